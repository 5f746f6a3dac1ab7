package com.churnmetrics.api.subscription.entities;

import com.churnmetrics.api.platform.BasicEntityRepository;
import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Product} entity.
 */
@Repository
public interface ProductRepository extends BasicEntityRepository<Product, Long> {

    /**
     * Retrieves all alive products with recurring billing that belong to the given account.
     *
     * @param accountId id of the owner account.
     * @return a guaranteed to be not {@literal null} list of products ordered by their ids.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Product e where e.accountId = ?1 and e.isRecurringBilling = true and" +
        WHERE_ALIVE_CLAUSE + "order by e.id")
    List<Product> findAllSubscriptionProductsByAccountId(long accountId);

    /**
     * Checks whether the given account owns at least one alive product with recurring billing.
     *
     * @param accountId id of the owner account.
     * @return {@literal true} if such a product exists.
     */
    @Transactional(readOnly = true)
    @Query("select case when count(e) > 0 then true else false end from Product e where " +
        "e.accountId = ?1 and e.isRecurringBilling = true and" + WHERE_ALIVE_CLAUSE)
    boolean existsSubscriptionProductByAccountId(long accountId);

    /**
     * Retrieves all products with recurring billing, including deleted ones, that belong to the
     * given account. Deleted products are listed so that historical reports can still name them.
     *
     * @param accountId id of the owner account.
     * @return a guaranteed to be not {@literal null} list of products ordered by their ids.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Product e where e.accountId = ?1 and e.isRecurringBilling = true order by e.id")
    List<Product> findAllRecurringIncludingDeletedByAccountId(long accountId);
}
