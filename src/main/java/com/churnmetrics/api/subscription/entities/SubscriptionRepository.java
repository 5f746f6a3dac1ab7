package com.churnmetrics.api.subscription.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Subscription} entity.
 */
@Repository
public interface SubscriptionRepository extends CrudRepository<Subscription, Long> {

    /**
     * Retrieves all subscriptions of the given products that overlap the half-open interval
     * {@code [from, until)}, i.e. that were created before {@code until} and were either still
     * active or deactivated on or after {@code from}.
     *
     * @param productIds a non-empty collection of product ids.
     * @param from       inclusive lower bound of the interval.
     * @param until      exclusive upper bound of the interval.
     * @return a guaranteed to be not {@literal null} list of {@link Subscription} instances.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.product.id in ?1 and e.createdAt < ?3 and " +
        "(e.deactivatedAt is null or e.deactivatedAt >= ?2)")
    List<Subscription> findAllOverlapping(
        @NonNull Collection<Long> productIds,
        @NonNull OffsetDateTime from,
        @NonNull OffsetDateTime until);

    /**
     * @param accountId id of the account that owns the subscribed products.
     * @return the number of subscriptions ever created for the products of the given account.
     */
    @Transactional(readOnly = true)
    @Query("select count(e) from Subscription e where e.product.accountId = ?1")
    long countByAccountId(@NonNull Long accountId);
}
