package com.churnmetrics.api.account.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Account} entity.
 */
@Repository
public interface AccountRepository extends CrudRepository<Account, Long> {

    /**
     * Marks the account with the given {@code id} as large, unless it is already large.
     *
     * @param id        id of the account.
     * @param timestamp the promotion timestamp.
     * @return the number of updated rows, {@literal 0} if the account was already large.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update Account e set e.largeSince = ?2 where e.id = ?1 and e.largeSince is null")
    int markLarge(@NonNull Long id, @NonNull OffsetDateTime timestamp);
}
