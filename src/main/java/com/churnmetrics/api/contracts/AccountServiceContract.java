package com.churnmetrics.api.contracts;

import lombok.NonNull;

import java.time.ZoneId;
import java.util.Optional;

/**
 * Defines a service contract for account service to provide account attributes to the churn
 * analytics service.
 */
public interface AccountServiceContract {

    /**
     * @param accountId id of an account.
     * @return a non-null {@link Optional}<{@link ZoneId}>, with the timezone that anchors calendar
     * days for the given {@code accountId} if the account exists.
     */
    @NonNull
    Optional<ZoneId> findTimeZone(@NonNull Long accountId);

    /**
     * @param accountId id of an account.
     * @return {@code true} if the account with given {@code accountId} is flagged as a large
     * account, {@code false} otherwise.
     */
    boolean isLargeAccount(@NonNull Long accountId);

    /**
     * Promotes the account with the given {@code accountId} to a large account if its subscriber
     * volume warrants it. Large accounts are eligible for day-level caching of analytics results.
     *
     * @param accountId id of an account.
     */
    void markLargeIfWarranted(@NonNull Long accountId);
}
