package com.churnmetrics.api.churn.source;

import lombok.Data;
import lombok.NonNull;

import java.time.ZoneId;
import java.util.List;

/**
 * Identifies the subscriptions a churn report covers: the products of an account, with calendar
 * days anchored to the account's timezone.
 */
@Data
public class ChurnQuery {

    private final long accountId;

    @NonNull
    private final ZoneId zone;

    /**
     * Sorted, distinct and non-empty list of product ids.
     */
    @NonNull
    private final List<Long> productIds;

    /**
     * @return a new query with sorted and de-duplicated {@code productIds}.
     * @throws IllegalArgumentException if {@code productIds} is empty.
     */
    @NonNull
    public static ChurnQuery of(long accountId, @NonNull ZoneId zone, @NonNull List<Long> productIds) {
        if (productIds.isEmpty()) {
            throw new IllegalArgumentException("churn query requires at least one product");
        }

        return new ChurnQuery(accountId, zone, productIds.stream().distinct().sorted().toList());
    }
}
