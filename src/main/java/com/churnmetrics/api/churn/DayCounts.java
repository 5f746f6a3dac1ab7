package com.churnmetrics.api.churn;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw churn counts of a single calendar day. These are the only per-day values that are cached;
 * churn rates are always derived from them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DayCounts {

    /**
     * Subscriptions active at the first instant of the day.
     */
    private long activeAtStart;

    private long newSubscribers;

    private long churnedSubscribers;

    private long churnedMrrCents;

    public static DayCounts zero() {
        return new DayCounts();
    }
}
