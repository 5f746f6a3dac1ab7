package com.churnmetrics.api.churn;

import lombok.Builder;
import lombok.Data;

/**
 * Churn metrics aggregated over a whole reporting period.
 */
@Data
@Builder
public class PeriodMetrics {

    private final long activeAtStart;

    private final long newSubscribers;

    private final long churnedSubscribers;

    private final long churnedMrrCents;

    /**
     * @return subscriptions that could have churned during the period, i.e. those active at its
     * start and those created during it.
     */
    public long getTotalBase() {
        return activeAtStart + newSubscribers;
    }

    public double getChurnRate() {
        return ChurnRates.churnRate(churnedSubscribers, getTotalBase());
    }
}
