package com.churnmetrics.api.churn;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.time.LocalDate;

/**
 * Aggregated churn metrics of a single calendar day within a reporting period.
 */
@Data
@Builder
public class DailyBucket {

    @NonNull
    private final LocalDate date;

    /**
     * The running active balance carried into this day.
     */
    private final long activeAtStart;

    private final long newSubscribers;

    private final long churnedSubscribers;

    private final long churnedMrrCents;

    private final double customerChurnRate;

    /**
     * @return the raw components of this bucket, without its derived churn rate.
     */
    @NonNull
    public DayCounts toDayCounts() {
        return new DayCounts(activeAtStart, newSubscribers, churnedSubscribers, churnedMrrCents);
    }
}
