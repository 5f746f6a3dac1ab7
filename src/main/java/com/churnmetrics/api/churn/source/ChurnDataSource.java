package com.churnmetrics.api.churn.source;

import lombok.NonNull;

import java.time.LocalDate;

/**
 * Retrieves raw daily churn counts for the subscriptions of a {@link ChurnQuery}. All
 * implementations must produce identical counts for the same data.
 */
public interface ChurnDataSource {

    /**
     * @param query identifies the products and the timezone of calendar days.
     * @param from  first day of the span.
     * @param to    last day of the span, not before {@code from}.
     * @return counts of new and churned subscriptions by day, along with the number of
     * subscriptions active at the start of {@code from}.
     * @throws org.springframework.dao.DataAccessException if the underlying store fails.
     */
    @NonNull
    DailyChurnCounts fetch(@NonNull ChurnQuery query, @NonNull LocalDate from, @NonNull LocalDate to);
}
