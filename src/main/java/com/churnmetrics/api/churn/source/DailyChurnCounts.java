package com.churnmetrics.api.churn.source;

import com.churnmetrics.api.churn.DayCounts;
import lombok.Data;
import lombok.NonNull;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Raw churn counts of a contiguous span of calendar days, as returned by a {@link
 * ChurnDataSource}. Days without events may be absent from {@code days}.
 */
@Data
public class DailyChurnCounts {

    @NonNull
    private final LocalDate from;

    @NonNull
    private final LocalDate to;

    /**
     * Number of subscriptions active at the first instant of {@code from}.
     */
    private final long activeAtStart;

    /**
     * Event counts by day. The {@link DayCounts#getActiveAtStart()} of the values is not set.
     */
    @NonNull
    private final Map<LocalDate, DayCounts> days;

    /**
     * @return a copy of {@code days} where the first day also carries {@link #getActiveAtStart()},
     * suitable as input to the daily series builder.
     */
    @NonNull
    public Map<LocalDate, DayCounts> toDayCountsByDate() {
        Map<LocalDate, DayCounts> result = new HashMap<>(days);
        result.put(from, days.getOrDefault(from, DayCounts.zero()).toBuilder()
            .activeAtStart(activeAtStart)
            .build());

        return result;
    }
}
