package com.churnmetrics.api.churn;

import lombok.NonNull;
import lombok.val;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * <p>
 * Builds one {@link DailyBucket} per calendar day from raw {@link DayCounts}, carrying a running
 * active balance from day to day.</p>
 *
 * <p>
 * The balance starts at the first day's {@link DayCounts#getActiveAtStart()} and moves by {@code
 * new - churned} after each day, so that each day's churn rate is computed against the base that
 * actually existed on that day. The active counts of all days except the first are ignored.</p>
 */
@Component
public class DailySeriesBuilder {

    /**
     * @param dates        chronologically ordered calendar days.
     * @param countsByDate raw counts by day; missing days count as zero.
     * @return a bucket for each day in {@code dates}, in the same order.
     */
    @NonNull
    public List<DailyBucket> build(@NonNull List<LocalDate> dates, @NonNull Map<LocalDate, DayCounts> countsByDate) {
        val buckets = new ArrayList<DailyBucket>(dates.size());
        if (dates.isEmpty()) {
            return buckets;
        }

        var runningActive = countsByDate.getOrDefault(dates.get(0), DayCounts.zero()).getActiveAtStart();
        for (val date : dates) {
            val counts = countsByDate.getOrDefault(date, DayCounts.zero());
            val base = runningActive + counts.getNewSubscribers();
            buckets.add(
                DailyBucket.builder()
                    .date(date)
                    .activeAtStart(runningActive)
                    .newSubscribers(counts.getNewSubscribers())
                    .churnedSubscribers(counts.getChurnedSubscribers())
                    .churnedMrrCents(counts.getChurnedMrrCents())
                    .customerChurnRate(ChurnRates.churnRate(counts.getChurnedSubscribers(), base))
                    .build());

            runningActive = base - counts.getChurnedSubscribers();
        }

        return buckets;
    }
}
