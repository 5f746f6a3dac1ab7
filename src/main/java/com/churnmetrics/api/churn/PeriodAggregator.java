package com.churnmetrics.api.churn;

import com.churnmetrics.api.subscription.entities.Subscription;
import lombok.NonNull;
import lombok.val;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Folds subscriptions or daily buckets into {@link PeriodMetrics}.
 */
@Component
public class PeriodAggregator {

    /**
     * Classifies each subscription against the whole period in one pass.
     *
     * @param subscriptions subscriptions of the reported products.
     * @param from          first day of the period.
     * @param to            last day of the period.
     * @param zone          timezone anchoring the calendar days.
     * @return period totals counted directly from the subscriptions.
     */
    @NonNull
    public PeriodMetrics aggregate(
        @NonNull Iterable<Subscription> subscriptions,
        @NonNull LocalDate from,
        @NonNull LocalDate to,
        @NonNull ZoneId zone
    ) {
        long active = 0, created = 0, churned = 0, churnedMrrCents = 0;
        for (val subscription : subscriptions) {
            if (SubscriptionClassifier.isActiveAtStart(subscription, from, zone)) {
                active++;
            }

            if (SubscriptionClassifier.isNewDuring(subscription, from, to, zone)) {
                created++;
            }

            if (SubscriptionClassifier.isChurnedDuring(subscription, from, to, zone)) {
                churned++;
                churnedMrrCents += SubscriptionClassifier.monthlyRecurringRevenue(subscription);
            }
        }

        return PeriodMetrics.builder()
            .activeAtStart(active)
            .newSubscribers(created)
            .churnedSubscribers(churned)
            .churnedMrrCents(churnedMrrCents)
            .build();
    }

    /**
     * Reconstructs the period totals from its chronologically ordered daily buckets. The active
     * count is taken from the first day, all other counts are summed over the days.
     *
     * @param buckets daily buckets of the period, first day first.
     * @return period totals, all zero if {@code buckets} is empty.
     */
    @NonNull
    public PeriodMetrics fromDailyBuckets(@NonNull List<DailyBucket> buckets) {
        long created = 0, churned = 0, churnedMrrCents = 0;
        for (val bucket : buckets) {
            created += bucket.getNewSubscribers();
            churned += bucket.getChurnedSubscribers();
            churnedMrrCents += bucket.getChurnedMrrCents();
        }

        return PeriodMetrics.builder()
            .activeAtStart(buckets.isEmpty() ? 0 : buckets.get(0).getActiveAtStart())
            .newSubscribers(created)
            .churnedSubscribers(churned)
            .churnedMrrCents(churnedMrrCents)
            .build();
    }
}
