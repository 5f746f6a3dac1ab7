package com.churnmetrics.api.churn.source;

import com.churnmetrics.api.churn.DayCounts;
import com.churnmetrics.api.churn.SubscriptionClassifier;
import com.churnmetrics.api.subscription.entities.SubscriptionRepository;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;

import java.time.LocalDate;
import java.util.HashMap;

/**
 * {@link ChurnDataSource} that loads every subscription overlapping the span with a single query
 * and classifies them in memory.
 */
@Slf4j
public class RelationalScanSource implements ChurnDataSource {

    private final SubscriptionRepository subscriptionRepository;

    public RelationalScanSource(@NonNull SubscriptionRepository subscriptionRepository) {
        this.subscriptionRepository = subscriptionRepository;
    }

    @NonNull
    @Override
    public DailyChurnCounts fetch(@NonNull ChurnQuery query, @NonNull LocalDate from, @NonNull LocalDate to) {
        val zone = query.getZone();
        val subscriptions = subscriptionRepository.findAllOverlapping(
            query.getProductIds(),
            SubscriptionClassifier.startOfDay(from, zone),
            SubscriptionClassifier.startOfDay(to.plusDays(1), zone));

        log.debug("scanned {} subscriptions of account {} from {} to {}", subscriptions.size(), query.getAccountId(), from, to);
        long activeAtStart = 0;
        val days = new HashMap<LocalDate, DayCounts>();
        for (val subscription : subscriptions) {
            if (SubscriptionClassifier.isActiveAtStart(subscription, from, zone)) {
                activeAtStart++;
            }

            if (SubscriptionClassifier.isNewDuring(subscription, from, to, zone)) {
                DayCounts day = days.computeIfAbsent(SubscriptionClassifier.dayOf(subscription.getCreatedAt(), zone), d -> DayCounts.zero());
                day.setNewSubscribers(day.getNewSubscribers() + 1);
            }

            if (SubscriptionClassifier.isChurnedDuring(subscription, from, to, zone)) {
                DayCounts day = days.computeIfAbsent(SubscriptionClassifier.dayOf(subscription.getDeactivatedAt(), zone), d -> DayCounts.zero());
                day.setChurnedSubscribers(day.getChurnedSubscribers() + 1);
                day.setChurnedMrrCents(day.getChurnedMrrCents() + SubscriptionClassifier.monthlyRecurringRevenue(subscription));
            }
        }

        return new DailyChurnCounts(from, to, activeAtStart, days);
    }
}
