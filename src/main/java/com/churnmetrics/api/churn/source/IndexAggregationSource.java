package com.churnmetrics.api.churn.source;

import com.churnmetrics.api.churn.DayCounts;
import com.churnmetrics.api.churn.SubscriptionClassifier;
import com.churnmetrics.api.subscription.entities.SubscriptionIndexRepository;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;

/**
 * <p>
 * {@link ChurnDataSource} that pushes day bucketing and counting to the store. Each fetch issues
 * exactly three aggregation queries, regardless of the span's length:</p>
 *
 * <ol>
 *     <li>a day histogram of churn events with their summed monthly recurring revenue;</li>
 *     <li>a day histogram of new subscriptions;</li>
 *     <li>a count of subscriptions active at the start of the span.</li>
 * </ol>
 */
@Slf4j
public class IndexAggregationSource implements ChurnDataSource {

    private final SubscriptionIndexRepository indexRepository;

    public IndexAggregationSource(@NonNull SubscriptionIndexRepository indexRepository) {
        this.indexRepository = indexRepository;
    }

    @NonNull
    @Override
    public DailyChurnCounts fetch(@NonNull ChurnQuery query, @NonNull LocalDate from, @NonNull LocalDate to) {
        val zone = query.getZone();
        val productIds = query.getProductIds();
        val lower = SubscriptionClassifier.startOfDay(from, zone);
        val upper = SubscriptionClassifier.startOfDay(to.plusDays(1), zone);
        val storeZone = storeTimeZone(zone);

        val days = new HashMap<LocalDate, DayCounts>();
        for (val bucket : indexRepository.findChurnHistogram(productIds, storeZone, lower, upper)) {
            DayCounts day = days.computeIfAbsent(LocalDate.parse(bucket.getDay()), d -> DayCounts.zero());
            day.setChurnedSubscribers(bucket.getSubscribers());
            day.setChurnedMrrCents(bucket.getMrr());
        }

        for (val bucket : indexRepository.findNewSubscriptionHistogram(productIds, storeZone, lower, upper)) {
            DayCounts day = days.computeIfAbsent(LocalDate.parse(bucket.getDay()), d -> DayCounts.zero());
            day.setNewSubscribers(bucket.getSubscribers());
        }

        val activeAtStart = indexRepository.countActiveAt(productIds, lower);
        log.debug("aggregated {} event days of account {} from {} to {}", days.size(), query.getAccountId(), from, to);
        return new DailyChurnCounts(from, to, activeAtStart, days);
    }

    /**
     * <p>
     * Translates a zone into a timezone name that the store buckets days with. Region ids are
     * passed as is. The store reads a bare offset such as {@code +05:30} as a POSIX zone, where
     * positive offsets lie west of Greenwich, so fixed offsets are written as POSIX names with
     * the sign inverted, e.g. {@code UTC-05:30} for {@code +05:30}.</p>
     *
     * @param zone the account's timezone.
     * @return the timezone name to use in day bucketing queries.
     */
    @NonNull
    static String storeTimeZone(@NonNull ZoneId zone) {
        val normalized = zone.normalized();
        if (!(normalized instanceof ZoneOffset)) {
            return zone.getId();
        }

        val offsetSeconds = ((ZoneOffset) normalized).getTotalSeconds();
        if (offsetSeconds == 0) {
            return "UTC";
        }

        return "UTC" + ZoneOffset.ofTotalSeconds(-offsetSeconds).getId();
    }
}
