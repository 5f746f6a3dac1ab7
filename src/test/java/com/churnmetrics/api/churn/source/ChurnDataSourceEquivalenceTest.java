package com.churnmetrics.api.churn.source;

import com.churnmetrics.api.churn.ChurnFixtures;
import com.churnmetrics.api.churn.DailySeriesBuilder;
import com.churnmetrics.api.churn.PeriodAggregator;
import com.churnmetrics.api.subscription.entities.Subscription;
import com.churnmetrics.api.subscription.entities.SubscriptionRepository;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Both data sources must produce identical counts for the same subscriptions.
 */
@ExtendWith(MockitoExtension.class)
public class ChurnDataSourceEquivalenceTest {

    private static final String[] RECURRENCES = {"monthly", "quarterly", "yearly", "weekly"};

    @Mock
    private SubscriptionRepository subscriptionRepository;

    private List<Subscription> subscriptions;

    @BeforeEach
    void setUp() {
        val random = new Random(20231201);
        val product = ChurnFixtures.product(1, 1, "first");
        val otherProduct = ChurnFixtures.product(2, 1, "second");
        val epoch = OffsetDateTime.parse("2025-05-01T00:00:00Z");

        subscriptions = new ArrayList<>();
        for (int i = 0; i < 400; i++) {
            val createdAt = epoch.plusMinutes(random.nextInt(150 * 24 * 60));
            OffsetDateTime deactivatedAt = random.nextBoolean() ? createdAt.plusMinutes(random.nextInt(60 * 24 * 60)) : null;
            subscriptions.add(ChurnFixtures.subscription(
                i + 1,
                i % 4 == 0 ? otherProduct : product,
                createdAt.toString(),
                deactivatedAt == null ? null : deactivatedAt.toString(),
                500 + random.nextInt(20000),
                RECURRENCES[random.nextInt(RECURRENCES.length)]));
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"UTC", "America/Los_Angeles", "Asia/Kolkata", "Pacific/Auckland", "+05:30", "-03:30", "UTC+09:00"})
    void scanAndIndex_produceIdenticalCounts(String zoneId) {
        val zone = ZoneId.of(zoneId);
        val from = LocalDate.of(2025, 7, 1);
        val to = LocalDate.of(2025, 8, 31);
        val query = ChurnQuery.of(1, zone, List.of(1L));
        List<Subscription> ofProduct = subscriptions.stream().filter(s -> s.getProduct().getId() == 1L).toList();
        when(subscriptionRepository.findAllOverlapping(any(), any(), any())).thenReturn(ofProduct);

        val scanned = new RelationalScanSource(subscriptionRepository).fetch(query, from, to);
        val aggregated = new IndexAggregationSource(new InMemorySubscriptionIndex(subscriptions)).fetch(query, from, to);

        assertEquals(scanned.getActiveAtStart(), aggregated.getActiveAtStart());
        assertEquals(scanned.getDays(), aggregated.getDays());

        // and both agree with the direct classification of the whole period
        val dates = datesBetween(from, to);
        val buckets = new DailySeriesBuilder().build(dates, aggregated.toDayCountsByDate());
        val aggregator = new PeriodAggregator();
        assertEquals(aggregator.aggregate(ofProduct, from, to, zone), aggregator.fromDailyBuckets(buckets));
    }

    @NonNull
    private static List<LocalDate> datesBetween(@NonNull LocalDate from, @NonNull LocalDate to) {
        val dates = new ArrayList<LocalDate>();
        for (var date = from; !date.isAfter(to); date = date.plusDays(1)) {
            dates.add(date);
        }

        return dates;
    }
}
