package com.churnmetrics.api.churn.cache;

import com.churnmetrics.api.churn.ChurnConfiguration;
import com.churnmetrics.api.churn.ChurnFixtures;
import com.churnmetrics.api.churn.DailySeriesBuilder;
import com.churnmetrics.api.churn.DayCounts;
import com.churnmetrics.api.churn.source.ChurnQuery;
import com.churnmetrics.api.churn.source.IndexAggregationSource;
import com.churnmetrics.api.churn.source.InMemorySubscriptionIndex;
import com.churnmetrics.api.contracts.AccountServiceContract;
import com.churnmetrics.api.subscription.entities.Subscription;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.churnmetrics.api.churn.ChurnFixtures.monthly;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ChurnDayCacheTest {

    private static final ZoneId ZONE = ZoneOffset.UTC;
    private static final LocalDate TODAY = LocalDate.of(2025, 9, 15);

    @Mock
    private ComputedChurnDayRepository repository;

    @Mock
    private AccountServiceContract accountServiceContract;

    private Map<String, String> store;
    private List<Subscription> subscriptions;
    private InMemorySubscriptionIndex index;
    private ChurnCacheVersion cacheVersion;
    private ChurnQuery query;
    private ChurnDayCache cache;

    @BeforeEach
    void setUp() {
        val product = ChurnFixtures.product(9, 1, "test");
        subscriptions = List.of(
            monthly(1, product, "2025-08-01T00:00:00Z", null),
            monthly(2, product, "2025-08-02T00:00:00Z", "2025-09-03T10:00:00Z"),
            monthly(3, product, "2025-09-02T10:00:00Z", null),
            monthly(4, product, "2025-09-05T10:00:00Z", "2025-09-09T10:00:00Z"),
            monthly(5, product, "2025-09-08T10:00:00Z", "2025-09-14T10:00:00Z"),
            monthly(6, product, "2025-09-13T10:00:00Z", "2025-09-15T10:00:00Z"));

        index = new InMemorySubscriptionIndex(subscriptions);

        store = new HashMap<>();
        lenient().when(repository.findAllByCacheKeyIn(any())).thenAnswer(invocation -> {
            Collection<String> keys = invocation.getArgument(0);
            List<ComputedChurnDay> entries = new ArrayList<>();
            for (Map.Entry<String, String> entry : store.entrySet()) {
                if (keys.contains(entry.getKey())) {
                    entries.add(new ComputedChurnDay(entry.getKey(), entry.getValue(), OffsetDateTime.now()));
                }
            }

            return entries;
        });

        lenient().when(repository.upsert(any(), any(), any())).thenAnswer(invocation -> {
            store.put(invocation.getArgument(0), invocation.getArgument(1));
            return 1;
        });

        lenient().when(accountServiceContract.isLargeAccount(anyLong())).thenReturn(true);

        val config = new ChurnConfiguration(ChurnConfiguration.DataSourceType.INDEX, 2, 1, Period.ofMonths(1));
        cacheVersion = new ChurnCacheVersion(1);
        query = ChurnQuery.of(1, ZONE, List.of(9L));
        cache = new ChurnDayCache(
            config,
            new IndexAggregationSource(index),
            repository,
            cacheVersion,
            accountServiceContract,
            new DailySeriesBuilder(),
            new ObjectMapper(),
            Clock.fixed(Instant.parse("2025-09-15T12:00:00Z"), ZONE));
    }

    @Test
    void fetch_isIdempotentAcrossCacheMissAndHit() {
        val dates = datesBetween(LocalDate.of(2025, 9, 1), LocalDate.of(2025, 9, 10));
        val first = cache.fetch(query, dates);
        assertEquals(3, index.getQueryCount());
        assertEquals(10, store.size());

        val second = cache.fetch(query, dates);
        assertEquals(3, index.getQueryCount());
        verify(repository, times(10)).upsert(any(), any(), any());
        assertEquals(first, second);
        assertEquals(uncached(dates), second);
    }

    @Test
    void fetch_storesEachDaysOwnActiveCount() {
        cache.fetch(query, datesBetween(LocalDate.of(2025, 9, 1), LocalDate.of(2025, 9, 10)));

        // a later report starting mid-span must see the running balance of that day
        val dates = datesBetween(LocalDate.of(2025, 9, 6), LocalDate.of(2025, 9, 10));
        val counts = cache.fetch(query, dates);
        assertEquals(3, index.getQueryCount());
        assertEquals(3, counts.get(LocalDate.of(2025, 9, 6)).getActiveAtStart());
        assertEquals(uncached(dates), counts);
    }

    @Test
    void fetch_onlyComputesMissingDays() {
        cache.fetch(query, datesBetween(LocalDate.of(2025, 9, 1), LocalDate.of(2025, 9, 5)));
        verify(repository, times(5)).upsert(any(), any(), any());

        val dates = datesBetween(LocalDate.of(2025, 9, 1), LocalDate.of(2025, 9, 10));
        val counts = cache.fetch(query, dates);
        assertEquals(6, index.getQueryCount());
        verify(repository, times(10)).upsert(any(), any(), any());
        assertEquals(uncached(dates), counts);
    }

    @Test
    void fetch_neverCachesRecentDays() {
        val dates = datesBetween(LocalDate.of(2025, 9, 12), TODAY);
        val first = cache.fetch(query, dates);
        assertEquals(6, index.getQueryCount());
        assertEquals(2, store.size());
        assertTrue(store.keySet().stream().anyMatch(key -> key.endsWith("_for_2025-09-13")));
        assertFalse(store.keySet().stream().anyMatch(key -> key.endsWith("_for_2025-09-14")));
        assertFalse(store.keySet().stream().anyMatch(key -> key.endsWith("_for_2025-09-15")));

        val second = cache.fetch(query, dates);
        assertEquals(9, index.getQueryCount());
        assertEquals(first, second);
        assertEquals(uncached(dates), second);
    }

    @Test
    void fetch_bypassesCacheForRegularAccounts() {
        when(accountServiceContract.isLargeAccount(1L)).thenReturn(false);
        val dates = datesBetween(LocalDate.of(2025, 9, 1), LocalDate.of(2025, 9, 10));
        val counts = cache.fetch(query, dates);

        assertEquals(3, index.getQueryCount());
        assertEquals(uncached(dates), counts);
        verifyNoInteractions(repository);
    }

    @Test
    void fetch_treatsUnreadableEntriesAsMisses() {
        val day = LocalDate.of(2025, 9, 3);
        val key = ChurnDayCache.buildKey(1, query, day);
        store.put(key, "{not json");

        val counts = cache.fetch(query, List.of(day));
        assertEquals(3, index.getQueryCount());
        assertEquals(uncached(List.of(day)), counts);
        verify(repository, times(1)).upsert(any(), any(), any());
        assertTrue(store.get(key).contains("churnedSubscribers"));
    }

    @Test
    void fetch_afterVersionBump() {
        val dates = datesBetween(LocalDate.of(2025, 9, 1), LocalDate.of(2025, 9, 3));
        cache.fetch(query, dates);
        cacheVersion.bump();
        cache.fetch(query, dates);

        assertEquals(6, index.getQueryCount());
        assertEquals(6, store.size());
        assertTrue(store.keySet().stream().allMatch(key -> key.startsWith("churn_v1_") || key.startsWith("churn_v2_")));
    }

    @Test
    void fetch_withoutDates() {
        assertTrue(cache.fetch(query, List.of()).isEmpty());
        verify(repository, never()).findAllByCacheKeyIn(any());
    }

    @Test
    void buildKey() {
        val multiProductQuery = ChurnQuery.of(42, ZoneId.of("America/Los_Angeles"), List.of(7L, 3L));
        assertEquals(
            "churn_v3_account_42_America/Los_Angeles_products_3-7_for_2023-12-01",
            ChurnDayCache.buildKey(3, multiProductQuery, LocalDate.of(2023, 12, 1)));
    }

    /**
     * Computes the expected counts straight from the data, without touching the cache.
     */
    @NonNull
    private Map<LocalDate, DayCounts> uncached(@NonNull List<LocalDate> dates) {
        val counts = new IndexAggregationSource(new InMemorySubscriptionIndex(subscriptions))
            .fetch(query, dates.get(0), dates.get(dates.size() - 1));

        val expected = new HashMap<LocalDate, DayCounts>();
        for (val bucket : new DailySeriesBuilder().build(dates, counts.toDayCountsByDate())) {
            expected.put(bucket.getDate(), bucket.toDayCounts());
        }

        return expected;
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
