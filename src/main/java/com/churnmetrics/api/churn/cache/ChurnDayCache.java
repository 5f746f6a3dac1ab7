package com.churnmetrics.api.churn.cache;

import com.churnmetrics.api.churn.ChurnConfiguration;
import com.churnmetrics.api.churn.DailySeriesBuilder;
import com.churnmetrics.api.churn.DayCounts;
import com.churnmetrics.api.churn.source.ChurnDataSource;
import com.churnmetrics.api.churn.source.ChurnQuery;
import com.churnmetrics.api.contracts.AccountServiceContract;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * <p>
 * Read-through, per-day cache of raw {@link DayCounts} in front of the {@link ChurnDataSource}.</p>
 *
 * <p>
 * Only large accounts use the cache. Days within the freshness horizon ({@link
 * ChurnConfiguration#getCacheHorizonDays()} most recent days, today included) are always fetched
 * live and never written. Every cached day stores its own active count, derived from the running
 * balance of the fetch that produced it, so a cached day is usable as the first day of any later
 * report.</p>
 */
@Component
@Slf4j
public class ChurnDayCache {

    private final ChurnConfiguration config;
    private final ChurnDataSource dataSource;
    private final ComputedChurnDayRepository repository;
    private final ChurnCacheVersion cacheVersion;
    private final AccountServiceContract accountServiceContract;
    private final DailySeriesBuilder dailySeriesBuilder;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public ChurnDayCache(
        @NonNull ChurnConfiguration config,
        @NonNull ChurnDataSource dataSource,
        @NonNull ComputedChurnDayRepository repository,
        @NonNull ChurnCacheVersion cacheVersion,
        @NonNull AccountServiceContract accountServiceContract,
        @NonNull DailySeriesBuilder dailySeriesBuilder,
        @NonNull ObjectMapper objectMapper,
        @NonNull Clock clock
    ) {
        this.config = config;
        this.dataSource = dataSource;
        this.repository = repository;
        this.cacheVersion = cacheVersion;
        this.accountServiceContract = accountServiceContract;
        this.dailySeriesBuilder = dailySeriesBuilder;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param query identifies the account, its timezone and the reported products.
     * @param dates chronologically ordered, contiguous calendar days.
     * @return counts for each of the given days, each with its own active-at-start count.
     * @throws org.springframework.dao.DataAccessException if the data source or the cache store
     *                                                     fails.
     */
    @NonNull
    public Map<LocalDate, DayCounts> fetch(@NonNull ChurnQuery query, @NonNull List<LocalDate> dates) {
        if (dates.isEmpty()) {
            return new HashMap<>();
        }

        if (!accountServiceContract.isLargeAccount(query.getAccountId())) {
            return fetchLive(query, dates);
        }

        val horizon = LocalDate.now(clock.withZone(query.getZone())).minusDays(config.getCacheHorizonDays());
        val cacheable = new ArrayList<LocalDate>();
        val live = new ArrayList<LocalDate>();
        for (val date : dates) {
            (date.isAfter(horizon) ? live : cacheable).add(date);
        }

        val result = new HashMap<LocalDate, DayCounts>();
        if (!cacheable.isEmpty()) {
            result.putAll(fetchCacheable(query, cacheable));
        }

        if (!live.isEmpty()) {
            result.putAll(fetchLive(query, live));
        }

        return result;
    }

    @NonNull
    private Map<LocalDate, DayCounts> fetchCacheable(@NonNull ChurnQuery query, @NonNull List<LocalDate> dates) {
        Map<String, LocalDate> keys = dates.stream()
            .collect(Collectors.toMap(date -> buildKey(cacheVersion.current(), query, date), date -> date));

        val result = new HashMap<LocalDate, DayCounts>();
        for (val entry : repository.findAllByCacheKeyIn(keys.keySet())) {
            val date = keys.get(entry.getCacheKey());
            try {
                result.put(date, objectMapper.readValue(entry.getData(), DayCounts.class));
            } catch (JsonProcessingException e) {
                log.warn("ignoring unreadable churn cache entry '{}'", entry.getCacheKey(), e);
            }
        }

        List<LocalDate> missing = dates.stream().filter(date -> !result.containsKey(date)).toList();
        log.debug("churn cache hits: {}, misses: {} for account {}", result.size(), missing.size(), query.getAccountId());
        if (missing.isEmpty()) {
            return result;
        }

        val fetched = fetchLive(query, missing.get(0), missing.get(missing.size() - 1));
        val now = OffsetDateTime.now(clock);
        for (val date : missing) {
            val counts = fetched.get(date);
            repository.upsert(buildKey(cacheVersion.current(), query, date), serialize(counts), now);
            result.put(date, counts);
        }

        return result;
    }

    @NonNull
    private Map<LocalDate, DayCounts> fetchLive(@NonNull ChurnQuery query, @NonNull List<LocalDate> dates) {
        return fetchLive(query, dates.get(0), dates.get(dates.size() - 1));
    }

    @NonNull
    private Map<LocalDate, DayCounts> fetchLive(@NonNull ChurnQuery query, @NonNull LocalDate from, @NonNull LocalDate to) {
        val span = new ArrayList<LocalDate>();
        for (var date = from; !date.isAfter(to); date = date.plusDays(1)) {
            span.add(date);
        }

        val counts = dataSource.fetch(query, from, to);
        val result = new HashMap<LocalDate, DayCounts>();
        for (val bucket : dailySeriesBuilder.build(span, counts.toDayCountsByDate())) {
            result.put(bucket.getDate(), bucket.toDayCounts());
        }

        return result;
    }

    @NonNull
    private String serialize(@NonNull DayCounts counts) {
        try {
            return objectMapper.writeValueAsString(counts);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("failed to serialise churn day counts", e);
        }
    }

    /**
     * @return the cache key of a single day, e.g. {@code
     * churn_v1_account_42_America/Los_Angeles_products_3-7_for_2023-12-01}.
     */
    @NonNull
    static String buildKey(long version, @NonNull ChurnQuery query, @NonNull LocalDate date) {
        return String.format(
            "churn_v%d_account_%d_%s_products_%s_for_%s",
            version,
            query.getAccountId(),
            query.getZone().getId(),
            query.getProductIds().stream().map(String::valueOf).collect(Collectors.joining("-")),
            date);
    }
}
