package com.churnmetrics.api.churn;

import com.churnmetrics.api.account.exceptions.AccountNotFoundException;
import com.churnmetrics.api.churn.cache.ChurnDayCache;
import com.churnmetrics.api.churn.exceptions.InvalidDateFormatException;
import com.churnmetrics.api.churn.exceptions.InvalidDateRangeException;
import com.churnmetrics.api.churn.payload.ChurnMetricsResponse;
import com.churnmetrics.api.churn.payload.ChurnProductsResponse;
import com.churnmetrics.api.churn.payload.ChurnReportResponse;
import com.churnmetrics.api.churn.payload.DailyChurnResponse;
import com.churnmetrics.api.churn.payload.ProductResponse;
import com.churnmetrics.api.churn.source.ChurnQuery;
import com.churnmetrics.api.contracts.AccountServiceContract;
import com.churnmetrics.api.subscription.entities.ProductRepository;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * {@link ChurnService} computes subscriber churn reports of merchant accounts.
 */
@Service
@Slf4j
public class ChurnService {

    private static final DateTimeFormatter MONTH_LABEL_FORMAT = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

    private final ChurnConfiguration churnConfig;
    private final ProductRepository productRepository;
    private final AccountServiceContract accountServiceContract;
    private final ChurnDayCache dayCache;
    private final DailySeriesBuilder dailySeriesBuilder;
    private final PeriodAggregator periodAggregator;
    private final Clock clock;

    @Autowired
    public ChurnService(
        @NonNull ChurnConfiguration churnConfig,
        @NonNull ProductRepository productRepository,
        @NonNull AccountServiceContract accountServiceContract,
        @NonNull ChurnDayCache dayCache,
        @NonNull DailySeriesBuilder dailySeriesBuilder,
        @NonNull PeriodAggregator periodAggregator,
        @NonNull Clock clock
    ) {
        this.churnConfig = churnConfig;
        this.productRepository = productRepository;
        this.accountServiceContract = accountServiceContract;
        this.dayCache = dayCache;
        this.dailySeriesBuilder = dailySeriesBuilder;
        this.periodAggregator = periodAggregator;
        this.clock = clock;
    }

    /**
     * <p>
     * Computes the churn report of an account for the period resolved from {@code params}. See
     * {@link ChurnPeriod#resolve(ChurnParams, LocalDate, java.time.Period)} for the rules that
     * resolve the period.</p>
     *
     * <p>
     * The report contains the period's churn rate, the churn rate of the preceding period of the
     * same length, the churned subscriptions and their lost monthly recurring revenue, and the
     * same metrics for each day of the period.</p>
     *
     * @param accountId id of the account.
     * @param params    period and product filter.
     * @param strict    whether an invalid period fails with {@link InvalidDateRangeException}
     *                  instead of producing no report.
     * @return the report, or an empty {@link Optional} if the account has no matching subscription
     * products, whatever the period, or if the period is invalid and {@code strict} is {@literal
     * false}.
     * @throws AccountNotFoundException   if the account doesn't exist.
     * @throws InvalidDateFormatException if a date parameter can't be parsed.
     * @throws InvalidDateRangeException  if the period ends before it starts and {@code strict} is
     *                                    {@literal true}.
     */
    @NonNull
    public Optional<ChurnReportResponse> getChurnReport(
        long accountId,
        @NonNull ChurnParams params,
        boolean strict
    ) throws AccountNotFoundException, InvalidDateFormatException, InvalidDateRangeException {
        val zone = findTimeZone(accountId);
        val period = ChurnPeriod.resolve(params, LocalDate.now(clock.withZone(zone)), churnConfig.getDefaultRange());
        val query = buildQuery(accountId, zone, params.getProductIds());
        if (query.isEmpty()) {
            return Optional.empty();
        }

        if (!period.isValid()) {
            if (strict) {
                throw new InvalidDateRangeException(period.getStartDate(), period.getEndDate());
            }

            log.debug("skipping churn report of account {} for invalid period {}", accountId, period);
            return Optional.empty();
        }

        val buckets = computeDailyBuckets(query.get(), period);
        val metrics = periodAggregator.fromDailyBuckets(buckets);
        val previousMetrics = periodAggregator.fromDailyBuckets(computeDailyBuckets(query.get(), period.previousPeriod()));

        val startMonth = YearMonth.from(period.getStartDate());
        val dailyData = new ArrayList<DailyChurnResponse>(buckets.size());
        for (val bucket : buckets) {
            dailyData.add(
                DailyChurnResponse.builder()
                    .date(bucket.getDate())
                    .month(MONTH_LABEL_FORMAT.format(bucket.getDate()))
                    .monthIndex((int) ChronoUnit.MONTHS.between(startMonth, YearMonth.from(bucket.getDate())))
                    .customerChurnRate(bucket.getCustomerChurnRate())
                    .churnedSubscribers(bucket.getChurnedSubscribers())
                    .churnedMrrCents(bucket.getChurnedMrrCents())
                    .activeAtStart(bucket.getActiveAtStart())
                    .newSubscribers(bucket.getNewSubscribers())
                    .build());
        }

        return Optional.of(
            ChurnReportResponse.builder()
                .startDate(period.getStartDate())
                .endDate(period.getEndDate())
                .metrics(
                    ChurnMetricsResponse.builder()
                        .customerChurnRate(metrics.getChurnRate())
                        .lastPeriodChurnRate(previousMetrics.getChurnRate())
                        .churnedSubscribers(metrics.getChurnedSubscribers())
                        .churnedMrrCents(metrics.getChurnedMrrCents())
                        .build())
                .dailyData(dailyData)
                .build());
    }

    /**
     * Computes only the churn rate of an account over the given period.
     *
     * @param accountId  id of the account.
     * @param startDate  first day of the period.
     * @param endDate    last day of the period.
     * @param productIds optional product filter; {@literal null} or empty includes all
     *                   subscription products.
     * @return the churn rate, {@literal 0.0} if the account has no matching subscription products.
     * @throws AccountNotFoundException  if the account doesn't exist.
     * @throws InvalidDateRangeException if the account has matching subscription products and the
     *                                   period ends before it starts.
     */
    public double getCustomerChurnRate(
        long accountId,
        @NonNull LocalDate startDate,
        @NonNull LocalDate endDate,
        List<Long> productIds
    ) throws AccountNotFoundException, InvalidDateRangeException {
        val query = buildQuery(accountId, findTimeZone(accountId), productIds);
        if (query.isEmpty()) {
            return 0.0;
        }

        val period = new ChurnPeriod(startDate, endDate);
        period.requireValid();

        return periodAggregator.fromDailyBuckets(computeDailyBuckets(query.get(), period)).getChurnRate();
    }

    /**
     * @return whether the account owns at least one alive subscription product.
     */
    public boolean hasSubscriptionProducts(long accountId) {
        return productRepository.existsSubscriptionProductByAccountId(accountId);
    }

    /**
     * Lists all recurring products of the account that a churn report can be filtered by,
     * including deleted products.
     *
     * @throws AccountNotFoundException if the account doesn't exist.
     */
    @NonNull
    public ChurnProductsResponse listAvailableProducts(long accountId) throws AccountNotFoundException {
        findTimeZone(accountId);
        val products = new ArrayList<ProductResponse>();
        for (val product : productRepository.findAllRecurringIncludingDeletedByAccountId(accountId)) {
            products.add(
                ProductResponse.builder()
                    .id(product.getId())
                    .name(product.getName())
                    .alive(product.isAlive())
                    .build());
        }

        return ChurnProductsResponse.builder()
            .hasSubscriptionProducts(hasSubscriptionProducts(accountId))
            .products(products)
            .build();
    }

    @NonNull
    private ZoneId findTimeZone(long accountId) throws AccountNotFoundException {
        return accountServiceContract.findTimeZone(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * Restricts the account's alive subscription products to {@code filter}, unless it is empty.
     */
    @NonNull
    private Optional<ChurnQuery> buildQuery(long accountId, @NonNull ZoneId zone, List<Long> filter) {
        val productIds = new ArrayList<Long>();
        Set<Long> allowed = filter == null ? Set.of() : new HashSet<>(filter);
        for (val product : productRepository.findAllSubscriptionProductsByAccountId(accountId)) {
            if (allowed.isEmpty() || allowed.contains(product.getId())) {
                productIds.add(product.getId());
            }
        }

        if (productIds.isEmpty()) {
            log.debug("account {} has no subscription products matching {}", accountId, filter);
            return Optional.empty();
        }

        return Optional.of(ChurnQuery.of(accountId, zone, productIds));
    }

    @NonNull
    private List<DailyBucket> computeDailyBuckets(@NonNull ChurnQuery query, @NonNull ChurnPeriod period) {
        val dates = period.dates();
        return dailySeriesBuilder.build(dates, dayCache.fetch(query, dates));
    }
}
