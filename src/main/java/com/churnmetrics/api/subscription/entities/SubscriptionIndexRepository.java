package com.churnmetrics.api.subscription.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

/**
 * <p>
 * Aggregation queries over the subscription index. Unlike {@link SubscriptionRepository}, these
 * queries never return subscription rows. They push bucketing and counting to the store and
 * return a bounded number of aggregated rows, at most one per calendar day in the queried
 * interval.</p>
 *
 * <p>
 * Day buckets are computed in the given IANA timezone, so that a subscription deactivated at
 * {@code 2025-09-15T00:30-07:00} falls into the {@code 2025-09-15} bucket for an account in
 * {@code America/Los_Angeles}. Days without events are absent from the histograms.</p>
 */
@Repository
public interface SubscriptionIndexRepository extends org.springframework.data.repository.Repository<Subscription, Long> {

    String MONTHLY_RECURRING_REVENUE_EXPRESSION = "case lower(s.recurrence) " +
        "when 'monthly' then s.recurring_price_cents " +
        "when 'quarterly' then round(s.recurring_price_cents / 3.0) " +
        "when 'yearly' then round(s.recurring_price_cents / 12.0) " +
        "else 0 end";

    /**
     * Buckets subscriptions deactivated within {@code [from, until)} by the calendar day of their
     * deactivation.
     *
     * @param productIds a non-empty collection of product ids.
     * @param zone       IANA timezone id used for day bucketing.
     * @param from       inclusive lower bound.
     * @param until      exclusive upper bound.
     * @return one {@link DayBucket} per day with at least one churn event, with the distinct
     * number of churned subscriptions and their summed monthly recurring revenue.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query(nativeQuery = true, value = "select to_char(s.deactivated_at at time zone :zone, 'YYYY-MM-DD') as day, " +
        "count(distinct s.id) as subscribers, " +
        "cast(coalesce(sum(" + MONTHLY_RECURRING_REVENUE_EXPRESSION + "), 0) as bigint) as mrr " +
        "from subscription s " +
        "where s.product_id in (:productIds) and s.deactivated_at >= :from and s.deactivated_at < :until " +
        "group by 1 order by 1")
    List<DayBucket> findChurnHistogram(
        @NonNull @Param("productIds") Collection<Long> productIds,
        @NonNull @Param("zone") String zone,
        @NonNull @Param("from") OffsetDateTime from,
        @NonNull @Param("until") OffsetDateTime until);

    /**
     * Buckets subscriptions created within {@code [from, until)} by the calendar day of their
     * creation.
     *
     * @param productIds a non-empty collection of product ids.
     * @param zone       IANA timezone id used for day bucketing.
     * @param from       inclusive lower bound.
     * @param until      exclusive upper bound.
     * @return one {@link DayBucket} per day with at least one new subscription. {@link
     * DayBucket#getMrr()} is always {@literal 0}.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query(nativeQuery = true, value = "select to_char(s.created_at at time zone :zone, 'YYYY-MM-DD') as day, " +
        "count(distinct s.id) as subscribers, " +
        "cast(0 as bigint) as mrr " +
        "from subscription s " +
        "where s.product_id in (:productIds) and s.created_at >= :from and s.created_at < :until " +
        "group by 1 order by 1")
    List<DayBucket> findNewSubscriptionHistogram(
        @NonNull @Param("productIds") Collection<Long> productIds,
        @NonNull @Param("zone") String zone,
        @NonNull @Param("from") OffsetDateTime from,
        @NonNull @Param("until") OffsetDateTime until);

    /**
     * Counts distinct subscriptions that were created before the given instant and were not
     * deactivated before it.
     *
     * @param productIds a non-empty collection of product ids.
     * @param at         the point in time, usually the start of a calendar day.
     * @return the number of subscriptions active at {@code at}.
     */
    @Transactional(readOnly = true)
    @Query(nativeQuery = true, value = "select count(distinct s.id) from subscription s " +
        "where s.product_id in (:productIds) and s.created_at < :at " +
        "and (s.deactivated_at is null or s.deactivated_at >= :at)")
    long countActiveAt(
        @NonNull @Param("productIds") Collection<Long> productIds,
        @NonNull @Param("at") OffsetDateTime at);

    /**
     * A single day bucket of a histogram aggregation.
     */
    interface DayBucket {

        /**
         * @return the bucket's calendar day in {@code yyyy-MM-dd} format.
         */
        String getDay();

        long getSubscribers();

        long getMrr();
    }
}
