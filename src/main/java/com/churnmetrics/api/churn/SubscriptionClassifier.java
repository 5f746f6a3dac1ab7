package com.churnmetrics.api.churn;

import com.churnmetrics.api.subscription.entities.RecurrenceUnit;
import com.churnmetrics.api.subscription.entities.Subscription;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * <p>
 * Stateless predicates that place a {@link Subscription} relative to calendar days of an account's
 * timezone.</p>
 *
 * <p>
 * A day spans from its first instant through its last instant, both inclusive, which is
 * implemented as the half-open interval {@code [startOfDay(day), startOfDay(day + 1))}. A
 * subscription created on a given day is new on that day and only counts as active at the start
 * of the following days.</p>
 */
@Slf4j
public final class SubscriptionClassifier {

    private SubscriptionClassifier() {
    }

    /**
     * @return the first instant of {@code date} in {@code zone}.
     */
    @NonNull
    public static OffsetDateTime startOfDay(@NonNull LocalDate date, @NonNull ZoneId zone) {
        return date.atStartOfDay(zone).toOffsetDateTime();
    }

    /**
     * @return the calendar day of {@code instant} in {@code zone}.
     */
    @NonNull
    public static LocalDate dayOf(@NonNull OffsetDateTime instant, @NonNull ZoneId zone) {
        return instant.atZoneSameInstant(zone).toLocalDate();
    }

    /**
     * A subscription is active at the start of {@code date} if it was created strictly before the
     * day began and had not ended before it.
     */
    public static boolean isActiveAtStart(@NonNull Subscription subscription, @NonNull LocalDate date, @NonNull ZoneId zone) {
        val dayStart = startOfDay(date, zone);
        val deactivatedAt = subscription.getDeactivatedAt();
        return subscription.getCreatedAt().isBefore(dayStart)
            && (deactivatedAt == null || !deactivatedAt.isBefore(dayStart));
    }

    /**
     * @return whether the subscription was created between the start of {@code from} and the end of
     * {@code to}.
     */
    public static boolean isNewDuring(
        @NonNull Subscription subscription,
        @NonNull LocalDate from,
        @NonNull LocalDate to,
        @NonNull ZoneId zone
    ) {
        return isWithin(subscription.getCreatedAt(), from, to, zone);
    }

    /**
     * @return whether the subscription was deactivated between the start of {@code from} and the
     * end of {@code to}.
     */
    public static boolean isChurnedDuring(
        @NonNull Subscription subscription,
        @NonNull LocalDate from,
        @NonNull LocalDate to,
        @NonNull ZoneId zone
    ) {
        val deactivatedAt = subscription.getDeactivatedAt();
        return deactivatedAt != null && isWithin(deactivatedAt, from, to, zone);
    }

    /**
     * Normalises the subscription's recurring price to a monthly-equivalent amount. Prices with an
     * unrecognised recurrence contribute nothing.
     *
     * @return monthly recurring revenue in minor currency units.
     */
    public static long monthlyRecurringRevenue(@NonNull Subscription subscription) {
        val unit = RecurrenceUnit.fromValue(subscription.getRecurrence());
        if (unit.isEmpty()) {
            log.debug("unknown recurrence '{}' of subscription {}", subscription.getRecurrence(), subscription.getId());
            return 0;
        }

        return unit.get().toMonthlyCents(subscription.getRecurringPriceCents());
    }

    private static boolean isWithin(OffsetDateTime instant, LocalDate from, LocalDate to, ZoneId zone) {
        return !instant.isBefore(startOfDay(from, zone)) && instant.isBefore(startOfDay(to.plusDays(1), zone));
    }
}
