package com.churnmetrics.api.subscription.entities;

import lombok.Getter;
import lombok.NonNull;

import java.util.Optional;

/**
 * Billing cycles supported by subscription prices, with the number of months each cycle spans.
 */
public enum RecurrenceUnit {
    MONTHLY("monthly", 1),
    QUARTERLY("quarterly", 3),
    YEARLY("yearly", 12);

    @Getter
    private final String value;

    @Getter
    private final int months;

    RecurrenceUnit(String value, int months) {
        this.value = value;
        this.months = months;
    }

    /**
     * Normalises a price charged once per billing cycle to its monthly equivalent, rounding the
     * quotient half-up to the nearest cent.
     *
     * @param priceCents price charged per billing cycle in minor currency units.
     * @return the monthly-equivalent price in minor currency units.
     */
    public long toMonthlyCents(long priceCents) {
        if (months == 1) {
            return priceCents;
        }

        return Math.round(priceCents / (double) months);
    }

    /**
     * @param value the stored recurrence value, e.g. {@code monthly}.
     * @return the matching {@link RecurrenceUnit}, or {@link Optional#empty()} if the value isn't
     * recognised.
     */
    @NonNull
    public static Optional<RecurrenceUnit> fromValue(String value) {
        for (RecurrenceUnit unit : values()) {
            if (unit.value.equalsIgnoreCase(value)) {
                return Optional.of(unit);
            }
        }

        return Optional.empty();
    }
}
