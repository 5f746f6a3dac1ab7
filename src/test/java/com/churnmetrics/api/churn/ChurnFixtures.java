package com.churnmetrics.api.churn;

import com.churnmetrics.api.subscription.entities.Product;
import com.churnmetrics.api.subscription.entities.Subscription;
import lombok.NonNull;
import lombok.val;

import java.time.OffsetDateTime;

/**
 * Builders for subscription fixtures shared by the churn tests.
 */
public final class ChurnFixtures {

    private ChurnFixtures() {
    }

    @NonNull
    public static Product product(long id, long accountId, @NonNull String name) {
        val product = new Product();
        product.setId(id);
        product.setAccountId(accountId);
        product.setName(name);
        product.setRecurringBilling(true);
        return product;
    }

    /**
     * @param createdAt     ISO-8601 offset date-time, e.g. {@code 2023-12-01T12:00:00Z}.
     * @param deactivatedAt ISO-8601 offset date-time, or {@literal null} if still active.
     */
    @NonNull
    public static Subscription subscription(
        long id,
        @NonNull Product product,
        @NonNull String createdAt,
        String deactivatedAt,
        int recurringPriceCents,
        @NonNull String recurrence
    ) {
        return Subscription.builder()
            .id(id)
            .product(product)
            .createdAt(OffsetDateTime.parse(createdAt))
            .deactivatedAt(deactivatedAt == null ? null : OffsetDateTime.parse(deactivatedAt))
            .recurringPriceCents(recurringPriceCents)
            .recurrence(recurrence)
            .build();
    }

    @NonNull
    public static Subscription monthly(long id, @NonNull Product product, @NonNull String createdAt, String deactivatedAt) {
        return subscription(id, product, createdAt, deactivatedAt, 1000, "monthly");
    }
}
