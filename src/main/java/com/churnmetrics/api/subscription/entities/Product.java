package com.churnmetrics.api.subscription.entities;

import com.churnmetrics.api.platform.BasicEntity;
import jakarta.persistence.Entity;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.NonNull;

/**
 * A data access object that maps to the {@code product} table in the database. Only alive
 * products with recurring billing take part in churn analytics.
 */
@Entity
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class Product extends BasicEntity<Long> {

    private long accountId;

    @NonNull
    private String name;

    private boolean isRecurringBilling;
}
