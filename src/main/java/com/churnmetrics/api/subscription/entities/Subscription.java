package com.churnmetrics.api.subscription.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToOne;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code subscription} table in the database. Analytics
 * only read these rows.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @ManyToOne(optional = false)
    private Product product;

    @NonNull
    @Column(updatable = false)
    private OffsetDateTime createdAt;

    /**
     * The instant this subscription ended, {@literal null} while it is still active.
     */
    private OffsetDateTime deactivatedAt;

    private int recurringPriceCents;

    /**
     * Raw recurrence value of the subscription price. Expected to be one of the {@link
     * RecurrenceUnit} values but kept as a string so that unexpected upstream values are still
     * readable.
     */
    @NonNull
    @Builder.Default
    private String recurrence = RecurrenceUnit.MONTHLY.getValue();
}
