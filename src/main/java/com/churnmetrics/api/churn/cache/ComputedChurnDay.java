package com.churnmetrics.api.churn.cache;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code computed_churn_day} table in the database. Each row
 * holds the raw churn counts of one calendar day of one report configuration.
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComputedChurnDay {

    @Id
    @NonNull
    @Column(name = "cache_key")
    private String cacheKey;

    /**
     * JSON serialised {@link com.churnmetrics.api.churn.DayCounts}.
     */
    @NonNull
    private String data;

    @NonNull
    private OffsetDateTime updatedAt;
}
