package com.churnmetrics.api.churn;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Period;

/**
 * Configuration properties used by various components in the churn package.
 */
@Validated
@ConfigurationProperties("app.churn")
@Data
public class ChurnConfiguration {

    /**
     * Strategy used to retrieve raw daily churn counts.
     */
    @NotNull
    private final DataSourceType dataSource;

    /**
     * Number of most recent days (including today) that are always computed in real time and never
     * cached. With the default of {@literal 2}, today and yesterday are always live.
     */
    @Min(1)
    private final int cacheHorizonDays;

    /**
     * Initial version of the day-level churn cache. Changing it orphans all cached days.
     */
    @Min(0)
    private final long cacheVersion;

    /**
     * Length of the reporting period when the start date isn't given.
     */
    @NotNull
    private final Period defaultRange;

    public enum DataSourceType {
        /**
         * Load overlapping subscription rows and classify them in memory.
         */
        SCAN,

        /**
         * Issue a fixed number of aggregation queries against the subscription index.
         */
        INDEX,
    }
}
