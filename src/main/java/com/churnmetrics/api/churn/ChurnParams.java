package com.churnmetrics.api.churn;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * Inputs of a churn report request. Explicit dates take precedence over raw date strings, and
 * {@code startTime}/{@code endTime} take precedence over {@code from}/{@code to}.
 */
@Data
@Builder
public class ChurnParams {

    private final LocalDate startDate;

    private final LocalDate endDate;

    private final String startTime;

    private final String endTime;

    private final String from;

    private final String to;

    /**
     * Product ids to restrict the report to. {@literal null} or empty includes all subscription
     * products of the account.
     */
    private final List<Long> productIds;

    public static ChurnParams empty() {
        return ChurnParams.builder().build();
    }
}
