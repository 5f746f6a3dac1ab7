package com.churnmetrics.api.churn.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(name = "ChurnMetrics")
public class ChurnMetricsResponse {

    @Schema(required = true, description = "percentage of the subscriber base that churned during the period")
    private double customerChurnRate;

    @Schema(required = true, description = "churn rate of the preceding period of the same length")
    private double lastPeriodChurnRate;

    @Schema(required = true, description = "number of subscriptions that ended during the period")
    private long churnedSubscribers;

    @Schema(required = true, description = "monthly recurring revenue lost with the churned subscriptions, in cents")
    private long churnedMrrCents;
}
