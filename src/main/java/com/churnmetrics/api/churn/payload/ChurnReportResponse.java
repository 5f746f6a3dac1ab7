package com.churnmetrics.api.churn.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(name = "ChurnReport")
public class ChurnReportResponse {

    @Schema(required = true, description = "first day of the reporting period (inclusive)")
    @NonNull
    private LocalDate startDate;

    @Schema(required = true, description = "last day of the reporting period (inclusive)")
    @NonNull
    private LocalDate endDate;

    @Schema(required = true, description = "metrics aggregated over the whole period")
    @NonNull
    private ChurnMetricsResponse metrics;

    @Schema(required = true, description = "metrics of each day of the period in chronological order")
    @NonNull
    private List<DailyChurnResponse> dailyData;
}
