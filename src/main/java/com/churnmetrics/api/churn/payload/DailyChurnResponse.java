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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(name = "DailyChurn")
public class DailyChurnResponse {

    @Schema(required = true)
    @NonNull
    private LocalDate date;

    @Schema(required = true, example = "December 2023", description = "month label of the day, for chart axes")
    @NonNull
    private String month;

    @Schema(required = true, description = "number of months between the period's first month and this day's month")
    private int monthIndex;

    @Schema(required = true)
    private double customerChurnRate;

    @Schema(required = true)
    private long churnedSubscribers;

    @Schema(required = true)
    private long churnedMrrCents;

    @Schema(required = true, description = "subscriptions active at the start of the day")
    private long activeAtStart;

    @Schema(required = true)
    private long newSubscribers;
}
