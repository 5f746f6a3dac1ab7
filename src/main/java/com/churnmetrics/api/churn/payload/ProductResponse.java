package com.churnmetrics.api.churn.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(name = "ChurnProduct")
public class ProductResponse {

    @Schema(required = true)
    @NonNull
    private Long id;

    @Schema(required = true)
    @NonNull
    private String name;

    @Schema(required = true, description = "false if the product has been deleted")
    private boolean alive;
}
