package com.churnmetrics.api.churn.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(name = "ChurnProducts")
public class ChurnProductsResponse {

    @Schema(required = true, description = "whether the account has at least one alive subscription product")
    private boolean hasSubscriptionProducts;

    @Schema(required = true, description = "recurring products of the account, including deleted ones")
    @NonNull
    private List<ProductResponse> products;
}
