package com.churnmetrics.api.churn;

import com.churnmetrics.api.account.exceptions.AccountNotFoundException;
import com.churnmetrics.api.churn.exceptions.InvalidDateFormatException;
import com.churnmetrics.api.churn.exceptions.InvalidDateRangeException;
import com.churnmetrics.api.churn.payload.ChurnProductsResponse;
import com.churnmetrics.api.churn.payload.ChurnReportResponse;
import com.churnmetrics.api.contracts.AccountServiceContract;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for churn analytics related '{@code /v1/accounts/{accountId}/churn}' routes.
 */
@Validated
@RestController
@RequestMapping("/v1/accounts/{accountId}/churn")
@Slf4j
@Tag(name = "churn")
class ChurnController {

    private final ChurnService churnService;
    private final AccountServiceContract accountServiceContract;

    @Autowired
    ChurnController(@NonNull ChurnService churnService, @NonNull AccountServiceContract accountServiceContract) {
        this.churnService = churnService;
        this.accountServiceContract = accountServiceContract;
    }

    /**
     * <p>
     * Computes the subscriber churn report of an account over a period of whole calendar days in
     * the account's timezone.</p>
     *
     * <ul>
     *     <li>the period starts on {@code start_time}, else on {@code from}, else one month before
     *     its end.</li>
     *     <li>the period ends on {@code end_time}, else on {@code to}, else today.</li>
     * </ul>
     *
     * <p>
     * Dates are ISO-8601 dates ({@code 2023-12-01}) or date-times, in which case only their date
     * part is used. Both ends of the period are inclusive.</p>
     *
     * @param products optional list of product ids to restrict the report to.
     * @return the churn report.
     */
    @Operation(summary = "Get churn report")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "204", description = "account has no matching subscription products", content = @Content),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "account doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping
    ResponseEntity<ChurnReportResponse> getChurnReport(
        @NotNull @Min(1) @PathVariable Long accountId,
        @RequestParam(value = "start_time", required = false) String startTime,
        @RequestParam(value = "end_time", required = false) String endTime,
        @RequestParam(value = "from", required = false) String from,
        @RequestParam(value = "to", required = false) String to,
        @RequestParam(value = "products", required = false) List<Long> products
    ) {
        val params = ChurnParams.builder()
            .startTime(startTime)
            .endTime(endTime)
            .from(from)
            .to(to)
            .productIds(products)
            .build();

        try {
            accountServiceContract.markLargeIfWarranted(accountId);
            return churnService.getChurnReport(accountId, params, true)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
        } catch (AccountNotFoundException e) {
            log.trace("churn report requested for unknown account", e);
            return ResponseEntity.notFound().build();
        } catch (InvalidDateFormatException | InvalidDateRangeException e) {
            log.trace("churn report requested with invalid dates", e);
            return ResponseEntity.badRequest().build();
        }
    }

    /**
     * Lists the recurring products of an account that a churn report can be restricted to,
     * including deleted products.
     */
    @Operation(summary = "List churn report products")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "account doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/products")
    ResponseEntity<ChurnProductsResponse> listProducts(@NotNull @Min(1) @PathVariable Long accountId) {
        try {
            return ResponseEntity.ok(churnService.listAvailableProducts(accountId));
        } catch (AccountNotFoundException e) {
            log.trace("products requested for unknown account", e);
            return ResponseEntity.notFound().build();
        }
    }
}
