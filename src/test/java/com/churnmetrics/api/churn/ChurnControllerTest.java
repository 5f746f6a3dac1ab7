package com.churnmetrics.api.churn;

import com.churnmetrics.api.account.exceptions.AccountNotFoundException;
import com.churnmetrics.api.churn.exceptions.InvalidDateFormatException;
import com.churnmetrics.api.churn.exceptions.InvalidDateRangeException;
import com.churnmetrics.api.churn.payload.ChurnMetricsResponse;
import com.churnmetrics.api.churn.payload.ChurnProductsResponse;
import com.churnmetrics.api.churn.payload.ChurnReportResponse;
import com.churnmetrics.api.contracts.AccountServiceContract;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ChurnControllerTest {

    @Mock
    private ChurnService churnService;

    @Mock
    private AccountServiceContract accountServiceContract;

    private ChurnController controller;

    @BeforeEach
    void setUp() {
        controller = new ChurnController(churnService, accountServiceContract);
    }

    @Test
    void getChurnReport() throws Exception {
        val report = ChurnReportResponse.builder()
            .startDate(LocalDate.of(2023, 12, 1))
            .endDate(LocalDate.of(2023, 12, 31))
            .metrics(ChurnMetricsResponse.builder().customerChurnRate(40.0).build())
            .dailyData(List.of())
            .build();

        val paramsCaptor = ArgumentCaptor.forClass(ChurnParams.class);
        when(churnService.getChurnReport(eq(1L), paramsCaptor.capture(), eq(true))).thenReturn(Optional.of(report));

        val response = controller.getChurnReport(1L, "2023-12-01", "2023-12-31", "2023-11-01", null, List.of(2L));
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(report, response.getBody());
        verify(accountServiceContract).markLargeIfWarranted(1L);

        val params = paramsCaptor.getValue();
        assertEquals("2023-12-01", params.getStartTime());
        assertEquals("2023-12-31", params.getEndTime());
        assertEquals("2023-11-01", params.getFrom());
        assertEquals(List.of(2L), params.getProductIds());
    }

    @Test
    void getChurnReport_withoutProducts() throws Exception {
        when(churnService.getChurnReport(anyLong(), any(), anyBoolean())).thenReturn(Optional.empty());
        val response = controller.getChurnReport(1L, null, null, null, null, null);
        assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode());
    }

    @Test
    void getChurnReport_withErrors() throws Exception {
        when(churnService.getChurnReport(eq(1L), any(), anyBoolean()))
            .thenThrow(new InvalidDateFormatException("yesterday", new IllegalArgumentException()));
        when(churnService.getChurnReport(eq(2L), any(), anyBoolean()))
            .thenThrow(new InvalidDateRangeException(LocalDate.of(2023, 12, 31), LocalDate.of(2023, 12, 1)));
        when(churnService.getChurnReport(eq(3L), any(), anyBoolean()))
            .thenThrow(new AccountNotFoundException(3L));

        assertEquals(HttpStatus.BAD_REQUEST, controller.getChurnReport(1L, "yesterday", null, null, null, null).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, controller.getChurnReport(2L, "2023-12-31", "2023-12-01", null, null, null).getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, controller.getChurnReport(3L, null, null, null, null, null).getStatusCode());
    }

    @Test
    void listProducts() throws Exception {
        val products = ChurnProductsResponse.builder().hasSubscriptionProducts(false).products(List.of()).build();
        when(churnService.listAvailableProducts(1L)).thenReturn(products);
        when(churnService.listAvailableProducts(2L)).thenThrow(new AccountNotFoundException(2L));

        assertEquals(products, controller.listProducts(1L).getBody());
        assertEquals(HttpStatus.NOT_FOUND, controller.listProducts(2L).getStatusCode());
    }
}
