package com.churnmetrics.api.churn.exceptions;

import java.time.LocalDate;

/**
 * Thrown by strict churn report operations when the end date of the requested period precedes its
 * start date.
 */
public class InvalidDateRangeException extends Exception {

    public InvalidDateRangeException(LocalDate startDate, LocalDate endDate) {
        super(String.format("invalid date range: end date %s is before start date %s", endDate, startDate));
    }
}
