package com.churnmetrics.api.churn.exceptions;

/**
 * Thrown while resolving a reporting period when a raw date parameter can't be parsed.
 */
public class InvalidDateFormatException extends Exception {

    public InvalidDateFormatException(String value, Throwable cause) {
        super(String.format("invalid date format: '%s'", value), cause);
    }
}
