package com.churnmetrics.api.platform;

import jakarta.validation.ConstraintViolationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;

import java.time.zone.ZoneRulesException;


/**
 * Exception handlers for common, global handled and unhandled errors. Controllers translate the
 * expected failures of their own operations; the handlers here cover everything that escapes
 * them.
 */
@RestControllerAdvice
@Slf4j
public class GlobalControllerAdvice {

    @ExceptionHandler(Throwable.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    void handleInternalError(@NonNull final Throwable e) {
        log.error("uncaught exception while processing the request", e);
    }

    @ExceptionHandler(DataAccessException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    void handleDataAccessError(@NonNull final DataAccessException e) {
        log.error("data source query failed while processing the request", e);
    }

    @ExceptionHandler(ZoneRulesException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    void handleUnknownTimeZone(@NonNull final ZoneRulesException e) {
        log.error("account has an unknown timezone", e);
    }

    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    @ResponseStatus(HttpStatus.NOT_ACCEPTABLE)
    void handleHttpMediaNotAcceptable(@NonNull final HttpMediaTypeNotAcceptableException e) {
        log.trace("http media not acceptable", e);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    @ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
    void handleHttpRequestMethodNotSupported(@NonNull final HttpRequestMethodNotSupportedException e) {
        log.trace("http method not supported", e);
    }

    @ExceptionHandler(NoHandlerFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    void handleNotFound(@NonNull final NoHandlerFoundException e) {
        log.trace("http handler not found", e);
    }

    @ExceptionHandler({
        ServletRequestBindingException.class,
        TypeMismatchException.class,
        ConstraintViolationException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    void handleBadRequest(@NonNull final Exception e) {
        log.trace("http request parameters are not valid", e);
    }
}
