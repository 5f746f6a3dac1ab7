package com.churnmetrics.api.platform.transaction.annotations;

import org.springframework.transaction.annotation.Transactional;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A reasonable meta-annotation for {@link Transactional} with {@link Transactional#rollbackFor()
 * rollbackFor} set to {@link Exception} instead of {@link RuntimeException} and {@link Error}.
 * Services in this application throw checked exceptions for expected failures, and those must
 * roll back as well.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
@Transactional(rollbackFor = Exception.class)
public @interface ReasonablyTransactional {
}
