package com.bountypipe.screener.common.exception;

import lombok.Getter;

import java.util.Objects;

/**
 * Root of the pipeline's unchecked failures. Every instance names the error code that
 * {@link com.bountypipe.screener.common.Result#fail(BaseScreeningException)} reports for the
 * affected record; each concrete type fixes its code or code family.
 */
@Getter
public abstract class BaseScreeningException extends RuntimeException {

    private final String errorCode;

    protected BaseScreeningException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }
}
