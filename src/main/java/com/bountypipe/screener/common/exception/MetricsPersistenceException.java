package com.bountypipe.screener.common.exception;

/**
 * The session metrics snapshot could not be written.
 */
public class MetricsPersistenceException extends BaseScreeningException {
    public static final String CODE = "ERR-IO-001";

    public MetricsPersistenceException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
