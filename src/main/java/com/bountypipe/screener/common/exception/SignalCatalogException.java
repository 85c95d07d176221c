package com.bountypipe.screener.common.exception;

/**
 * A configured red-flag or indicator rule could not be compiled.
 */
public class SignalCatalogException extends BaseScreeningException {
    public static final String CODE = "ERR-CFG-001";

    public SignalCatalogException(String message) {
        super(CODE, message, null);
    }

    public SignalCatalogException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
