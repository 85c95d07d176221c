package com.bountypipe.screener.common.exception;

/**
 * Raised when a record is missing a required field or carries values outside their
 * documented ranges. Fatal to that record only.
 */
public class ValidationException extends BaseScreeningException {
    public static final String MISSING_FIELD = "ERR-VAL-001";
    public static final String OUT_OF_RANGE = "ERR-VAL-002";
    public static final String INCONSISTENT_FLAGS = "ERR-VAL-003";

    public ValidationException(String errorCode, String message) {
        super(errorCode, message, null);
    }
}
