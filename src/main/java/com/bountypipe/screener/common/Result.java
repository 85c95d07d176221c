package com.bountypipe.screener.common;

import com.bountypipe.screener.common.exception.BaseScreeningException;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Outcome of processing a single record inside a batch. A failed result carries the
 * error code and message of the failure instead of a payload, so one bad record never
 * aborts the rest of the batch.
 */
@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    public static <T> Result<T> fail(BaseScreeningException e) {
        Objects.requireNonNull(e, "exception");
        return fail(e.getErrorCode(), e.getMessage());
    }

    // ---------- convenience helpers ----------

    /**
     * Convenience alias: true when successful.
     */
    public boolean isOk() {
        return success;
    }

    /**
     * Convenience alias for the payload (same as getData()).
     */
    public T get() {
        return data;
    }

    public boolean isFailure() {
        return !success;
    }
}
