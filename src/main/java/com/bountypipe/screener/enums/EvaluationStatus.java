package com.bountypipe.screener.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of the viability evaluation of a bounty.
 */
public enum EvaluationStatus {
    NOT_EVALUATED("not_evaluated"),
    IN_PROGRESS("in_progress"),
    EVALUATED("evaluated"),
    EVALUATION_FAILED("evaluation_failed");

    private final String code;

    EvaluationStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static EvaluationStatus fromCode(String code) {
        for (EvaluationStatus s : values()) {
            if (s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code)) return s;
        }
        throw new IllegalArgumentException("Unknown evaluation status: " + code);
    }
}
