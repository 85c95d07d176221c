package com.bountypipe.screener.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Session-level dial applied additively to the blended decision score.
 * The adjustment values themselves live in configuration.
 */
public enum RiskTolerance {
    CONSERVATIVE("conservative"),
    MODERATE("moderate"),
    AGGRESSIVE("aggressive");

    private final String code;

    RiskTolerance(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
