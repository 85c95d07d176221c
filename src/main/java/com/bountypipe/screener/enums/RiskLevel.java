package com.bountypipe.screener.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discrete risk levels for a bounty attempt.
 */
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String code;

    RiskLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * @return null for {@code "unknown"} or a missing code, meaning the risk was never assessed
     */
    @JsonCreator
    public static RiskLevel fromCode(String code) {
        if (code == null || code.isBlank() || "unknown".equalsIgnoreCase(code.trim())) return null;
        for (RiskLevel r : values()) {
            if (r.code.equalsIgnoreCase(code) || r.name().equalsIgnoreCase(code)) return r;
        }
        throw new IllegalArgumentException("Unknown risk level: " + code);
    }
}
