package com.bountypipe.screener.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tri-state viability verdict, plus PENDING while no verdict exists yet.
 */
public enum GoNoGo {
    GO("go"),
    NO_GO("no-go"),
    CAUTION("caution"),
    PENDING("pending");

    private final String code;

    GoNoGo(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static GoNoGo fromCode(String code) {
        if (code == null) return PENDING;
        String c = code.trim();
        for (GoNoGo g : values()) {
            if (g.code.equalsIgnoreCase(c) || g.name().equalsIgnoreCase(c)) return g;
        }
        throw new IllegalArgumentException("Unknown go/no-go verdict: " + code);
    }
}
