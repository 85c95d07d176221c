package com.bountypipe.screener.enums;

/**
 * Severity class of a red flag. CRITICAL flags carry the heavy probability penalty
 * and force a no-go verdict from the quick scorer.
 */
public enum FlagCategory {
    CRITICAL,
    STANDARD
}
