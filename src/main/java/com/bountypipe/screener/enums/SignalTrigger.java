package com.bountypipe.screener.enums;

/**
 * How a red-flag rule decides that it fires.
 */
public enum SignalTrigger {
    /** Pattern found anywhere in the lower-cased title and body. */
    TEXT_MATCH,
    /** Body shorter than the configured minimum length; pattern unused. */
    SHORT_BODY,
    /** Reward below the configured ceiling and pattern found in the text. */
    LOW_REWARD_MATCH
}
