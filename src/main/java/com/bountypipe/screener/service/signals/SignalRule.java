package com.bountypipe.screener.service.signals;

import com.bountypipe.screener.enums.FlagCategory;
import com.bountypipe.screener.enums.SignalTrigger;

import java.util.regex.Pattern;

/**
 * One compiled row of the red-flag catalog. {@code pattern} is null for SHORT_BODY rules.
 */
public record SignalRule(String key, String label, FlagCategory category, SignalTrigger trigger, Pattern pattern) {

    public boolean isCritical() {
        return category == FlagCategory.CRITICAL;
    }
}
