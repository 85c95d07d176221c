package com.bountypipe.screener.dto;

import java.util.List;

/**
 * Structured signals extracted from the free text of a bounty. Computed fresh for every
 * quick evaluation and never mutated.
 *
 * @param redFlags         labels of every red flag that fired, in catalog order
 * @param criticalRedFlags subset of {@code redFlags} whose rule is CRITICAL
 */
public record SignalBundle(
        boolean hasCodeExamples,
        boolean hasSpecificRequirements,
        boolean isWellDefined,
        boolean mentionsIntegration,
        boolean mentionsArchitecture,
        boolean hasSubjectiveCriteria,
        int estimatedWordCount,
        List<String> redFlags,
        List<String> criticalRedFlags
) {
    public SignalBundle {
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
        criticalRedFlags = criticalRedFlags == null ? List.of() : List.copyOf(criticalRedFlags);
    }

    public int redFlagCount() {
        return redFlags.size();
    }

    public boolean hasCriticalRedFlag() {
        return !criticalRedFlags.isEmpty();
    }
}
