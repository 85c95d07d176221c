package com.bountypipe.screener.dto;

import java.util.List;

/**
 * Outcome of the external quality gates run against a finished implementation.
 *
 * @param passed   whether every blocking gate passed
 * @param score    aggregate gate score, 0-100
 * @param blockers human readable reasons the submission is blocked
 */
public record QualityGateResult(boolean passed, double score, List<String> blockers) {

    public QualityGateResult {
        blockers = blockers == null ? List.of() : List.copyOf(blockers);
    }
}
