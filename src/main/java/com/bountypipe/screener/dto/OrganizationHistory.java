package com.bountypipe.screener.dto;

import java.time.Instant;
import java.util.List;

/**
 * Past performance of one organization, as seen by a full scan of the record corpus.
 *
 * @param successRate       successfulImplementations / totalAttempts * 100, 0 without attempts
 * @param averageComplexity mean observed complexity, 5 when no record carries one
 * @param totalValue        sum of rewards in cents
 * @param lastSuccessDate   completion time of the latest successful implementation, may be null
 * @param flaggedRecords    ids of records carrying a readiness flag without a completed status
 */
public record OrganizationHistory(
        String name,
        int totalAttempts,
        int successfulImplementations,
        double successRate,
        double averageComplexity,
        long totalValue,
        Instant lastSuccessDate,
        List<String> flaggedRecords
) {
    public OrganizationHistory {
        flaggedRecords = flaggedRecords == null ? List.of() : List.copyOf(flaggedRecords);
    }
}
