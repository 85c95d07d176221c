package com.bountypipe.screener.dto;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of everything the analytics aggregator observed during one session.
 * Cost and ROI figures are rough estimates, rounded to cents / two decimals.
 */
@Builder
public record SessionMetrics(
        String sessionId,
        Instant asOf,
        long totalRuntimeMs,
        int bountiesProcessed,
        Decisions decisions,
        Implementations implementations,
        QualityGates qualityGates,
        Performance performance,
        ValueAnalysis valueAnalysis
) {

    public record Decisions(
            int totalEvaluated,
            int goDecisions,
            int cautionDecisions,
            int noGoDecisions,
            double averageConfidence,
            double averageThresholdUsed
    ) {
    }

    /**
     * @param totalCostEstimate approximation only: flat cost per attempt scaled by duration
     */
    public record Implementations(
            int attempted,
            int successful,
            int failed,
            double successRate,
            double averageDurationMs,
            double totalCostEstimate
    ) {
    }

    public record QualityGates(
            boolean enabled,
            int totalChecked,
            int passed,
            int failed,
            double averageScore,
            List<String> commonBlockers
    ) {
        public QualityGates {
            commonBlockers = commonBlockers == null ? List.of() : List.copyOf(commonBlockers);
        }
    }

    /**
     * @param parallelEfficiency heuristic percentage, not a measurement
     */
    public record Performance(
            double evaluationsPerMinute,
            double implementationsPerHour,
            double parallelEfficiency,
            List<String> bottlenecks
    ) {
        public Performance {
            bottlenecks = bottlenecks == null ? List.of() : List.copyOf(bottlenecks);
        }
    }

    /**
     * @param roiEstimate successfully implemented value in dollars over estimated cost; an estimate
     */
    public record ValueAnalysis(
            long totalBountyValue,
            long successfullyImplementedValue,
            double roiEstimate,
            double averageBountyValue,
            ValueDistribution valueDistribution
    ) {
    }

    public record ValueDistribution(int low, int medium, int high) {
    }
}
