package com.bountypipe.screener.dto;

/**
 * The four independently computed component scores (each 0-100) and their blend.
 */
public record DecisionFactors(
        double valueScore,
        double complexityScore,
        double organizationHistoryScore,
        double evaluationScore,
        double overallScore
) {
    public static DecisionFactors none() {
        return new DecisionFactors(0, 0, 0, 0, 0);
    }
}
