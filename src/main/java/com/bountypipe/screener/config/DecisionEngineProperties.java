package com.bountypipe.screener.config;

import com.bountypipe.screener.enums.EvaluationStatus;
import com.bountypipe.screener.enums.GoNoGo;
import com.bountypipe.screener.enums.RiskTolerance;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Weights, tiers and gates of the authoritative implement/skip decision.
 */
@Data
@Component
@ConfigurationProperties("screening.decision")
public class DecisionEngineProperties {

    // Value tiers: reward floor (cents) and the decision threshold applied in that tier
    private ValueTier tier1 = new ValueTier(50_000, 60);
    private ValueTier tier2 = new ValueTier(100_000, 55);
    private ValueTier tier3 = new ValueTier(150_000, 50);

    // Complexity adjustments
    private int lowComplexityMax = 4;
    private int lowComplexityBonus = 5;
    private int mediumComplexityMax = 7;
    private int mediumComplexityBonus = 0;
    private int highComplexityPenalty = 10;

    // Organization history weighting
    private int historyMinAttempts = 3;
    private double historySuccessRateMultiplier = 0.2;
    private double historyMaxAdjustment = 10;

    // Risk tolerance, added to the blended score
    private double conservativeAdjustment = 15;
    private double moderateAdjustment = 0;
    private double aggressiveAdjustment = -10;
    private RiskTolerance defaultRiskTolerance = RiskTolerance.MODERATE;

    // Minimum requirements
    private EvaluationStatus requiredEvaluationStatus = EvaluationStatus.EVALUATED;
    private GoNoGo requiredGoNoGo = GoNoGo.GO;
    private int minConfidence = 50;

    // Estimated success rate
    private double declaredProbabilityWeight = 0.7;
    private double historyRateWeight = 0.3;
    private double scorePivot = 60;
    private double scoreAdjustmentFactor = 0.2;

    public double adjustmentFor(RiskTolerance tolerance) {
        return switch (tolerance) {
            case CONSERVATIVE -> conservativeAdjustment;
            case MODERATE -> moderateAdjustment;
            case AGGRESSIVE -> aggressiveAdjustment;
        };
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ValueTier {
        private long minValue;
        private double threshold;
    }
}
