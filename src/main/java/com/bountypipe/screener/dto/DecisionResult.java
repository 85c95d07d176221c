package com.bountypipe.screener.dto;

import com.bountypipe.screener.enums.RiskLevel;
import lombok.Builder;

import java.util.List;

/**
 * Final implement/skip verdict for one bounty. {@code reasoning} is the audit trail: one
 * entry per scoring step, in the order the steps ran, ending with the verdict line.
 *
 * @param gatePassed false when a minimum requirement failed and no scores were computed
 */
@Builder
public record DecisionResult(
        String bountyId,
        boolean shouldImplement,
        boolean gatePassed,
        double confidence,
        List<String> reasoning,
        double thresholdUsed,
        RiskLevel riskLevel,
        double estimatedSuccessRate,
        DecisionFactors decisionFactors
) {
    public DecisionResult {
        reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
        decisionFactors = decisionFactors == null ? DecisionFactors.none() : decisionFactors;
    }
}
