package com.bountypipe.screener.dto;

import com.bountypipe.screener.enums.GoNoGo;
import com.bountypipe.screener.enums.RiskLevel;
import lombok.Builder;

import java.util.List;

/**
 * Output of the quick first-pass scorer.
 *
 * @param complexityScore      1-10
 * @param successProbability   0-100
 * @param confidence           20-85, how much the quick pass trusts itself
 * @param evaluationDurationMs wall time of the evaluation, 0 when scored from a ready bundle
 */
@Builder
public record QuickEvaluationResult(
        GoNoGo goNoGo,
        int complexityScore,
        int successProbability,
        RiskLevel riskLevel,
        List<String> redFlags,
        String estimatedTimeline,
        String notes,
        int confidence,
        double evaluationDurationMs
) {
    public QuickEvaluationResult {
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
    }
}
