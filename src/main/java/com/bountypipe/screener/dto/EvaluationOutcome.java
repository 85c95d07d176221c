package com.bountypipe.screener.dto;

import com.bountypipe.screener.enums.GoNoGo;
import com.bountypipe.screener.enums.RiskLevel;
import lombok.Builder;

import java.util.List;

/**
 * Structured form of an evaluation produced outside this pipeline. The decision engine
 * treats these values as given.
 *
 * @param evaluationConfidence 0-100, null when the report did not state one
 * @param structured           true when read from the fenced JSON summary, false for text fallback
 */
@Builder
public record EvaluationOutcome(
        GoNoGo goNoGo,
        int complexityScore,
        int successProbability,
        Integer evaluationConfidence,
        RiskLevel riskLevel,
        List<String> redFlags,
        String estimatedTimeline,
        String notes,
        boolean structured
) {
    public EvaluationOutcome {
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
    }
}
