package com.bountypipe.screener.model;

import com.bountypipe.screener.enums.EvaluationStatus;
import com.bountypipe.screener.enums.GoNoGo;
import com.bountypipe.screener.enums.ImplementationStatus;
import com.bountypipe.screener.enums.RiskLevel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable pipeline bookkeeping attached to a {@link Bounty}. Preparation, submission and
 * assignment fields of stored records are ignored.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InternalTracking {

    // Evaluation phase
    @Builder.Default
    private EvaluationStatus evaluationStatus = EvaluationStatus.NOT_EVALUATED;
    @Builder.Default
    private GoNoGo goNoGo = GoNoGo.PENDING;
    private Integer complexityScore;       // 1-10
    private Integer successProbability;    // 0-100
    private Integer evaluationConfidence;  // 0-100
    private RiskLevel riskLevel;
    @Builder.Default
    private List<String> redFlags = new ArrayList<>();
    private String estimatedTimeline;
    private String notes;
    private String evaluationMethod;
    private Instant lastEvaluated;

    // Implementation phase
    private ImplementationStatus implementationStatus;
    private Boolean readyForSubmission;
    private Instant implementationCompletedAt;

    /**
     * Stored records keep the readiness flag inside {@code implementation_result}.
     */
    @JsonProperty("implementation_result")
    public void applyImplementationResult(ImplementationResult result) {
        if (result != null && result.getReadyForSubmission() != null) {
            this.readyForSubmission = result.getReadyForSubmission();
        }
    }

    /**
     * A success needs both the completed status and the readiness flag.
     */
    @JsonIgnore
    public boolean isSuccessfulImplementation() {
        return implementationStatus == ImplementationStatus.COMPLETED && Boolean.TRUE.equals(readyForSubmission);
    }

    public int redFlagCount() {
        return redFlags == null ? 0 : redFlags.size();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ImplementationResult {
        @JsonProperty("ready_for_submission")
        private Boolean readyForSubmission;
    }
}
