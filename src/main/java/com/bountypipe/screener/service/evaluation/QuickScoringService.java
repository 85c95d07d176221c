package com.bountypipe.screener.service.evaluation;

import com.bountypipe.screener.config.QuickScoringProperties;
import com.bountypipe.screener.dto.QuickEvaluationResult;
import com.bountypipe.screener.dto.SignalBundle;
import com.bountypipe.screener.enums.EvaluationStatus;
import com.bountypipe.screener.enums.GoNoGo;
import com.bountypipe.screener.enums.RiskLevel;
import com.bountypipe.screener.model.Bounty;
import com.bountypipe.screener.model.InternalTracking;
import com.bountypipe.screener.service.signals.SignalExtractor;
import com.bountypipe.screener.service.validation.BountyValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Cheap first-pass viability filter. Scores a signal bundle in microseconds so that only
 * promising bounties go on to the expensive external evaluation.
 * <p>
 * Never fails on poor text: short or empty issues degrade the scores instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuickScoringService {

    static final String QUICK_NOTE = "Quick evaluation - consider deeper analysis for high-value bounties";

    private final SignalExtractor signalExtractor;
    private final BountyValidator validator;
    private final QuickScoringProperties props;
    private final Clock clock;

    /**
     * Extracts fresh signals from the bounty text and scores them.
     *
     * @throws com.bountypipe.screener.common.exception.ValidationException when the record lacks an id, title or reward
     */
    public QuickEvaluationResult evaluate(Bounty bounty) {
        validator.requireIngestible(bounty);
        final long start = System.nanoTime();

        SignalBundle bundle = signalExtractor.extractSignals(bounty.getTitle(), bounty.getBody(), bounty.getRewardAmount());
        QuickEvaluationResult scored = scoreQuickly(bundle, bounty.getRewardAmount());

        double durationMs = (System.nanoTime() - start) / 1_000_000.0;
        QuickEvaluationResult result = QuickEvaluationResult.builder()
                .goNoGo(scored.goNoGo())
                .complexityScore(scored.complexityScore())
                .successProbability(scored.successProbability())
                .riskLevel(scored.riskLevel())
                .redFlags(scored.redFlags())
                .estimatedTimeline(scored.estimatedTimeline())
                .notes(scored.notes())
                .confidence(scored.confidence())
                .evaluationDurationMs(durationMs)
                .build();

        log.info("quick.evaluation -> {} '{}' verdict={}, success={}%, confidence={}%",
                bounty.getId(), bounty.getTitle(), result.goNoGo(), result.successProbability(), result.confidence());
        return result;
    }

    public QuickEvaluationResult scoreQuickly(SignalBundle bundle, long rewardAmount) {
        int complexity = calculateComplexity(bundle);
        int probability = calculateSuccessProbability(complexity, bundle, rewardAmount);
        return QuickEvaluationResult.builder()
                .goNoGo(makeDecision(probability, bundle))
                .complexityScore(complexity)
                .successProbability(probability)
                .riskLevel(calculateRiskLevel(bundle.redFlagCount(), complexity))
                .redFlags(bundle.redFlags())
                .estimatedTimeline(estimateTimeline(complexity, bundle))
                .notes(generateNotes(bundle))
                .confidence(calculateConfidence(bundle))
                .evaluationDurationMs(0)
                .build();
    }

    /**
     * Records a quick evaluation on the bounty's tracking block.
     */
    public void applyTo(Bounty bounty, QuickEvaluationResult result) {
        InternalTracking t = bounty.getInternal();
        t.setEvaluationStatus(EvaluationStatus.EVALUATED);
        t.setGoNoGo(result.goNoGo());
        t.setComplexityScore(result.complexityScore());
        t.setSuccessProbability(result.successProbability());
        t.setEvaluationConfidence(result.confidence());
        t.setRiskLevel(result.riskLevel());
        t.setRedFlags(new ArrayList<>(result.redFlags()));
        t.setEstimatedTimeline(result.estimatedTimeline());
        t.setNotes(result.notes());
        t.setEvaluationMethod("quick");
        t.setLastEvaluated(clock.instant());
    }

    // ========== Scoring steps ==========

    int calculateComplexity(SignalBundle b) {
        int complexity = props.getBaseComplexity();

        if (!b.hasSpecificRequirements()) complexity += props.getUnspecificRequirementsPenalty();
        if (!b.isWellDefined()) complexity += props.getNotWellDefinedPenalty();
        if (b.mentionsIntegration()) complexity += props.getIntegrationPenalty();
        if (b.mentionsArchitecture()) complexity += props.getArchitecturePenalty();
        if (b.hasSubjectiveCriteria()) complexity += props.getSubjectiveCriteriaPenalty();

        complexity += b.redFlagCount();

        if (b.hasCodeExamples()) complexity -= props.getCodeExamplesRelief();
        if (b.estimatedWordCount() > props.getLongTextWordCount()) complexity -= props.getLongTextRelief();

        return clamp(complexity, 1, 10);
    }

    int calculateSuccessProbability(int complexity, SignalBundle b, long rewardAmount) {
        int probability = props.getBaseProbability();
        probability -= (complexity - props.getBaseComplexity()) * props.getProbabilityPerComplexityPoint();

        int critical = b.criticalRedFlags().size();
        probability -= critical * props.getCriticalFlagPenalty();
        probability -= (b.redFlagCount() - critical) * props.getStandardFlagPenalty();

        if (rewardAmount >= props.getMediumRewardThreshold()) probability += props.getMediumRewardBonus();
        if (rewardAmount >= props.getHighRewardThreshold()) probability += props.getHighRewardBonus();

        return clamp(probability, 0, 100);
    }

    GoNoGo makeDecision(int probability, SignalBundle b) {
        // Critical flags veto regardless of probability
        if (b.hasCriticalRedFlag()) return GoNoGo.NO_GO;
        if (probability >= props.getGoCutoff()) return GoNoGo.GO;
        if (probability >= props.getCautionCutoff()) return GoNoGo.CAUTION;
        return GoNoGo.NO_GO;
    }

    static RiskLevel calculateRiskLevel(int redFlags, int complexity) {
        if (redFlags >= 3 || complexity >= 8) return RiskLevel.HIGH;
        if (redFlags >= 1 || complexity >= 6) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    String estimateTimeline(int complexity, SignalBundle b) {
        double hours = complexity * props.getHoursPerComplexityPoint();
        if (!b.isWellDefined()) hours *= props.getNotWellDefinedMultiplier();
        if (b.mentionsArchitecture()) hours *= props.getArchitectureMultiplier();
        if (b.hasCodeExamples()) hours *= props.getCodeExamplesMultiplier();

        if (hours <= 8) return Math.round(hours) + " hours";
        if (hours <= 40) return Math.round(hours / 8) + " days";
        return Math.round(hours / 40) + " weeks";
    }

    int calculateConfidence(SignalBundle b) {
        int confidence = props.getBaseConfidence();

        if (b.isWellDefined()) confidence += props.getWellDefinedConfidence();
        if (b.hasCodeExamples()) confidence += props.getCodeExamplesConfidence();
        if (b.hasSpecificRequirements()) confidence += props.getSpecificRequirementsConfidence();

        if (b.hasSubjectiveCriteria()) confidence -= props.getSubjectiveCriteriaConfidencePenalty();
        if (b.mentionsArchitecture()) confidence -= props.getArchitectureConfidencePenalty();

        confidence -= b.redFlagCount() * props.getPerFlagConfidencePenalty();

        return clamp(confidence, props.getMinConfidence(), props.getMaxConfidence());
    }

    static String generateNotes(SignalBundle b) {
        List<String> notes = new ArrayList<>();
        notes.add(b.isWellDefined() ? "Requirements appear well-defined" : "Requirements need clarification");
        if (b.hasCodeExamples()) notes.add("Code examples provided");
        notes.add(b.redFlagCount() == 0
                ? "No major red flags identified"
                : b.redFlagCount() + " risk factors identified");
        notes.add(QUICK_NOTE);
        return String.join(". ", notes);
    }

    private static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
