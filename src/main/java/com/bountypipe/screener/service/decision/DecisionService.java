package com.bountypipe.screener.service.decision;

import com.bountypipe.screener.common.Result;
import com.bountypipe.screener.common.exception.BaseScreeningException;
import com.bountypipe.screener.config.DecisionEngineProperties;
import com.bountypipe.screener.dto.DecisionFactors;
import com.bountypipe.screener.dto.DecisionResult;
import com.bountypipe.screener.dto.OrganizationHistory;
import com.bountypipe.screener.enums.ImplementationStatus;
import com.bountypipe.screener.enums.RiskLevel;
import com.bountypipe.screener.enums.RiskTolerance;
import com.bountypipe.screener.model.Bounty;
import com.bountypipe.screener.model.InternalTracking;
import com.bountypipe.screener.service.history.OrganizationHistorySnapshot;
import com.bountypipe.screener.service.validation.BountyValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Authoritative, history-aware gate deciding whether a bounty is auto-implemented.
 * <p>
 * Steps: minimum requirements, four component scores (value, complexity, organization
 * history, evaluation), blend plus risk-tolerance adjustment, value-tiered threshold.
 * Every step appends to the reasoning trace of the returned {@link DecisionResult}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionService {

    // Value score per tier
    private static final double HIGH_VALUE_SCORE = 85;
    private static final double MEDIUM_VALUE_SCORE = 70;
    private static final double LOWER_VALUE_SCORE = 60;
    private static final double VERY_LOW_VALUE_SCORE = 30;

    // Complexity score bases
    private static final double LOW_COMPLEXITY_BASE = 70;
    private static final double MEDIUM_COMPLEXITY_BASE = 60;
    private static final double HIGH_COMPLEXITY_BASE = 50;

    private static final double NEUTRAL_HISTORY_SCORE = 50;

    private final DecisionEngineProperties config;
    private final BountyValidator validator;

    public DecisionResult decide(Bounty bounty, OrganizationHistorySnapshot history) {
        return decide(bounty, history, config.getDefaultRiskTolerance());
    }

    /**
     * @throws com.bountypipe.screener.common.exception.ValidationException if the record is malformed
     */
    public DecisionResult decide(Bounty bounty, OrganizationHistorySnapshot history, RiskTolerance tolerance) {
        validator.requireValid(bounty);
        RiskTolerance riskTolerance = tolerance == null ? config.getDefaultRiskTolerance() : tolerance;
        List<String> reasoning = new ArrayList<>();

        // 1) Minimum requirements
        if (!meetsMinimumRequirements(bounty.getInternal(), reasoning)) {
            log.info("decision -> {} SKIP (gate): {}", bounty.getId(), reasoning.get(reasoning.size() - 1));
            return DecisionResult.builder()
                    .bountyId(bounty.getId())
                    .shouldImplement(false)
                    .gatePassed(false)
                    .confidence(0)
                    .reasoning(reasoning)
                    .thresholdUsed(0)
                    .riskLevel(RiskLevel.HIGH)
                    .estimatedSuccessRate(0)
                    .decisionFactors(DecisionFactors.none())
                    .build();
        }

        // 2) Component scores
        Optional<OrganizationHistory> orgHistory = sufficientHistory(bounty, history);
        double valueScore = calculateValueScore(bounty.getRewardAmount(), reasoning);
        double complexityScore = calculateComplexityScore(bounty.getInternal().getComplexityScore(), reasoning);
        double historyScore = calculateOrganizationHistoryScore(bounty.getOrganization(), orgHistory, reasoning);
        double evaluationScore = calculateEvaluationScore(bounty.getInternal(), reasoning);

        // 3) Blend + risk tolerance
        double baseScore = (valueScore + complexityScore + historyScore + evaluationScore) / 4.0;
        double adjustment = config.adjustmentFor(riskTolerance);
        double overall = clamp(baseScore + adjustment, 0, 100);
        reasoning.add(String.format(Locale.ROOT, "Overall score: %.1f (base %.1f, %s tolerance %s)",
                overall, baseScore, riskTolerance.getCode(), signed(adjustment)));

        // 4) Threshold by value tier
        double threshold = valueBasedThreshold(bounty.getRewardAmount());

        // 5) Verdict
        boolean implement = overall >= threshold;
        double confidence = Math.min(100, overall);
        RiskLevel riskLevel = calculateRiskLevel(bounty.getInternal(), overall);
        double successRate = estimateSuccessRate(bounty.getInternal(), orgHistory, overall);

        if (implement) {
            reasoning.add(String.format(Locale.ROOT, "Decision: IMPLEMENT (score: %.1f >= threshold: %s)", overall, num(threshold)));
        } else {
            reasoning.add(String.format(Locale.ROOT, "Decision: SKIP (score: %.1f < threshold: %s)", overall, num(threshold)));
        }
        log.info("decision -> {} {} score={} threshold={} risk={}", bounty.getId(),
                implement ? "IMPLEMENT" : "SKIP", String.format(Locale.ROOT, "%.1f", overall), num(threshold), riskLevel);

        return DecisionResult.builder()
                .bountyId(bounty.getId())
                .shouldImplement(implement)
                .gatePassed(true)
                .confidence(confidence)
                .reasoning(reasoning)
                .thresholdUsed(threshold)
                .riskLevel(riskLevel)
                .estimatedSuccessRate(successRate)
                .decisionFactors(new DecisionFactors(valueScore, complexityScore, historyScore, evaluationScore, overall))
                .build();
    }

    /**
     * Decides every record independently; a malformed record yields a failed {@link Result}
     * and never prevents the others from being decided.
     */
    public List<Result<DecisionResult>> decideAll(Collection<Bounty> bounties, OrganizationHistorySnapshot history,
                                                  RiskTolerance tolerance) {
        List<Result<DecisionResult>> out = new ArrayList<>(bounties.size());
        for (Bounty b : bounties) {
            try {
                out.add(Result.ok(decide(b, history, tolerance)));
            } catch (BaseScreeningException e) {
                log.error("decision failed for {}: [{}] {}", b == null ? null : b.getId(), e.getErrorCode(), e.getMessage());
                out.add(Result.fail(e));
            }
        }
        return out;
    }

    // ========== Steps ==========

    private boolean meetsMinimumRequirements(InternalTracking t, List<String> reasoning) {
        if (t.getEvaluationStatus() != config.getRequiredEvaluationStatus()) {
            reasoning.add("Not evaluated (status: " + code(t.getEvaluationStatus() == null ? null : t.getEvaluationStatus().getCode()) + ")");
            return false;
        }
        if (t.getGoNoGo() != config.getRequiredGoNoGo()) {
            reasoning.add("Not GO-rated (rating: " + code(t.getGoNoGo() == null ? null : t.getGoNoGo().getCode()) + ")");
            return false;
        }
        int confidence = t.getEvaluationConfidence() == null ? 0 : t.getEvaluationConfidence();
        if (confidence < config.getMinConfidence()) {
            reasoning.add("Low evaluation confidence (" + confidence + "% < " + config.getMinConfidence() + "%)");
            return false;
        }
        if (t.getImplementationStatus() == ImplementationStatus.COMPLETED) {
            reasoning.add("Already implemented");
            return false;
        }
        reasoning.add("Meets minimum requirements");
        return true;
    }

    double calculateValueScore(long value, List<String> reasoning) {
        String dollars = String.format(Locale.ROOT, "$%.2f", value / 100.0);
        double score;
        if (value >= config.getTier3().getMinValue()) {
            score = HIGH_VALUE_SCORE;
            reasoning.add("High value bounty: " + dollars + " (score: " + num(score) + ")");
        } else if (value >= config.getTier2().getMinValue()) {
            score = MEDIUM_VALUE_SCORE;
            reasoning.add("Medium value bounty: " + dollars + " (score: " + num(score) + ")");
        } else if (value >= config.getTier1().getMinValue()) {
            score = LOWER_VALUE_SCORE;
            reasoning.add("Lower value bounty: " + dollars + " (score: " + num(score) + ")");
        } else {
            score = VERY_LOW_VALUE_SCORE;
            reasoning.add("Very low value bounty: " + dollars + " (score: " + num(score) + ")");
        }
        return score;
    }

    double calculateComplexityScore(int complexity, List<String> reasoning) {
        double score;
        if (complexity <= config.getLowComplexityMax()) {
            score = LOW_COMPLEXITY_BASE + config.getLowComplexityBonus();
            reasoning.add("Low complexity (" + complexity + "): +" + config.getLowComplexityBonus() + " bonus (score: " + num(score) + ")");
        } else if (complexity <= config.getMediumComplexityMax()) {
            score = MEDIUM_COMPLEXITY_BASE + config.getMediumComplexityBonus();
            String adj = config.getMediumComplexityBonus() == 0
                    ? "no adjustment" : signed(config.getMediumComplexityBonus()) + " bonus";
            reasoning.add("Medium complexity (" + complexity + "): " + adj + " (score: " + num(score) + ")");
        } else {
            score = Math.max(0, HIGH_COMPLEXITY_BASE - config.getHighComplexityPenalty());
            reasoning.add("High complexity (" + complexity + "): -" + config.getHighComplexityPenalty() + " penalty (score: " + num(score) + ")");
        }
        return score;
    }

    double calculateOrganizationHistoryScore(String organization, Optional<OrganizationHistory> history,
                                             List<String> reasoning) {
        if (history.isEmpty()) {
            reasoning.add("No significant history for " + organization + " (score: " + num(NEUTRAL_HISTORY_SCORE) + ")");
            return NEUTRAL_HISTORY_SCORE;
        }
        OrganizationHistory h = history.get();
        double raw = (h.successRate() - 50) * config.getHistorySuccessRateMultiplier();
        double capped = clamp(raw, -config.getHistoryMaxAdjustment(), config.getHistoryMaxAdjustment());
        double score = NEUTRAL_HISTORY_SCORE + capped;
        reasoning.add(String.format(Locale.ROOT, "%s history: %.1f%% success rate (%s adjustment, score: %.1f)",
                organization, h.successRate(), signed(capped), score));
        return score;
    }

    double calculateEvaluationScore(InternalTracking t, List<String> reasoning) {
        int probability = t.getSuccessProbability();
        int confidence = t.getEvaluationConfidence() == null ? 0 : t.getEvaluationConfidence();
        double score = probability * 0.7 + confidence * 0.3;
        reasoning.add(String.format(Locale.ROOT, "Evaluation: %d%% success probability, %d%% confidence (score: %.1f)",
                probability, confidence, score));
        return score;
    }

    double valueBasedThreshold(long value) {
        if (value >= config.getTier3().getMinValue()) return config.getTier3().getThreshold();
        if (value >= config.getTier2().getMinValue()) return config.getTier2().getThreshold();
        return config.getTier1().getThreshold();
    }

    static RiskLevel calculateRiskLevel(InternalTracking t, double overall) {
        int complexity = t.getComplexityScore();
        int redFlags = t.redFlagCount();
        if (overall >= 75 && complexity <= 5 && redFlags == 0) return RiskLevel.LOW;
        if (overall >= 60 && complexity <= 7 && redFlags <= 2) return RiskLevel.MEDIUM;
        return RiskLevel.HIGH;
    }

    double estimateSuccessRate(InternalTracking t, Optional<OrganizationHistory> history, double overall) {
        double rate = t.getSuccessProbability();
        if (history.isPresent()) {
            rate = rate * config.getDeclaredProbabilityWeight() + history.get().successRate() * config.getHistoryRateWeight();
        }
        rate += (overall - config.getScorePivot()) * config.getScoreAdjustmentFactor();
        return clamp(rate, 0, 100);
    }

    /**
     * History counts only once the organization has the configured minimum of attempts.
     */
    private Optional<OrganizationHistory> sufficientHistory(Bounty bounty, OrganizationHistorySnapshot snapshot) {
        if (snapshot == null) return Optional.empty();
        return snapshot.find(bounty.getOrganization())
                .filter(h -> h.totalAttempts() >= config.getHistoryMinAttempts());
    }

    // ========== Helpers ==========

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static String code(String c) {
        return c == null ? "unknown" : c;
    }

    private static String signed(double v) {
        return String.format(Locale.ROOT, "%s%.1f", v >= 0 ? "+" : "", v);
    }

    private static String num(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.format(Locale.ROOT, "%.1f", v);
    }
}
