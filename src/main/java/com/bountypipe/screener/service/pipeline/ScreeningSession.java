package com.bountypipe.screener.service.pipeline;

import com.bountypipe.screener.common.Result;
import com.bountypipe.screener.common.exception.BaseScreeningException;
import com.bountypipe.screener.dto.DecisionResult;
import com.bountypipe.screener.dto.EvaluationOutcome;
import com.bountypipe.screener.dto.QualityGateResult;
import com.bountypipe.screener.dto.QuickEvaluationResult;
import com.bountypipe.screener.dto.SessionMetrics;
import com.bountypipe.screener.enums.ImplementationStatus;
import com.bountypipe.screener.enums.RiskTolerance;
import com.bountypipe.screener.model.Bounty;
import com.bountypipe.screener.model.InternalTracking;
import com.bountypipe.screener.service.analytics.PipelineAnalytics;
import com.bountypipe.screener.service.decision.DecisionService;
import com.bountypipe.screener.service.evaluation.EvaluationReportParser;
import com.bountypipe.screener.service.evaluation.QuickScoringService;
import com.bountypipe.screener.service.history.OrganizationHistorySnapshot;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One screening run over a fixed history snapshot. Every record is processed in
 * isolation: a failure is reported as a failed {@link Result} and the batch continues.
 * <p>
 * Records are updated in place; callers own the bounty objects.
 */
@Slf4j
public class ScreeningSession {

    private final QuickScoringService quickScoring;
    private final EvaluationReportParser reportParser;
    private final DecisionService decisionService;
    @Getter
    private final OrganizationHistorySnapshot history;
    @Getter
    private final PipelineAnalytics analytics;
    private final RiskTolerance tolerance;
    private final int maxImplementations;
    private final Clock clock;

    private final Map<Bounty, DecisionResult> decided = new IdentityHashMap<>();

    ScreeningSession(QuickScoringService quickScoring, EvaluationReportParser reportParser, DecisionService decisionService,
                     OrganizationHistorySnapshot history, PipelineAnalytics analytics, RiskTolerance tolerance,
                     int maxImplementations, Clock clock) {
        this.quickScoring = quickScoring;
        this.reportParser = reportParser;
        this.decisionService = decisionService;
        this.history = history;
        this.analytics = analytics;
        this.tolerance = tolerance;
        this.maxImplementations = maxImplementations;
        this.clock = clock;
    }

    public String getSessionId() {
        return analytics.getSessionId();
    }

    /**
     * Quick-scores each record and writes the outcome into its tracking block.
     *
     * @return one result per input record, in input order
     */
    public List<Result<QuickEvaluationResult>> quickScreen(List<Bounty> bounties) {
        List<Result<QuickEvaluationResult>> out = new ArrayList<>(bounties.size());
        for (int i = 0; i < bounties.size(); i++) {
            Bounty b = bounties.get(i);
            try {
                QuickEvaluationResult r = quickScoring.evaluate(b);
                quickScoring.applyTo(b, r);
                out.add(Result.ok(r));
            } catch (BaseScreeningException e) {
                log.warn("quick screen skipped record #{} ({}): [{}] {}", i, b == null ? null : b.getId(),
                        e.getErrorCode(), e.getMessage());
                out.add(Result.fail(e));
            }
        }
        return out;
    }

    /**
     * Applies an external evaluation report (JSON block or free text) to the record.
     */
    public EvaluationOutcome applyEvaluationReport(Bounty bounty, String reportText) {
        EvaluationOutcome outcome = reportParser.parse(reportText);
        reportParser.applyTo(bounty, outcome);
        return outcome;
    }

    public List<Result<DecisionResult>> decideAll(List<Bounty> bounties) {
        List<Result<DecisionResult>> results = decisionService.decideAll(bounties, history, tolerance);
        for (int i = 0; i < bounties.size(); i++) {
            Bounty b = bounties.get(i);
            Result<DecisionResult> r = results.get(i);
            if (r.isOk()) {
                analytics.trackDecision(b, r.get());
                synchronized (decided) {
                    decided.put(b, r.get());
                }
            }
        }
        return results;
    }

    /**
     * Approved bounties from {@link #decideAll}, highest confidence first, capped at the
     * configured maximum.
     */
    public List<Bounty> selectForImplementation() {
        List<Map.Entry<Bounty, DecisionResult>> approved = new ArrayList<>();
        synchronized (decided) {
            for (Map.Entry<Bounty, DecisionResult> e : decided.entrySet()) {
                if (e.getValue().shouldImplement()) approved.add(e);
            }
        }
        approved.sort(Map.Entry.<Bounty, DecisionResult>comparingByValue(
                Comparator.comparingDouble(DecisionResult::confidence).reversed())
                .thenComparing(e -> e.getKey().getId()));
        List<Bounty> selected = approved.stream().limit(maxImplementations).map(Map.Entry::getKey).toList();
        log.info("selected {} of {} approved bounties for implementation", selected.size(), approved.size());
        return selected;
    }

    public Optional<DecisionResult> decisionFor(Bounty bounty) {
        synchronized (decided) {
            return Optional.ofNullable(decided.get(bounty));
        }
    }

    public String startImplementation(Bounty bounty) {
        bounty.getInternal().setImplementationStatus(ImplementationStatus.IN_PROGRESS);
        return analytics.trackImplementationStart(bounty);
    }

    /**
     * Records the result of an implementation attempt on the bounty and in the analytics.
     *
     * @param readyForSubmission whether the produced change passed review and may be submitted
     */
    public void recordImplementationOutcome(String trackingId, Bounty bounty, Duration duration, boolean readyForSubmission) {
        InternalTracking t = bounty.getInternal();
        if (readyForSubmission) {
            t.setImplementationStatus(ImplementationStatus.COMPLETED);
            t.setReadyForSubmission(true);
            t.setImplementationCompletedAt(clock.instant());
        } else {
            t.setImplementationStatus(ImplementationStatus.FAILED);
            t.setReadyForSubmission(false);
        }
        analytics.trackImplementationComplete(trackingId, bounty, duration, t.isSuccessfulImplementation());
    }

    public void recordQualityGates(Bounty bounty, QualityGateResult result) {
        analytics.trackQualityGates(bounty, result);
    }

    /**
     * Generates the session metrics, logs the summary and persists them when enabled.
     */
    public SessionMetrics finish() {
        SessionMetrics metrics = analytics.generateMetrics();
        analytics.printSummary(metrics);
        analytics.saveMetrics(metrics);
        return metrics;
    }
}
