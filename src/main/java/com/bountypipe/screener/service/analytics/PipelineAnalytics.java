package com.bountypipe.screener.service.analytics;

import com.bountypipe.screener.common.exception.MetricsPersistenceException;
import com.bountypipe.screener.config.AnalyticsProperties;
import com.bountypipe.screener.dto.DecisionResult;
import com.bountypipe.screener.dto.QualityGateResult;
import com.bountypipe.screener.dto.SessionMetrics;
import com.bountypipe.screener.model.Bounty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Session-scoped observer of decisions and implementation outcomes.
 * <p>
 * {@code track*} calls only append to internal lists and may come from several worker
 * threads; they are serialized on a single lock. {@link #generateMetrics()} is a pure
 * aggregation over those lists: with no tracking in between, two calls return equal
 * snapshots. The snapshot time is the instant of the last tracked event, not the wall clock.
 */
@Slf4j
public class PipelineAnalytics {

    private static final DateTimeFormatter SESSION_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final double CAUTION_CONFIDENCE_FLOOR = 30;

    private final AnalyticsProperties config;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String sessionId;
    private final Instant sessionStart;

    private final Object lock = new Object();
    private final List<TrackedDecision> decisions = new ArrayList<>();
    private final Map<String, Instant> openImplementations = new HashMap<>();
    private final List<ImplementationOutcome> implementations = new ArrayList<>();
    private final List<QualityGateResult> qualityResults = new ArrayList<>();
    private Instant lastActivity;

    public PipelineAnalytics(AnalyticsProperties config, ObjectMapper mapper, Clock clock) {
        this.config = config;
        this.mapper = mapper;
        this.clock = clock;
        this.sessionStart = clock.instant();
        this.lastActivity = sessionStart;
        this.sessionId = SESSION_DATE.format(sessionStart) + "-" + randomBase36(8);
        log.info("Analytics enabled - session {}", sessionId);
    }

    public String getSessionId() {
        return sessionId;
    }

    // ========== Tracking ==========

    public void trackDecision(Bounty bounty, DecisionResult decision) {
        synchronized (lock) {
            decisions.add(new TrackedDecision(bounty.getId(), bounty.getRewardAmount() == null ? 0L : bounty.getRewardAmount(), decision));
            touch();
        }
        if (config.isEnableRealtimeLogging()) {
            log.info("decision tracked: {} -> {} ({}%)", bounty.getTitle(),
                    decision.shouldImplement() ? "IMPLEMENT" : "SKIP", fmt1(decision.confidence()));
        }
    }

    /**
     * @return tracking id to hand back to {@link #trackImplementationComplete}
     */
    public String trackImplementationStart(Bounty bounty) {
        String trackingId = "impl_" + clock.millis() + "_" + randomBase36(9);
        synchronized (lock) {
            openImplementations.put(trackingId, clock.instant());
            touch();
        }
        if (config.isEnableRealtimeLogging()) {
            log.info("implementation started: {} [{}]", bounty.getTitle(), trackingId);
        }
        return trackingId;
    }

    /**
     * Completion with the duration measured from the matching start call.
     */
    public void trackImplementationComplete(String trackingId, Bounty bounty, boolean success) {
        Instant started;
        synchronized (lock) {
            started = openImplementations.get(trackingId);
        }
        Duration duration;
        if (started == null) {
            log.warn("no open implementation for tracking id {} (bounty {}): recording zero duration", trackingId, bounty.getId());
            duration = Duration.ZERO;
        } else {
            duration = Duration.between(started, clock.instant());
        }
        trackImplementationComplete(trackingId, bounty, duration, success);
    }

    public void trackImplementationComplete(String trackingId, Bounty bounty, Duration duration, boolean success) {
        long reward = bounty.getRewardAmount() == null ? 0L : bounty.getRewardAmount();
        synchronized (lock) {
            openImplementations.remove(trackingId);
            implementations.add(new ImplementationOutcome(trackingId, bounty.getId(), reward, duration.toMillis(), success));
            touch();
        }
        if (config.isEnableRealtimeLogging()) {
            log.info("implementation complete: {} -> {} ({}s) [{}]", bounty.getTitle(),
                    success ? "SUCCESS" : "FAILED", duration.toSeconds(), trackingId);
        }
    }

    public void trackQualityGates(Bounty bounty, QualityGateResult result) {
        if (!config.isTrackQualityMetrics()) return;
        synchronized (lock) {
            qualityResults.add(result);
            touch();
        }
        if (config.isEnableRealtimeLogging()) {
            log.info("quality gates: {} -> {} ({}/100)", bounty.getTitle(), result.passed() ? "PASS" : "FAIL", fmt1(result.score()));
        }
    }

    // ========== Aggregation ==========

    public SessionMetrics generateMetrics() {
        List<TrackedDecision> ds;
        List<ImplementationOutcome> impls;
        List<QualityGateResult> qs;
        Instant asOf;
        synchronized (lock) {
            ds = List.copyOf(decisions);
            impls = List.copyOf(implementations);
            qs = List.copyOf(qualityResults);
            asOf = lastActivity;
        }

        long runtimeMs = Duration.between(sessionStart, asOf).toMillis();
        double runtimeMinutes = runtimeMs / 60_000.0;

        // Decisions
        int go = 0, caution = 0, noGo = 0;
        double confidenceSum = 0, thresholdSum = 0;
        for (TrackedDecision d : ds) {
            DecisionResult r = d.decision();
            if (r.shouldImplement()) go++;
            else if (r.confidence() >= CAUTION_CONFIDENCE_FLOOR) caution++;
            else noGo++;
            confidenceSum += r.confidence();
            thresholdSum += r.thresholdUsed();
        }
        SessionMetrics.Decisions decisionMetrics = new SessionMetrics.Decisions(ds.size(), go, caution, noGo,
                average(confidenceSum, ds.size()), average(thresholdSum, ds.size()));

        // Implementations
        int successful = (int) impls.stream().filter(ImplementationOutcome::success).count();
        int failed = impls.size() - successful;
        int attempted = impls.size();
        double successRate = attempted > 0 ? successful * 100.0 / attempted : 0;
        double avgDurationMs = average(impls.stream().mapToLong(ImplementationOutcome::durationMs).sum(), attempted);
        double cost = estimateCost(attempted, avgDurationMs);
        SessionMetrics.Implementations implMetrics = new SessionMetrics.Implementations(
                attempted, successful, failed, successRate, avgDurationMs, cost);

        // Quality gates
        int qPassed = (int) qs.stream().filter(QualityGateResult::passed).count();
        int qFailed = qs.size() - qPassed;
        double avgQuality = average(qs.stream().mapToDouble(QualityGateResult::score).sum(), qs.size());
        SessionMetrics.QualityGates qualityMetrics = new SessionMetrics.QualityGates(
                config.isTrackQualityMetrics(), qs.size(), qPassed, qFailed, avgQuality, commonBlockers(qs));

        // Value
        long totalValue = ds.stream().mapToLong(TrackedDecision::rewardAmount).sum();
        long successfulValue = impls.stream().filter(ImplementationOutcome::success).mapToLong(ImplementationOutcome::rewardAmount).sum();
        double roi = cost > 0 ? round2((successfulValue / 100.0) / cost) : 0;
        int low = 0, medium = 0, high = 0;
        for (TrackedDecision d : ds) {
            if (d.rewardAmount() < config.getMediumValueFloor()) low++;
            else if (d.rewardAmount() < config.getHighValueFloor()) medium++;
            else high++;
        }
        SessionMetrics.ValueAnalysis valueMetrics = new SessionMetrics.ValueAnalysis(totalValue, successfulValue, roi,
                average(totalValue, ds.size()), new SessionMetrics.ValueDistribution(low, medium, high));

        // Performance
        double evaluationsPerMinute = runtimeMinutes > 0 ? ds.size() / runtimeMinutes : 0;
        double implementationsPerHour = runtimeMinutes > 0 ? attempted / runtimeMinutes * 60 : 0;
        SessionMetrics.Performance performance = new SessionMetrics.Performance(evaluationsPerMinute, implementationsPerHour,
                parallelEfficiency(attempted), identifyBottlenecks(avgDurationMs, attempted, successRate, qs.size(), qFailed));

        return SessionMetrics.builder()
                .sessionId(sessionId)
                .asOf(asOf)
                .totalRuntimeMs(runtimeMs)
                .bountiesProcessed(ds.size())
                .decisions(decisionMetrics)
                .implementations(implMetrics)
                .qualityGates(qualityMetrics)
                .performance(performance)
                .valueAnalysis(valueMetrics)
                .build();
    }

    /**
     * Rough cost approximation: a flat amount per attempt, scaled up when the average
     * attempt runs longer than the baseline. Never a billing figure.
     */
    double estimateCost(int attempts, double avgDurationMs) {
        double base = attempts * config.getCostPerAttempt();
        double multiplier = Math.max(1.0, avgDurationMs / config.getCostDurationBaseline().toMillis());
        return round2(base * multiplier);
    }

    List<String> identifyBottlenecks(double avgDurationMs, int attempted, double successRate, int qualityChecked, int qualityFailed) {
        List<String> bottlenecks = new ArrayList<>();
        Duration ceiling = config.getDurationCeiling();
        if (avgDurationMs > ceiling.toMillis()) {
            bottlenecks.add("Implementation duration exceeds " + ceiling.toMinutes() + " minutes on average");
        }
        if (attempted > 0 && successRate < config.getSuccessRateFloor()) {
            bottlenecks.add("Implementation success rate below " + fmt0(config.getSuccessRateFloor()) + "%");
        }
        double qualityFailureRate = qualityChecked > 0 ? qualityFailed * 100.0 / qualityChecked : 0;
        if (qualityFailureRate > config.getQualityFailureCeiling()) {
            bottlenecks.add("Quality gate failure rate above " + fmt0(config.getQualityFailureCeiling()) + "%");
        }
        return bottlenecks;
    }

    private List<String> commonBlockers(List<QualityGateResult> qs) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (QualityGateResult q : qs) {
            for (String blocker : q.blockers()) counts.merge(blocker, 1, Integer::sum);
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(config.getCommonBlockersLimit())
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Heuristic only: no per-worker timing is collected.
     */
    private static double parallelEfficiency(int implementationCount) {
        if (implementationCount < 2) return 0;
        return Math.min(85, 50 + implementationCount * 5);
    }

    // ========== Presentation ==========

    /**
     * Writes {@code pipeline-metrics-<sessionId>.json} under the configured output path.
     *
     * @return the written file, or empty when saving is disabled
     */
    public Optional<Path> saveMetrics(SessionMetrics metrics) {
        if (!config.isSaveMetricsToFile()) return Optional.empty();
        return Optional.of(saveMetrics(metrics, Path.of(config.getMetricsOutputPath())));
    }

    /**
     * Writes the snapshot into {@code directory}, creating it when missing.
     *
     * @throws MetricsPersistenceException when the file cannot be written
     */
    public Path saveMetrics(SessionMetrics metrics, Path directory) {
        SessionMetrics finalMetrics = metrics == null ? generateMetrics() : metrics;
        Path file = directory.resolve("pipeline-metrics-" + finalMetrics.sessionId() + ".json");
        try {
            Files.createDirectories(directory);
            Files.writeString(file, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(finalMetrics));
        } catch (IOException e) {
            log.error("Failed to save metrics to {}", file, e);
            throw new MetricsPersistenceException("Failed to save metrics to " + file, e);
        }
        log.info("Metrics saved to: {}", file);
        return file;
    }

    public void printSummary(SessionMetrics metrics) {
        SessionMetrics m = metrics == null ? generateMetrics() : metrics;
        log.info("PIPELINE ANALYTICS SUMMARY - session {}", m.sessionId());
        log.info("Runtime: {}s, bounties processed: {}", m.totalRuntimeMs() / 1000, m.bountiesProcessed());
        log.info("Decisions: total={}, go={}, caution={}, no-go={}, avg confidence={}%",
                m.decisions().totalEvaluated(), m.decisions().goDecisions(), m.decisions().cautionDecisions(),
                m.decisions().noGoDecisions(), fmt1(m.decisions().averageConfidence()));
        log.info("Implementations: attempted={}, successful={}, success rate={}%, avg duration={}s",
                m.implementations().attempted(), m.implementations().successful(),
                fmt1(m.implementations().successRate()), Math.round(m.implementations().averageDurationMs() / 1000));
        if (m.qualityGates().enabled()) {
            log.info("Quality gates: checked={}, passed={}, avg score={}/100",
                    m.qualityGates().totalChecked(), m.qualityGates().passed(), fmt1(m.qualityGates().averageScore()));
        }
        log.info("Performance: {} evaluations/min, {} implementations/hour",
                fmt1(m.performance().evaluationsPerMinute()), fmt1(m.performance().implementationsPerHour()));
        log.info("Value: total ${}, implemented ${}, estimated cost ~${}, estimated ROI ~{}x",
                fmt2(m.valueAnalysis().totalBountyValue() / 100.0), fmt2(m.valueAnalysis().successfullyImplementedValue() / 100.0),
                fmt2(m.implementations().totalCostEstimate()), fmt2(m.valueAnalysis().roiEstimate()));
        for (String b : m.performance().bottlenecks()) {
            log.warn("Bottleneck: {}", b);
        }
    }

    // ========== Helpers ==========

    private void touch() {
        Instant now = clock.instant();
        if (now.isAfter(lastActivity)) lastActivity = now;
    }

    private static double average(double sum, int n) {
        return n > 0 ? sum / n : 0;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static String fmt0(double v) {
        return String.format(Locale.ROOT, "%.0f", v);
    }

    private static String fmt1(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }

    private static String fmt2(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }

    private static String randomBase36(int length) {
        StringBuilder sb = new StringBuilder(length);
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        for (int i = 0; i < length; i++) sb.append(Character.forDigit(rnd.nextInt(36), 36));
        return sb.toString();
    }

    private record TrackedDecision(String bountyId, long rewardAmount, DecisionResult decision) {
    }

    private record ImplementationOutcome(String trackingId, String bountyId, long rewardAmount, long durationMs, boolean success) {
    }
}
