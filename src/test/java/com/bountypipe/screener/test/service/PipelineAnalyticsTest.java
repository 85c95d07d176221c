package com.bountypipe.screener.test.service;

import com.bountypipe.screener.common.exception.MetricsPersistenceException;
import com.bountypipe.screener.config.AnalyticsProperties;
import com.bountypipe.screener.dto.DecisionFactors;
import com.bountypipe.screener.dto.DecisionResult;
import com.bountypipe.screener.dto.QualityGateResult;
import com.bountypipe.screener.dto.SessionMetrics;
import com.bountypipe.screener.enums.RiskLevel;
import com.bountypipe.screener.model.Bounty;
import com.bountypipe.screener.service.analytics.PipelineAnalytics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PipelineAnalyticsTest {

    private final ObjectMapper mapper = Fixtures.mapper();

    private static AnalyticsProperties quietProps() {
        AnalyticsProperties p = new AnalyticsProperties();
        p.setEnableRealtimeLogging(false);
        p.setSaveMetricsToFile(false);
        return p;
    }

    private static DecisionResult decision(String id, boolean implement, double confidence, double threshold) {
        return DecisionResult.builder()
                .bountyId(id)
                .shouldImplement(implement)
                .gatePassed(confidence > 0)
                .confidence(confidence)
                .thresholdUsed(threshold)
                .riskLevel(RiskLevel.MEDIUM)
                .reasoning(List.of())
                .decisionFactors(DecisionFactors.none())
                .build();
    }

    private PipelineAnalytics populated(AnalyticsProperties props) {
        PipelineAnalytics a = new PipelineAnalytics(props, mapper, Fixtures.fixedClock());
        Bounty high = Fixtures.bounty("b-high", "acme", 300_000);
        Bounty medium = Fixtures.bounty("b-medium", "acme", 150_000);
        Bounty low = Fixtures.bounty("b-low", "acme", 20_000);

        a.trackDecision(medium, decision("b-medium", true, 72.0, 50));
        a.trackDecision(low, decision("b-low", false, 57.0, 60));
        a.trackDecision(high, decision("b-high", false, 0, 0));

        String t1 = a.trackImplementationStart(medium);
        a.trackImplementationComplete(t1, medium, Duration.ofMinutes(4), true);
        String t2 = a.trackImplementationStart(low);
        a.trackImplementationComplete(t2, low, Duration.ofMinutes(8), false);

        a.trackQualityGates(medium, new QualityGateResult(true, 90, List.of()));
        a.trackQualityGates(low, new QualityGateResult(false, 40, List.of("Tests failing", "Lint errors")));
        a.trackQualityGates(low, new QualityGateResult(false, 50, List.of("Tests failing")));
        return a;
    }

    @Test
    void aggregatesDecisionsImplementationsAndValue() {
        SessionMetrics m = populated(quietProps()).generateMetrics();

        assertThat(m.bountiesProcessed()).isEqualTo(3);
        assertThat(m.decisions().goDecisions()).isEqualTo(1);
        assertThat(m.decisions().cautionDecisions()).isEqualTo(1);
        assertThat(m.decisions().noGoDecisions()).isEqualTo(1);
        assertThat(m.decisions().averageConfidence()).isCloseTo(43.0, within(1e-9));
        assertThat(m.decisions().averageThresholdUsed()).isCloseTo(110.0 / 3, within(1e-9));

        assertThat(m.implementations().attempted()).isEqualTo(2);
        assertThat(m.implementations().successful()).isEqualTo(1);
        assertThat(m.implementations().failed()).isEqualTo(1);
        assertThat(m.implementations().successRate()).isEqualTo(50.0);
        assertThat(m.implementations().averageDurationMs()).isEqualTo(360_000.0);
        assertThat(m.implementations().totalCostEstimate()).isEqualTo(1.2);

        assertThat(m.valueAnalysis().totalBountyValue()).isEqualTo(470_000L);
        assertThat(m.valueAnalysis().successfullyImplementedValue()).isEqualTo(150_000L);
        assertThat(m.valueAnalysis().roiEstimate()).isEqualTo(1250.0);
        assertThat(m.valueAnalysis().valueDistribution()).isEqualTo(new SessionMetrics.ValueDistribution(1, 1, 1));

        assertThat(m.qualityGates().totalChecked()).isEqualTo(3);
        assertThat(m.qualityGates().passed()).isEqualTo(1);
        assertThat(m.qualityGates().averageScore()).isCloseTo(60.0, within(1e-9));
        assertThat(m.qualityGates().commonBlockers()).containsExactly("Tests failing", "Lint errors");

        assertThat(m.performance().parallelEfficiency()).isEqualTo(60.0);
        assertThat(m.performance().bottlenecks()).containsExactly("Quality gate failure rate above 30%");
    }

    @Test
    void generatingTwiceWithoutNewEventsIsIdentical() throws Exception {
        PipelineAnalytics a = populated(quietProps());

        SessionMetrics first = a.generateMetrics();
        SessionMetrics second = a.generateMetrics();

        assertThat(second).isEqualTo(first);
        assertThat(mapper.writeValueAsString(second)).isEqualTo(mapper.writeValueAsString(first));
    }

    @Test
    void ratesUseTimeOfLastActivity() {
        MutableClock clock = new MutableClock(Fixtures.T0);
        PipelineAnalytics a = new PipelineAnalytics(quietProps(), mapper, clock);
        Bounty b = Fixtures.bounty("b-1", "acme", 100_000);

        clock.advance(Duration.ofMinutes(1));
        a.trackDecision(b, decision("b-1", true, 80, 55));
        String id = a.trackImplementationStart(b);
        clock.advance(Duration.ofMinutes(3));
        a.trackImplementationComplete(id, b, true);
        clock.advance(Duration.ofHours(1));

        SessionMetrics m = a.generateMetrics();

        assertThat(m.asOf()).isEqualTo(Fixtures.T0.plus(Duration.ofMinutes(4)));
        assertThat(m.totalRuntimeMs()).isEqualTo(240_000L);
        assertThat(m.implementations().averageDurationMs()).isEqualTo(180_000.0);
        assertThat(m.performance().evaluationsPerMinute()).isCloseTo(0.25, within(1e-9));
        assertThat(m.performance().implementationsPerHour()).isCloseTo(15.0, within(1e-9));
        assertThat(m.performance().parallelEfficiency()).as("single implementation").isZero();
    }

    @Test
    void slowAndUnreliableImplementationsAreBottlenecks() {
        PipelineAnalytics a = new PipelineAnalytics(quietProps(), mapper, Fixtures.fixedClock());
        Bounty b = Fixtures.bounty("b-1", "acme", 100_000);

        a.trackImplementationComplete(a.trackImplementationStart(b), b, Duration.ofMinutes(12), false);
        a.trackImplementationComplete(a.trackImplementationStart(b), b, Duration.ofMinutes(14), false);

        SessionMetrics m = a.generateMetrics();

        assertThat(m.performance().bottlenecks()).containsExactly(
                "Implementation duration exceeds 10 minutes on average",
                "Implementation success rate below 50%");
        assertThat(m.implementations().totalCostEstimate()).isEqualTo(2.6);
        assertThat(m.valueAnalysis().roiEstimate()).isZero();
    }

    @Test
    void emptySessionHasNoBottlenecks() {
        SessionMetrics m = new PipelineAnalytics(quietProps(), mapper, Fixtures.fixedClock()).generateMetrics();

        assertThat(m.bountiesProcessed()).isZero();
        assertThat(m.implementations().successRate()).isZero();
        assertThat(m.implementations().totalCostEstimate()).isZero();
        assertThat(m.performance().bottlenecks()).isEmpty();
        assertThat(m.totalRuntimeMs()).isZero();
    }

    @Test
    void identifiersFollowTheirFormats() {
        PipelineAnalytics a = new PipelineAnalytics(quietProps(), mapper, Fixtures.fixedClock());

        assertThat(a.getSessionId()).matches("2025-03-01-[0-9a-z]{8}");
        assertThat(a.trackImplementationStart(Fixtures.bounty("b-1", "acme", 1)))
                .matches("impl_" + Fixtures.T0.toEpochMilli() + "_[0-9a-z]{9}");
    }

    @Test
    void qualityTrackingCanBeDisabled() {
        AnalyticsProperties props = quietProps();
        props.setTrackQualityMetrics(false);

        SessionMetrics m = populated(props).generateMetrics();

        assertThat(m.qualityGates().enabled()).isFalse();
        assertThat(m.qualityGates().totalChecked()).isZero();
        assertThat(m.performance().bottlenecks()).isEmpty();
    }

    @Test
    void savesMetricsAsJsonWhenEnabled(@TempDir Path dir) throws Exception {
        AnalyticsProperties props = quietProps();
        props.setSaveMetricsToFile(true);
        props.setMetricsOutputPath(dir.resolve("analytics").toString());
        PipelineAnalytics a = populated(props);

        Optional<Path> written = a.saveMetrics(a.generateMetrics());

        assertThat(written).isPresent();
        assertThat(written.get().getFileName().toString()).isEqualTo("pipeline-metrics-" + a.getSessionId() + ".json");
        String json = Files.readString(written.get());
        assertThat(json).contains("\"session_id\"", "\"value_analysis\"", "\"common_blockers\"");
    }

    @Test
    void saveIsSkippedWhenDisabled() {
        PipelineAnalytics a = populated(quietProps());

        assertThat(a.saveMetrics(a.generateMetrics())).isEmpty();
    }

    @Test
    void unwritableTargetRaisesPersistenceError(@TempDir Path dir) throws Exception {
        Path notADirectory = Files.writeString(dir.resolve("occupied"), "x");
        PipelineAnalytics a = populated(quietProps());

        assertThatThrownBy(() -> a.saveMetrics(a.generateMetrics(), notADirectory))
                .isInstanceOf(MetricsPersistenceException.class)
                .satisfies(e -> assertThat(((MetricsPersistenceException) e).getErrorCode()).isEqualTo("ERR-IO-001"));
    }

    @Test
    void completionWithUnknownTrackingIdCountsWithZeroDuration() {
        MutableClock clock = new MutableClock(Fixtures.T0);
        PipelineAnalytics a = new PipelineAnalytics(quietProps(), mapper, clock);
        Bounty b = Fixtures.bounty("b-1", "acme", 100_000);

        String id = a.trackImplementationStart(b);
        clock.advance(Duration.ofMinutes(2));
        a.trackImplementationComplete(id, b, true);
        a.trackImplementationComplete(id, b, true);
        a.trackImplementationComplete("impl_unknown", b, false);

        SessionMetrics m = a.generateMetrics();
        assertThat(m.implementations().attempted()).isEqualTo(3);
        assertThat(m.implementations().successful()).isEqualTo(2);
        assertThat(m.implementations().averageDurationMs()).isCloseTo(40_000.0, within(1e-9));
    }

    @Test
    void concurrentTrackingLosesNoEvents() throws Exception {
        PipelineAnalytics a = new PipelineAnalytics(quietProps(), mapper, Fixtures.fixedClock());
        int n = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < n; i++) {
            String id = "b-" + i;
            pool.submit(() -> {
                Bounty b = Fixtures.bounty(id, "acme", 10_000);
                a.trackDecision(b, decision(id, true, 70.0, 60));
                String trackingId = a.trackImplementationStart(b);
                a.trackImplementationComplete(trackingId, b, true);
            });
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        SessionMetrics m = a.generateMetrics();
        assertThat(m.bountiesProcessed()).isEqualTo(n);
        assertThat(m.decisions().goDecisions()).isEqualTo(n);
        assertThat(m.implementations().attempted()).isEqualTo(n);
        assertThat(m.implementations().successful()).isEqualTo(n);
    }
}
