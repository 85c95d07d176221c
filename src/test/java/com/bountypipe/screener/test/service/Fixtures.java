package com.bountypipe.screener.test.service;

import com.bountypipe.screener.config.DecisionEngineProperties;
import com.bountypipe.screener.config.HistoryProperties;
import com.bountypipe.screener.config.QuickScoringProperties;
import com.bountypipe.screener.config.SignalCatalogProperties;
import com.bountypipe.screener.enums.EvaluationStatus;
import com.bountypipe.screener.enums.GoNoGo;
import com.bountypipe.screener.enums.ImplementationStatus;
import com.bountypipe.screener.model.Bounty;
import com.bountypipe.screener.model.InternalTracking;
import com.bountypipe.screener.service.decision.DecisionService;
import com.bountypipe.screener.service.evaluation.QuickScoringService;
import com.bountypipe.screener.service.history.OrganizationHistoryService;
import com.bountypipe.screener.service.signals.SignalCatalog;
import com.bountypipe.screener.service.signals.SignalExtractor;
import com.bountypipe.screener.service.validation.BountyValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared builders for service tests. Services are wired by hand with default properties.
 */
final class Fixtures {

    static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private Fixtures() {
    }

    static Clock fixedClock() {
        return Clock.fixed(T0, ZoneOffset.UTC);
    }

    static ObjectMapper mapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    static SignalExtractor extractor() {
        return new SignalExtractor(SignalCatalog.defaults(), new SignalCatalogProperties());
    }

    static QuickScoringService quickScoring() {
        return new QuickScoringService(extractor(), new BountyValidator(), new QuickScoringProperties(), fixedClock());
    }

    static DecisionService decisionService() {
        return new DecisionService(new DecisionEngineProperties(), new BountyValidator());
    }

    static OrganizationHistoryService historyService(boolean strict) {
        HistoryProperties props = new HistoryProperties();
        props.setStrictIngestion(strict);
        return new OrganizationHistoryService(new BountyValidator(), props);
    }

    static Bounty bounty(String id, String org, long reward) {
        return Bounty.builder()
                .id(id)
                .title("Add retry option to the CLI")
                .body("The command should accept a --retry flag.")
                .organization(org)
                .rewardAmount(reward)
                .build();
    }

    /**
     * A record already rated GO by an evaluation, ready for a decision.
     */
    static Bounty evaluated(String id, String org, long reward, int complexity, int probability, int confidence) {
        return bounty(id, org, reward).toBuilder()
                .internal(InternalTracking.builder()
                        .evaluationStatus(EvaluationStatus.EVALUATED)
                        .goNoGo(GoNoGo.GO)
                        .complexityScore(complexity)
                        .successProbability(probability)
                        .evaluationConfidence(confidence)
                        .build())
                .build();
    }

    /**
     * {@code attempts} past attempts for {@code org}, the first {@code successes} of them successful.
     */
    static List<Bounty> pastAttempts(String org, int attempts, int successes) {
        List<Bounty> out = new ArrayList<>();
        for (int i = 0; i < attempts; i++) {
            boolean ok = i < successes;
            Bounty b = bounty(org + "-past-" + i, org, 20_000);
            b.getInternal().setImplementationStatus(ok ? ImplementationStatus.COMPLETED : ImplementationStatus.FAILED);
            b.getInternal().setReadyForSubmission(ok);
            if (ok) b.getInternal().setImplementationCompletedAt(T0.minusSeconds(3600L * (i + 1)));
            out.add(b);
        }
        return out;
    }
}
