package com.bountypipe.screener.service.pipeline;

import com.bountypipe.screener.config.AnalyticsProperties;
import com.bountypipe.screener.config.PipelineProperties;
import com.bountypipe.screener.enums.RiskTolerance;
import com.bountypipe.screener.model.Bounty;
import com.bountypipe.screener.service.analytics.PipelineAnalytics;
import com.bountypipe.screener.service.decision.DecisionService;
import com.bountypipe.screener.service.evaluation.EvaluationReportParser;
import com.bountypipe.screener.service.evaluation.QuickScoringService;
import com.bountypipe.screener.service.history.OrganizationHistoryService;
import com.bountypipe.screener.service.history.OrganizationHistorySnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;

/**
 * Entry point for a screening run. Builds the organization history from the corpus once
 * and hands back a {@link ScreeningSession} that owns its own analytics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScreeningPipeline {

    private final QuickScoringService quickScoring;
    private final EvaluationReportParser reportParser;
    private final OrganizationHistoryService historyService;
    private final DecisionService decisionService;
    private final PipelineProperties pipelineProps;
    private final AnalyticsProperties analyticsProps;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ScreeningSession openSession(Collection<Bounty> corpus) {
        return openSession(corpus, null);
    }

    /**
     * @param tolerance risk tolerance for every decision in the session; null selects the configured default
     */
    public ScreeningSession openSession(Collection<Bounty> corpus, RiskTolerance tolerance) {
        OrganizationHistorySnapshot history = historyService.build(corpus);
        PipelineAnalytics analytics = new PipelineAnalytics(analyticsProps, mapper, clock);
        log.info("session {} opened: {} records, {} organizations", analytics.getSessionId(), corpus.size(), history.size());
        return new ScreeningSession(quickScoring, reportParser, decisionService, history, analytics, tolerance,
                pipelineProps.getMaxImplementations(), clock);
    }
}
