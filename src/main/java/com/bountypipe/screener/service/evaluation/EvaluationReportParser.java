package com.bountypipe.screener.service.evaluation;

import com.bountypipe.screener.dto.EvaluationOutcome;
import com.bountypipe.screener.enums.EvaluationStatus;
import com.bountypipe.screener.enums.GoNoGo;
import com.bountypipe.screener.enums.RiskLevel;
import com.bountypipe.screener.model.Bounty;
import com.bountypipe.screener.model.InternalTracking;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the free-form report of an external evaluation step. Prefers the fenced
 * {@code ```json} summary block; falls back to loose text patterns when the block is
 * absent or unparseable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvaluationReportParser {

    private static final Pattern JSON_BLOCK = Pattern.compile("```json\\s*([\\s\\S]*?)\\s*```", Pattern.CASE_INSENSITIVE);
    private static final Pattern VERDICT = Pattern.compile("(?:decision|recommendation|status).*?:\\s*(go|no-go|caution)", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPLEXITY = Pattern.compile("complexity.*?(\\d+)/10", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROBABILITY = Pattern.compile("(?:success|probability).*?(\\d+)%", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONFIDENCE = Pattern.compile("confidence.*?(\\d+)%", Pattern.CASE_INSENSITIVE);
    private static final Pattern RISK = Pattern.compile("risk.*?level.*?:\\s*(low|medium|high)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIMELINE = Pattern.compile("(?:timeline|estimate).*?:\\s*([^\\n]+)", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> RED_FLAG_LINES = List.of(
            Pattern.compile("red flag[s]?.*?:?\\s*([^\\n]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("warning[s]?.*?:?\\s*([^\\n]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("risk[s]?.*?:?\\s*([^\\n]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("concern[s]?.*?:?\\s*([^\\n]+)", Pattern.CASE_INSENSITIVE)
    );

    private static final int DEFAULT_COMPLEXITY = 5;
    private static final int DEFAULT_PROBABILITY = 50;
    private static final int MAX_RED_FLAGS = 5;
    private static final int MIN_RED_FLAG_LENGTH = 10;

    private final ObjectMapper mapper;
    private final Clock clock;

    public EvaluationOutcome parse(String evaluationText) {
        String text = evaluationText == null ? "" : evaluationText;
        Matcher json = JSON_BLOCK.matcher(text);
        if (json.find()) {
            try {
                return fromJson(mapper.readTree(json.group(1)));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("evaluation summary block unreadable, using text analysis: {}", e.getMessage());
            }
        }
        return fromText(text);
    }

    /**
     * Records an external evaluation on the bounty's tracking block.
     */
    public void applyTo(Bounty bounty, EvaluationOutcome outcome) {
        InternalTracking t = bounty.getInternal();
        t.setEvaluationStatus(EvaluationStatus.EVALUATED);
        t.setGoNoGo(outcome.goNoGo());
        t.setComplexityScore(outcome.complexityScore());
        t.setSuccessProbability(outcome.successProbability());
        t.setEvaluationConfidence(outcome.evaluationConfidence());
        t.setRiskLevel(outcome.riskLevel());
        t.setRedFlags(new ArrayList<>(outcome.redFlags()));
        t.setEstimatedTimeline(outcome.estimatedTimeline());
        t.setNotes(outcome.notes());
        t.setEvaluationMethod("external");
        t.setLastEvaluated(clock.instant());
    }

    private EvaluationOutcome fromJson(JsonNode node) {
        if (node == null || !node.isObject()) throw new IllegalArgumentException("summary is not a JSON object");
        List<String> flags = new ArrayList<>();
        node.path("red_flags").forEach(f -> flags.add(f.asText()));
        return EvaluationOutcome.builder()
                .goNoGo(node.hasNonNull("go_no_go") ? GoNoGo.fromCode(node.get("go_no_go").asText()) : GoNoGo.CAUTION)
                .complexityScore(clamp(node.path("complexity_score").asInt(DEFAULT_COMPLEXITY), 1, 10))
                .successProbability(clamp(node.path("success_probability").asInt(DEFAULT_PROBABILITY), 0, 100))
                .evaluationConfidence(node.hasNonNull("evaluation_confidence")
                        ? clamp(node.get("evaluation_confidence").asInt(), 0, 100) : null)
                .riskLevel(riskOrMedium(node.path("risk_level").asText(null)))
                .redFlags(flags)
                .estimatedTimeline(node.path("estimated_timeline").asText("Unknown"))
                .notes(node.path("decision_rationale").asText("Automated external evaluation"))
                .structured(true)
                .build();
    }

    private static RiskLevel riskOrMedium(String code) {
        RiskLevel r = RiskLevel.fromCode(code);
        return r == null ? RiskLevel.MEDIUM : r;
    }

    private EvaluationOutcome fromText(String text) {
        String verdict = group(VERDICT, text);
        String complexity = group(COMPLEXITY, text);
        String probability = group(PROBABILITY, text);
        String confidence = group(CONFIDENCE, text);
        String risk = group(RISK, text);
        String timeline = group(TIMELINE, text);

        return EvaluationOutcome.builder()
                .goNoGo(verdict == null ? GoNoGo.CAUTION : GoNoGo.fromCode(verdict.toLowerCase(Locale.ROOT)))
                .complexityScore(clamp(complexity == null ? DEFAULT_COMPLEXITY : parseInt(complexity, DEFAULT_COMPLEXITY), 1, 10))
                .successProbability(clamp(probability == null ? DEFAULT_PROBABILITY : parseInt(probability, DEFAULT_PROBABILITY), 0, 100))
                .evaluationConfidence(confidence == null ? null : clamp(parseInt(confidence, 0), 0, 100))
                .riskLevel(riskOrMedium(risk))
                .redFlags(extractRedFlags(text))
                .estimatedTimeline(timeline == null ? "Unknown" : timeline.trim())
                .notes("Automated external evaluation (text analysis)")
                .structured(false)
                .build();
    }

    static List<String> extractRedFlags(String text) {
        Set<String> flags = new LinkedHashSet<>();
        for (Pattern p : RED_FLAG_LINES) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                String candidate = m.group(1).trim();
                if (candidate.length() > MIN_RED_FLAG_LENGTH) flags.add(candidate);
            }
        }
        return flags.stream().limit(MAX_RED_FLAGS).toList();
    }

    private static String group(Pattern p, String text) {
        Matcher m = p.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    private static int parseInt(String s, int fallback) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            // digits overflowing int
            return fallback;
        }
    }

    private static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
