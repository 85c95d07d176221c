package com.bountypipe.screener.service.signals;

import com.bountypipe.screener.config.SignalCatalogProperties;
import com.bountypipe.screener.dto.SignalBundle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns the unstructured title and body of an issue into a {@link SignalBundle}.
 * Pure keyword matching; empty text is valid and simply yields weak signals.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalExtractor {

    private final SignalCatalog catalog;
    private final SignalCatalogProperties properties;

    /**
     * Text-only extraction. Reward-dependent rules are skipped.
     */
    public SignalBundle extractSignals(String title, String body) {
        return extractSignals(title, body, null);
    }

    public SignalBundle extractSignals(String title, String body, Long rewardAmount) {
        String safeTitle = title == null ? "" : title;
        String safeBody = body == null ? "" : body;
        String fullText = (safeTitle + " " + safeBody).toLowerCase(Locale.ROOT);

        List<String> redFlags = new ArrayList<>();
        List<String> critical = new ArrayList<>();
        for (SignalRule rule : catalog.rules()) {
            if (fires(rule, fullText, safeBody, rewardAmount)) {
                redFlags.add(rule.label());
                if (rule.isCritical()) critical.add(rule.label());
            }
        }

        SignalBundle bundle = new SignalBundle(
                find(catalog.codeExamples, fullText),
                find(catalog.specificRequirements, fullText),
                safeBody.length() > properties.getWellDefinedBodyLength() && find(catalog.structureMarkers, fullText),
                find(catalog.integration, fullText),
                find(catalog.architecture, fullText),
                find(catalog.subjective, fullText),
                countWords(fullText),
                redFlags,
                critical
        );
        log.debug("signals -> words={}, flags={}", bundle.estimatedWordCount(), redFlags);
        return bundle;
    }

    private boolean fires(SignalRule rule, String fullText, String body, Long rewardAmount) {
        return switch (rule.trigger()) {
            case TEXT_MATCH -> find(rule.pattern(), fullText);
            case SHORT_BODY -> body.length() < properties.getShortBodyLength();
            case LOW_REWARD_MATCH -> rewardAmount != null
                    && rewardAmount < properties.getLowRewardCeiling()
                    && find(rule.pattern(), fullText);
        };
    }

    private static boolean find(Pattern p, String text) {
        return p.matcher(text).find();
    }

    private static int countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
