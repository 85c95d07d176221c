package com.bountypipe.screener.service.signals;

import com.bountypipe.screener.common.exception.SignalCatalogException;
import com.bountypipe.screener.config.SignalCatalogProperties.RuleDefinition;
import com.bountypipe.screener.enums.FlagCategory;
import com.bountypipe.screener.enums.SignalTrigger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable table of red-flag rules plus the fixed indicator patterns, compiled once.
 * Rule order is evaluation order and therefore the order of flags in a {@code SignalBundle}.
 */
public final class SignalCatalog {

    // Indicator patterns, matched against the lower-cased "title body" text
    public static final String CODE_EXAMPLES = "```|`[^`]+`|example|sample";
    public static final String SPECIFIC_REQUIREMENTS = "should|must|require|need to|implement|add|create";
    public static final String STRUCTURE_MARKERS = "step|todo|list|bullet";
    public static final String INTEGRATION = "integrat|pipeline|system|phase|workflow|connect";
    public static final String ARCHITECTURE = "architect|design|structure|refactor|redesign";
    public static final String SUBJECTIVE = "aesthetic|clean|optimal|nice|better|improve|enhance";

    private static final List<RuleDefinition> DEFAULT_RULES = List.of(
            new RuleDefinition("vague-requirements", "Vague requirements with uncertainty indicators",
                    "somehow|possibly|maybe|probably|might", FlagCategory.CRITICAL, SignalTrigger.TEXT_MATCH),
            new RuleDefinition("multi-repository", "Multi-repository integration required",
                    "multiple.*repo|across.*repo|several.*repo", FlagCategory.CRITICAL, SignalTrigger.TEXT_MATCH),
            new RuleDefinition("domain-expertise", "Requires domain expertise",
                    "domain.*expert|specialist|advanced.*knowledge|deep.*understanding", FlagCategory.CRITICAL, SignalTrigger.TEXT_MATCH),
            new RuleDefinition("maintainer-coordination", "Requires maintainer coordination",
                    "coordination|collaborate|work.*with.*maintainer", FlagCategory.STANDARD, SignalTrigger.TEXT_MATCH),
            new RuleDefinition("aesthetic-subjectivity", "Subjective aesthetic criteria",
                    "aesthetic|beautiful|clean.*look|visually", FlagCategory.STANDARD, SignalTrigger.TEXT_MATCH),
            new RuleDefinition("architecture-change", "System architecture changes required",
                    "phase|pipeline|workflow|system.*design", FlagCategory.STANDARD, SignalTrigger.TEXT_MATCH),
            new RuleDefinition("insufficient-detail", "Insufficient requirement details",
                    null, FlagCategory.STANDARD, SignalTrigger.SHORT_BODY),
            new RuleDefinition("low-reward-for-scope", "Low reward for implementation task",
                    "implement|create|build|develop", FlagCategory.STANDARD, SignalTrigger.LOW_REWARD_MATCH)
    );

    private final List<SignalRule> rules;

    final Pattern codeExamples = compile("code-examples", CODE_EXAMPLES);
    final Pattern specificRequirements = compile("specific-requirements", SPECIFIC_REQUIREMENTS);
    final Pattern structureMarkers = compile("structure-markers", STRUCTURE_MARKERS);
    final Pattern integration = compile("integration", INTEGRATION);
    final Pattern architecture = compile("architecture", ARCHITECTURE);
    final Pattern subjective = compile("subjective", SUBJECTIVE);

    private SignalCatalog(List<SignalRule> rules) {
        this.rules = Collections.unmodifiableList(rules);
    }

    public static SignalCatalog defaults() {
        return fromDefinitions(DEFAULT_RULES);
    }

    /**
     * Compiles the given rule rows. An empty or null list yields the built-in catalog.
     *
     * @throws SignalCatalogException if a row is incomplete or its pattern does not compile
     */
    public static SignalCatalog fromDefinitions(List<RuleDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) definitions = DEFAULT_RULES;
        List<SignalRule> compiled = new ArrayList<>(definitions.size());
        for (RuleDefinition d : definitions) {
            if (d.getLabel() == null || d.getLabel().isBlank()) {
                throw new SignalCatalogException("Red-flag rule '" + d.getKey() + "' has no label");
            }
            SignalTrigger trigger = d.getTrigger() == null ? SignalTrigger.TEXT_MATCH : d.getTrigger();
            Pattern pattern = null;
            if (trigger != SignalTrigger.SHORT_BODY) {
                if (d.getPattern() == null || d.getPattern().isBlank()) {
                    throw new SignalCatalogException("Red-flag rule '" + d.getKey() + "' needs a pattern for " + trigger);
                }
                pattern = compile(d.getKey(), d.getPattern());
            }
            FlagCategory category = d.getCategory() == null ? FlagCategory.STANDARD : d.getCategory();
            compiled.add(new SignalRule(d.getKey(), d.getLabel(), category, trigger, pattern));
        }
        return new SignalCatalog(compiled);
    }

    public List<SignalRule> rules() {
        return rules;
    }

    private static Pattern compile(String key, String regex) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new SignalCatalogException("Invalid pattern for rule '" + key + "': " + regex, e);
        }
    }
}
