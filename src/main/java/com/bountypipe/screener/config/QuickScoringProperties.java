package com.bountypipe.screener.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Arithmetic of the quick first-pass scorer. The go/caution cutoffs (50/30) are
 * deliberately looser than the conservative auto-preparation defaults used elsewhere;
 * they are kept as shipped pending product-owner confirmation.
 */
@Data
@Component
@ConfigurationProperties("screening.quick")
public class QuickScoringProperties {

    // Complexity
    private int baseComplexity = 3;
    private int unspecificRequirementsPenalty = 2;
    private int notWellDefinedPenalty = 2;
    private int integrationPenalty = 2;
    private int architecturePenalty = 3;
    private int subjectiveCriteriaPenalty = 2;
    private int codeExamplesRelief = 1;
    private int longTextRelief = 1;
    private int longTextWordCount = 300;

    // Success probability
    private int baseProbability = 70;
    private int probabilityPerComplexityPoint = 8;
    private int criticalFlagPenalty = 25;
    private int standardFlagPenalty = 10;
    private long mediumRewardThreshold = 5000;
    private int mediumRewardBonus = 10;
    private long highRewardThreshold = 10000;
    private int highRewardBonus = 5;

    // Verdict
    private int goCutoff = 50;
    private int cautionCutoff = 30;

    // Confidence
    private int baseConfidence = 60;
    private int wellDefinedConfidence = 15;
    private int codeExamplesConfidence = 10;
    private int specificRequirementsConfidence = 10;
    private int subjectiveCriteriaConfidencePenalty = 15;
    private int architectureConfidencePenalty = 10;
    private int perFlagConfidencePenalty = 5;
    private int minConfidence = 20;
    private int maxConfidence = 85;

    // Timeline
    private int hoursPerComplexityPoint = 4;
    private double notWellDefinedMultiplier = 1.5;
    private double architectureMultiplier = 1.8;
    private double codeExamplesMultiplier = 0.8;
}
