package com.bountypipe.screener.config;

import com.bountypipe.screener.enums.FlagCategory;
import com.bountypipe.screener.enums.SignalTrigger;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Red-flag catalog and the length/reward limits used by the text signal extractor.
 * When {@code redFlags} is empty the built-in catalog is used.
 */
@Data
@Component
@ConfigurationProperties("screening.signals")
public class SignalCatalogProperties {

    private int shortBodyLength = 100;
    private long lowRewardCeiling = 1000;
    private int wellDefinedBodyLength = 200;
    private List<RuleDefinition> redFlags = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RuleDefinition {
        private String key;
        private String label;
        private String pattern;
        private FlagCategory category = FlagCategory.STANDARD;
        private SignalTrigger trigger = SignalTrigger.TEXT_MATCH;
    }
}
