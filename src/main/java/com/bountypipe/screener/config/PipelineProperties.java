package com.bountypipe.screener.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties("screening.pipeline")
public class PipelineProperties {

    /** Upper bound on approved bounties handed to execution per session. */
    private int maxImplementations = 5;
}
