package com.bountypipe.screener.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Session analytics switches, bottleneck rules and the constants behind the rough cost model.
 */
@Data
@Component
@ConfigurationProperties("screening.analytics")
public class AnalyticsProperties {

    private boolean trackQualityMetrics = true;
    private boolean enableRealtimeLogging = true;
    private boolean saveMetricsToFile = true;
    private String metricsOutputPath = "output/analytics";

    // Bottleneck rules
    private Duration durationCeiling = Duration.ofMinutes(10);
    private double successRateFloor = 50.0;
    private double qualityFailureCeiling = 30.0;

    // Cost estimate: flat cost per attempt scaled by average duration over the baseline
    private double costPerAttempt = 0.50;
    private Duration costDurationBaseline = Duration.ofMinutes(5);

    // Value distribution boundaries (cents)
    private long mediumValueFloor = 50_000;
    private long highValueFloor = 250_000;

    private int commonBlockersLimit = 5;
}
