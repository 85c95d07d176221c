package com.bountypipe.screener.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties("screening.history")
public class HistoryProperties {

    /**
     * When true, a record marked ready for submission without a completed status aborts
     * the history build. Otherwise the record is flagged and left out of the success count.
     */
    private boolean strictIngestion = false;
}
