package com.bountypipe.screener.config;

import com.bountypipe.screener.service.signals.SignalCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class ScreeningConfig {

    /**
     * Compiles the red-flag catalog once at startup; a bad pattern fails the context.
     */
    @Bean
    public SignalCatalog signalCatalog(SignalCatalogProperties properties) {
        SignalCatalog catalog = SignalCatalog.fromDefinitions(properties.getRedFlags());
        log.info("Red-flag catalog loaded with {} rules", catalog.rules().size());
        return catalog;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
