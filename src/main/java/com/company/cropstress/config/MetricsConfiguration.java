package com.company.cropstress.config;

import com.company.cropstress.service.AnalysisDeduplicator;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final AnalysisDeduplicator deduplicator;

    @Bean
    public MeterBinder analysisMetrics() {
        return registry -> {
            Gauge.builder("cropstress.analyses.in_flight", deduplicator, AnalysisDeduplicator::inFlightCount)
                    .description("Number of field analyses currently computing")
                    .register(registry);

            log.info("Custom metrics registered");
        };
    }
}
