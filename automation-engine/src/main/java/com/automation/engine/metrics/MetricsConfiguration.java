package com.automation.engine.metrics;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link AutomationMetrics} and tags every meter with the application name.
 * Action durations are published as a histogram so dashboards can compute percentiles.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> automationRegistryCustomizer(
            @Value("${spring.application.name:event-automations}") String applicationName) {
        return registry -> registry.config()
            .commonTags("application", applicationName)
            .meterFilter(actionDurationHistogram());
    }

    @Bean
    public AutomationMetrics automationMetrics() {
        return new AutomationMetrics();
    }

    private static MeterFilter actionDurationHistogram() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                if (!AutomationMetrics.ACTION_DURATION.equals(id.getName())) {
                    return config;
                }
                return DistributionStatisticConfig.builder()
                    .percentilesHistogram(true)
                    .build()
                    .merge(config);
            }
        };
    }
}
