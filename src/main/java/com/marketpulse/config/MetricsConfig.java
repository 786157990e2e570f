package com.marketpulse.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name. The analytics meters themselves are
 * defined in {@link com.marketpulse.observability.AnalyticsMetricsService}.
 */
@Configuration
public class MetricsConfig {

    static final String APPLICATION_TAG = "marketpulse";

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTagsCustomizer() {
        return registry -> registry.config().commonTags("application", APPLICATION_TAG);
    }
}
