package com.tradinggateway.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application and the active transport, so simulator runs
 * never mix with live gateway data on a shared dashboard. Meter definitions live in
 * {@link com.tradinggateway.observability.GatewayMetricsService}.
 *
 * <p>A customizer runs before the registry is handed out, so meters registered in
 * constructors carry the tags too.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTags(@Value("${gateway.transport:SIMULATED}") String transport) {
        return registry -> registry.config().commonTags("application", "trading-gateway-core", "transport", transport);
    }
}
