package com.tradinggateway.config;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the immutable {@link GatewaySettings} bean from application.properties.
 *
 * <p>Every value has a default matching the production deployment, so an empty
 * configuration connects to a paper gateway on localhost:4002.
 *
 * <p>Properties prefix: {@code gateway.*}
 */
@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean
    public GatewaySettings gatewaySettings(
            @Value("${gateway.host:localhost}") String host,
            @Value("${gateway.port:4002}") int port,
            @Value("${gateway.startup-timeout-seconds:300}") long startupTimeoutSeconds,
            @Value("${gateway.handshake-timeout-seconds:30}") long handshakeTimeoutSeconds,
            @Value("${gateway.retry.max-attempts:30}") int maxReconnectAttempts,
            @Value("${gateway.retry.initial-backoff-ms:2000}") long initialBackoffMs,
            @Value("${gateway.retry.max-backoff-ms:60000}") long maxBackoffMs,
            @Value("${gateway.retry.multiplier:2.0}") double backoffMultiplier,
            @Value("${gateway.retry.jitter:0.2}") double backoffJitter,
            @Value("${gateway.retry.auth-pending-wait-seconds:90}") long authPendingWaitSeconds,
            @Value("${gateway.health.probe-interval-ms:5000}") long probeIntervalMs,
            @Value("${gateway.health.probe-timeout-ms:5000}") long probeTimeoutMs,
            @Value("${gateway.health.unhealthy-threshold:3}") int unhealthyThreshold,
            @Value("${gateway.health.sample-window-size:50}") int sampleWindowSize,
            @Value("${gateway.health.staleness-threshold-seconds:300}") long stalenessThresholdSeconds,
            @Value("${gateway.health.staleness-rth-only:true}") boolean stalenessRthOnly,
            @Value("${gateway.market.zone:America/New_York}") String marketZone,
            @Value("${gateway.market.open:09:30}") String marketOpen,
            @Value("${gateway.market.close:16:00}") String marketClose,
            @Value("${gateway.request.timeout-ms:30000}") long requestTimeoutMs,
            @Value("${gateway.request.qualification-timeout-ms:10000}") long qualificationTimeoutMs,
            @Value("${gateway.request.max-in-flight:8}") int maxInFlightRequests,
            @Value("${gateway.historical.max-window-minutes:60}") long maxHistoricalWindowMinutes,
            @Value("${gateway.historical.max-bars:1000}") int maxHistoricalBars,
            @Value("${gateway.degradation.recovery-healthy-samples:3}") int recoveryHealthySamples,
            @Value("${gateway.degradation.stale-grace-seconds:30}") long staleGraceSeconds,
            @Value("${gateway.degradation.history-size:100}") int degradationHistorySize) {
        GatewaySettings settings = GatewaySettings.builder()
                .host(host)
                .port(port)
                .startupTimeout(Duration.ofSeconds(startupTimeoutSeconds))
                .handshakeTimeout(Duration.ofSeconds(handshakeTimeoutSeconds))
                .maxReconnectAttempts(maxReconnectAttempts)
                .initialBackoff(Duration.ofMillis(initialBackoffMs))
                .maxBackoff(Duration.ofMillis(maxBackoffMs))
                .backoffMultiplier(backoffMultiplier)
                .backoffJitter(backoffJitter)
                .authenticationPendingWait(Duration.ofSeconds(authPendingWaitSeconds))
                .probeInterval(Duration.ofMillis(probeIntervalMs))
                .probeTimeout(Duration.ofMillis(probeTimeoutMs))
                .unhealthyThreshold(unhealthyThreshold)
                .sampleWindowSize(sampleWindowSize)
                .stalenessThreshold(Duration.ofSeconds(stalenessThresholdSeconds))
                .stalenessRthOnly(stalenessRthOnly)
                .marketZone(ZoneId.of(marketZone))
                .marketOpen(LocalTime.parse(marketOpen))
                .marketClose(LocalTime.parse(marketClose))
                .requestTimeout(Duration.ofMillis(requestTimeoutMs))
                .qualificationTimeout(Duration.ofMillis(qualificationTimeoutMs))
                .maxInFlightRequests(maxInFlightRequests)
                .maxHistoricalWindow(Duration.ofMinutes(maxHistoricalWindowMinutes))
                .maxHistoricalBars(maxHistoricalBars)
                .recoveryHealthySamples(recoveryHealthySamples)
                .staleGracePeriod(Duration.ofSeconds(staleGraceSeconds))
                .degradationHistorySize(degradationHistorySize)
                .build();

        log.info(
                "Gateway settings: {}:{} maxAttempts={} probeInterval={} staleness={} recoverySamples={}",
                settings.getHost(),
                settings.getPort(),
                settings.getMaxReconnectAttempts(),
                settings.getProbeInterval(),
                settings.getStalenessThreshold(),
                settings.getRecoveryHealthySamples());
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
