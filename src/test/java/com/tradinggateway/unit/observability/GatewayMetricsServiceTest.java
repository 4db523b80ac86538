package com.tradinggateway.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradinggateway.degradation.DegradationEvent;
import com.tradinggateway.degradation.TriggerReason;
import com.tradinggateway.event.HealthSampleEvent;
import com.tradinggateway.event.SafeModeEvent;
import com.tradinggateway.event.SafeModeEventType;
import com.tradinggateway.event.SessionEvent;
import com.tradinggateway.event.SessionEventType;
import com.tradinggateway.gate.RequestErrorType;
import com.tradinggateway.gate.RequestType;
import com.tradinggateway.health.HealthSample;
import com.tradinggateway.health.SampleSource;
import com.tradinggateway.health.SampleStatus;
import com.tradinggateway.observability.GatewayMetricsService;
import com.tradinggateway.session.SessionState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for GatewayMetricsService verifying that gauges, counters and timers follow
 * the gateway events they observe.
 */
class GatewayMetricsServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-14T15:00:00Z");

    private MeterRegistry meterRegistry;
    private GatewayMetricsService metricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new GatewayMetricsService(meterRegistry);
    }

    private SessionEvent sessionEvent(SessionEventType type, SessionState previous, SessionState next) {
        return new SessionEvent(this, type, previous, next, 101, 1, type.name(), NOW);
    }

    private SafeModeEvent safeModeEvent(SafeModeEventType type, boolean active) {
        DegradationEvent degradation = DegradationEvent.builder()
                .id(1L)
                .triggerReason(TriggerReason.CONNECTION_EXHAUSTED)
                .enteredAt(NOW)
                .build();
        return new SafeModeEvent(this, type, degradation, active);
    }

    @Nested
    @DisplayName("Gauges")
    class Gauges {

        @Test
        @DisplayName("gateway.session.ready follows READY transitions")
        void sessionReadyGauge() {
            assertThat(meterRegistry.get("gateway.session.ready").gauge().value()).isEqualTo(0.0);

            metricsService.onSessionEvent(
                    sessionEvent(SessionEventType.SESSION_READY, SessionState.AUTHENTICATING, SessionState.READY));
            assertThat(meterRegistry.get("gateway.session.ready").gauge().value()).isEqualTo(1.0);

            metricsService.onSessionEvent(
                    sessionEvent(SessionEventType.SESSION_RECONNECTING, SessionState.READY, SessionState.RECONNECTING));
            assertThat(meterRegistry.get("gateway.session.ready").gauge().value()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("gateway.safe_mode.active follows safe-mode events")
        void safeModeGauge() {
            metricsService.onSafeModeEvent(safeModeEvent(SafeModeEventType.ENTERED, true));
            assertThat(meterRegistry.get("gateway.safe_mode.active").gauge().value()).isEqualTo(1.0);

            metricsService.onSafeModeEvent(safeModeEvent(SafeModeEventType.RECOVERED, false));
            assertThat(meterRegistry.get("gateway.safe_mode.active").gauge().value()).isEqualTo(0.0);
        }
    }

    @Nested
    @DisplayName("Counters")
    class Counters {

        @Test
        @DisplayName("gateway.session.reconnects counts RECONNECTING transitions")
        void reconnectCounter() {
            metricsService.onSessionEvent(
                    sessionEvent(SessionEventType.SESSION_RECONNECTING, SessionState.CONNECTING, SessionState.RECONNECTING));
            metricsService.onSessionEvent(
                    sessionEvent(SessionEventType.SESSION_RECONNECTING, SessionState.READY, SessionState.RECONNECTING));

            assertThat(meterRegistry.get("gateway.session.reconnects").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("gateway.session.gave_up is tagged with the give-up event")
        void gaveUpCounter() {
            metricsService.onSessionEvent(
                    sessionEvent(SessionEventType.SESSION_EXHAUSTED, SessionState.RECONNECTING, SessionState.DISCONNECTED));

            assertThat(meterRegistry.get("gateway.session.gave_up").tag("reason", "SESSION_EXHAUSTED")
                    .counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("gateway.safe_mode.entries is tagged with the trigger and ignores recoveries")
        void safeModeEntries() {
            metricsService.onSafeModeEvent(safeModeEvent(SafeModeEventType.ENTERED, true));
            metricsService.onSafeModeEvent(safeModeEvent(SafeModeEventType.RECOVERED, false));

            assertThat(meterRegistry.get("gateway.safe_mode.entries").tag("reason", "CONNECTION_EXHAUSTED")
                    .counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("gateway.health.samples is tagged by status and source")
        void healthSamples() {
            metricsService.onHealthSample(new HealthSampleEvent(this, HealthSample.builder()
                    .timestamp(NOW)
                    .status(SampleStatus.TIMEOUT)
                    .source(SampleSource.PROBE)
                    .build()));

            assertThat(meterRegistry.get("gateway.health.samples")
                    .tag("status", "TIMEOUT").tag("source", "PROBE").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("gateway.request.failures is tagged by error type")
        void requestFailures() {
            metricsService.recordRequestFailure(RequestErrorType.WINDOW_TOO_LARGE);
            metricsService.recordRequestFailure(RequestErrorType.WINDOW_TOO_LARGE);

            assertThat(meterRegistry.get("gateway.request.failures").tag("type", "WINDOW_TOO_LARGE")
                    .counter().count()).isEqualTo(2.0);
        }
    }

    @Test
    @DisplayName("gateway.request.latency records round-trips per request type")
    void requestLatency() {
        metricsService.recordRequestLatency(RequestType.HISTORICAL_BARS, Duration.ofMillis(250));

        assertThat(meterRegistry.get("gateway.request.latency").tag("type", "HISTORICAL_BARS").timer()
                .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
    }
}
