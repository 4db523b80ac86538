package com.tradinggateway.observability;

import com.tradinggateway.event.HealthSampleEvent;
import com.tradinggateway.event.SafeModeEvent;
import com.tradinggateway.event.SafeModeEventType;
import com.tradinggateway.event.SessionEvent;
import com.tradinggateway.event.SessionEventType;
import com.tradinggateway.gate.RequestErrorType;
import com.tradinggateway.gate.RequestType;
import com.tradinggateway.health.HealthSample;
import com.tradinggateway.session.SessionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates Micrometer metrics for the gateway connectivity core.
 *
 * <ul>
 *   <li><b>gateway.session.ready</b> (gauge 0/1): whether the session is READY</li>
 *   <li><b>gateway.safe_mode.active</b> (gauge 0/1): capital-preservation flag</li>
 *   <li><b>gateway.session.reconnects</b> (counter): transitions into RECONNECTING</li>
 *   <li><b>gateway.session.gave_up</b> (counter, tag {@code reason}): exhausted budgets and rejected logins</li>
 *   <li><b>gateway.safe_mode.entries</b> (counter, tag {@code reason}): safe-mode entries by trigger</li>
 *   <li><b>gateway.health.samples</b> (counter, tags {@code status}, {@code source})</li>
 *   <li><b>gateway.request.latency</b> (timer, tag {@code type}): gateway round-trip of accepted requests</li>
 *   <li><b>gateway.request.failures</b> (counter, tag {@code type}): failed or rejected requests by error type</li>
 * </ul>
 *
 * <p>Gauges read state tracked from application events, so this service has no dependency
 * on the components it observes.
 */
@Service
public class GatewayMetricsService {

    private final MeterRegistry meterRegistry;
    private final AtomicInteger sessionReady = new AtomicInteger(0);
    private final AtomicInteger safeModeActive = new AtomicInteger(0);
    private final Counter reconnectCounter;

    public GatewayMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.reconnectCounter = Counter.builder("gateway.session.reconnects")
                .description("Transitions of the gateway session into RECONNECTING")
                .register(meterRegistry);

        Gauge.builder("gateway.session.ready", sessionReady, AtomicInteger::get)
                .description("1 when the gateway session is READY")
                .register(meterRegistry);

        Gauge.builder("gateway.safe_mode.active", safeModeActive, AtomicInteger::get)
                .description("1 while capital-preservation mode is active")
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onSessionEvent(SessionEvent event) {
        sessionReady.set(event.getNewState() == SessionState.READY ? 1 : 0);
        if (event.getEventType() == SessionEventType.SESSION_RECONNECTING) {
            reconnectCounter.increment();
        } else if (event.getEventType() == SessionEventType.SESSION_EXHAUSTED
                || event.getEventType() == SessionEventType.SESSION_AUTH_FAILED) {
            Counter.builder("gateway.session.gave_up")
                    .tag("reason", event.getEventType().name())
                    .register(meterRegistry)
                    .increment();
        }
    }

    @EventListener
    @Order(20)
    public void onSafeModeEvent(SafeModeEvent event) {
        safeModeActive.set(event.isSafeModeActive() ? 1 : 0);
        if (event.getEventType() == SafeModeEventType.ENTERED) {
            Counter.builder("gateway.safe_mode.entries")
                    .tag("reason", event.getDegradation().getTriggerReason().name())
                    .register(meterRegistry)
                    .increment();
        }
    }

    @EventListener
    @Order(20)
    public void onHealthSample(HealthSampleEvent event) {
        HealthSample sample = event.getSample();
        Counter.builder("gateway.health.samples")
                .tag("status", sample.getStatus().name())
                .tag("source", sample.getSource().name())
                .register(meterRegistry)
                .increment();
    }

    public void recordRequestLatency(RequestType type, Duration latency) {
        Timer.builder("gateway.request.latency")
                .description("Gateway round-trip of accepted data requests")
                .tag("type", type.name())
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(latency);
    }

    public void recordRequestFailure(RequestErrorType type) {
        Counter.builder("gateway.request.failures")
                .tag("type", type.name())
                .register(meterRegistry)
                .increment();
    }
}
