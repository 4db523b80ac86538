package com.tradinggateway.event;

import com.tradinggateway.degradation.DegradationEvent;
import com.tradinggateway.health.HealthSample;
import com.tradinggateway.health.HealthSignal;
import com.tradinggateway.session.SessionState;
import java.time.Instant;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the gateway event types.
 *
 * <p>Delivery is synchronous: listeners run on the publishing thread before the publish
 * call returns. That is what gives session events their total order.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Session ----

    public void publishSessionTransition(
            Object source,
            SessionEventType eventType,
            SessionState previousState,
            SessionState newState,
            Integer clientId,
            int attemptNumber,
            String message,
            Instant occurredAt) {
        applicationEventPublisher.publishEvent(new SessionEvent(
                source, eventType, previousState, newState, clientId, attemptNumber, message, occurredAt));
    }

    // ---- Health ----

    public void publishHealthSample(Object source, HealthSample sample) {
        applicationEventPublisher.publishEvent(new HealthSampleEvent(source, sample));
    }

    public void publishHealthSignal(Object source, HealthSignal signal) {
        applicationEventPublisher.publishEvent(new HealthSignalEvent(source, signal));
    }

    // ---- Safe mode ----

    public void publishSafeModeEntered(Object source, DegradationEvent degradation) {
        applicationEventPublisher.publishEvent(new SafeModeEvent(source, SafeModeEventType.ENTERED, degradation, true));
    }

    public void publishSafeModeAcknowledged(Object source, DegradationEvent degradation) {
        applicationEventPublisher.publishEvent(
                new SafeModeEvent(source, SafeModeEventType.ACKNOWLEDGED, degradation, true));
    }

    public void publishSafeModeRecovered(Object source, DegradationEvent degradation) {
        applicationEventPublisher.publishEvent(
                new SafeModeEvent(source, SafeModeEventType.RECOVERED, degradation, false));
    }
}
