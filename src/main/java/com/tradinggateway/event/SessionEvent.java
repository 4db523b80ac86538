package com.tradinggateway.event;

import com.tradinggateway.session.SessionState;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every gateway session transition.
 *
 * <p>Events are published while the session manager holds its state lock, so listeners
 * observe transitions in exactly the order they happened. Listeners must not call back
 * into the session manager's mutating methods synchronously.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>HealthMonitor: starts the staleness clock on SESSION_READY</li>
 *   <li>RequestGate: cancels in-flight requests when the session leaves READY</li>
 *   <li>DegradationCoordinator: enters safe mode on SESSION_EXHAUSTED / SESSION_AUTH_FAILED</li>
 *   <li>GatewayMetricsService: session state gauge and reconnect counter</li>
 * </ul>
 */
public class SessionEvent extends ApplicationEvent {

    private final SessionEventType eventType;
    private final SessionState previousState;
    private final SessionState newState;
    private final Integer clientId;
    private final int attemptNumber;
    private final String message;
    private final Instant occurredAt;

    public SessionEvent(
            Object source,
            SessionEventType eventType,
            SessionState previousState,
            SessionState newState,
            Integer clientId,
            int attemptNumber,
            String message,
            Instant occurredAt) {
        super(source);
        this.eventType = eventType;
        this.previousState = previousState;
        this.newState = newState;
        this.clientId = clientId;
        this.attemptNumber = attemptNumber;
        this.message = message;
        this.occurredAt = occurredAt;
    }

    public SessionEventType getEventType() {
        return eventType;
    }

    public SessionState getPreviousState() {
        return previousState;
    }

    public SessionState getNewState() {
        return newState;
    }

    /** Identity of the session involved, or null when no session exists. */
    public Integer getClientId() {
        return clientId;
    }

    /** Attempt number within the current connect cycle, 0 outside a cycle. */
    public int getAttemptNumber() {
        return attemptNumber;
    }

    public String getMessage() {
        return message;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
