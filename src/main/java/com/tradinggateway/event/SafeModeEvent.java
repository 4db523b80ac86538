package com.tradinggateway.event;

import com.tradinggateway.degradation.DegradationEvent;
import org.springframework.context.ApplicationEvent;

/**
 * The externally visible output of the connectivity core: entry into, acknowledgement of,
 * and recovery from capital-preservation mode.
 *
 * <p>The capital-preservation strategy, alerting and the order path subscribe to this event.
 * It is published after the coordinator's flag has changed, so a listener that reads
 * {@code DegradationCoordinator.isSafeModeActive()} sees the new value.
 */
public class SafeModeEvent extends ApplicationEvent {

    private final SafeModeEventType eventType;
    private final DegradationEvent degradation;
    private final boolean safeModeActive;

    public SafeModeEvent(
            Object source, SafeModeEventType eventType, DegradationEvent degradation, boolean safeModeActive) {
        super(source);
        this.eventType = eventType;
        this.degradation = degradation;
        this.safeModeActive = safeModeActive;
    }

    public SafeModeEventType getEventType() {
        return eventType;
    }

    public DegradationEvent getDegradation() {
        return degradation;
    }

    public boolean isSafeModeActive() {
        return safeModeActive;
    }
}
