package com.tradinggateway.degradation;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One stay in capital-preservation mode. Open while {@code recoveredAt} is null.
 *
 * <p>Immutable: the coordinator replaces the open instance when it is acknowledged or closed.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class DegradationEvent {

    private final long id;
    private final TriggerReason triggerReason;
    private final Instant enteredAt;
    private final Instant recoveredAt;
    private final String message;
    private final boolean acknowledgementRequired;
    private final Instant acknowledgedAt;
    private final String acknowledgedBy;

    public boolean isOpen() {
        return recoveredAt == null;
    }

    public boolean isAwaitingAcknowledgement() {
        return acknowledgementRequired && acknowledgedAt == null;
    }
}
