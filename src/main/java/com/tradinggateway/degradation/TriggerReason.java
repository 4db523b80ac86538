package com.tradinggateway.degradation;

/**
 * Why capital-preservation mode was entered.
 */
public enum TriggerReason {

    /** The reconnect budget was used up without reaching READY. */
    CONNECTION_EXHAUSTED(false),

    /** No market update for longer than the staleness threshold plus grace period. */
    DATA_STALE(false),

    /** The gateway rejected the login. */
    AUTHENTICATION_FAILED(true),

    /** An operator forced safe mode. */
    MANUAL_OVERRIDE(true);

    private final boolean acknowledgementRequired;

    TriggerReason(boolean acknowledgementRequired) {
        this.acknowledgementRequired = acknowledgementRequired;
    }

    /** Whether leaving safe mode needs an explicit operator acknowledgement on top of a healthy session. */
    public boolean isAcknowledgementRequired() {
        return acknowledgementRequired;
    }
}
