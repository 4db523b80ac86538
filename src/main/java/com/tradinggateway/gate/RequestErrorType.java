package com.tradinggateway.gate;

/**
 * Typed reasons a data request did not produce data.
 *
 * <p>{@link #isCallerError()} types are programming-contract violations rejected before any
 * network call. {@link #SESSION_CLOSED} and {@link #DEGRADED} mean the core cancelled the
 * request because the session is known to be unusable, unlike {@link #REQUEST_TIMEOUT},
 * where the gateway may still be healthy.
 */
public enum RequestErrorType {
    SESSION_NOT_READY,
    UNSAFE_MODE_REJECTED,
    NOT_QUALIFIED,
    QUALIFICATION_FAILED,
    WINDOW_TOO_LARGE,
    RTH_ONLY_REQUIRED,
    INVALID_REQUEST,
    REQUEST_TIMEOUT,
    SESSION_CLOSED,
    DEGRADED,
    GATEWAY_ERROR,
    INVALID_DATA;

    public boolean isCallerError() {
        return this == UNSAFE_MODE_REJECTED || this == WINDOW_TOO_LARGE || this == RTH_ONLY_REQUIRED
                || this == INVALID_REQUEST;
    }

    public boolean isCancellation() {
        return this == SESSION_CLOSED || this == DEGRADED;
    }
}
