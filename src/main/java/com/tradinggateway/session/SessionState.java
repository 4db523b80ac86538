package com.tradinggateway.session;

/**
 * State machine for the gateway session lifecycle.
 *
 * <p>Valid transitions:
 * <pre>
 * DISCONNECTED -> CONNECTING -> AUTHENTICATING -> READY
 *       ^             ^    |           |            |
 *       |             |    +-----------+------------+--> RECONNECTING
 *       |             +------ (attempt granted) -------------+
 *       +------------ (budget exhausted / auth rejected) ----+
 * READY -> DISCONNECTED on graceful shutdown
 * </pre>
 *
 * <p>Only READY allows data requests. At most one session is READY at any instant.
 */
public enum SessionState {

    /** No session. Initial state, and terminal after shutdown or give-up. */
    DISCONNECTED,

    /** Socket being opened with a freshly allocated client identity. */
    CONNECTING,

    /** Socket open, API handshake in progress. */
    AUTHENTICATING,

    /** Handshake complete, requests allowed. */
    READY,

    /** Previous session lost; waiting for the next attempt granted by the backoff controller. */
    RECONNECTING;

    /** True while a connect cycle is running and a new {@code connect()} must not start another. */
    public boolean isConnectCycleActive() {
        return this == CONNECTING || this == AUTHENTICATING || this == RECONNECTING;
    }
}
