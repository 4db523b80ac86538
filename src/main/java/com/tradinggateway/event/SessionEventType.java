package com.tradinggateway.event;

/**
 * Classifies the session transition that produced a {@link SessionEvent}.
 */
public enum SessionEventType {

    /** A connection attempt started with a new client identity. */
    SESSION_CONNECTING,

    /** Socket open, handshake in progress. */
    SESSION_AUTHENTICATING,

    /** Handshake complete; the session accepts requests. */
    SESSION_READY,

    /** The session was lost (transport error, failed handshake, or health signal). */
    SESSION_RECONNECTING,

    /** The reconnect budget was exhausted. Triggers CONNECTION_EXHAUSTED safe mode. */
    SESSION_EXHAUSTED,

    /** The gateway rejected the login. Triggers AUTHENTICATION_FAILED safe mode. */
    SESSION_AUTH_FAILED,

    /** Graceful disconnect requested by the application or an operator. */
    SESSION_SHUTDOWN
}
