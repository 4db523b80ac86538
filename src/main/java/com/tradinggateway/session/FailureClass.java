package com.tradinggateway.session;

/**
 * Why a connection attempt (or a READY session) failed. Drives the backoff decision.
 */
public enum FailureClass {

    /** Socket refused, reset or timed out. */
    TRANSPORT,

    /** Socket opened but the API handshake failed for a non-authentication reason. */
    HANDSHAKE,

    /** The health monitor saw too many consecutive failed probes. */
    HEALTH_DEGRADED,

    /** The health monitor saw no market update for longer than the staleness threshold. */
    DATA_STALE,

    /** Login is waiting for out-of-band 2FA approval. Retried after a long fixed wait. */
    AUTHENTICATION_PENDING,

    /** Credentials rejected. Never retried automatically. */
    AUTHENTICATION_REJECTED
}
