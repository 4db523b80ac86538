package com.tradinggateway.health;

public enum HealthSignalType {

    /** Consecutive failed samples reached the unhealthy threshold. */
    DEGRADING,

    /** No market update within the staleness threshold although the transport may be healthy. */
    STALE
}
