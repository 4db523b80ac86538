package com.tradinggateway.health;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class HealthSignal {

    private final HealthSignalType type;
    private final Instant raisedAt;

    /** Consecutive non-ok samples at the time of a DEGRADING signal. */
    private final int consecutiveFailures;

    /** Most recent market update, or the READY time when none arrived yet. STALE only. */
    private final Instant lastMarketUpdate;

    /** Instant at which the data became stale (last update plus threshold). STALE only. */
    private final Instant staleSince;

    private final String message;
}
