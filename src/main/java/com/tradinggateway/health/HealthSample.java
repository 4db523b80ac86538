package com.tradinggateway.health;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One observation of gateway responsiveness. Kept in the monitor's ring buffer only.
 */
@Getter
@Builder
@ToString
public class HealthSample {

    private final Instant timestamp;

    /** Null when the call never completed. */
    private final Duration roundTripLatency;

    private final SampleStatus status;
    private final SampleSource source;

    /** Error message or contract key, for logs. */
    private final String detail;

    public boolean isOk() {
        return status.isOk();
    }
}
