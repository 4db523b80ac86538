package com.tradinggateway.api.dto.response;

import com.tradinggateway.degradation.DegradationEvent;
import com.tradinggateway.session.SessionSnapshot;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Combined view of the connectivity core for operators and the dashboard.
 */
@Getter
@Builder
public class GatewayStatusResponse {

    private final SessionSnapshot session;
    private final boolean safeModeActive;

    /** Null when safe mode is not active. */
    private final DegradationEvent openDegradation;

    private final int consecutiveHealthFailures;
    private final Instant lastMarketUpdate;
    private final int inFlightRequests;
}
