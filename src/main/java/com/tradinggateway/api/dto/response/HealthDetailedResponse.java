package com.tradinggateway.api.dto.response;

import com.tradinggateway.session.SessionState;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Body of GET /api/health/detailed: an overall verdict plus one entry per subsystem
 * ({@code gatewaySession}, {@code marketData}, {@code safeMode}).
 */
@Getter
@Builder
public class HealthDetailedResponse {

    /** "UP" when every subsystem is UP, otherwise "DEGRADED". */
    private final String status;

    private final SessionState sessionState;

    /** Null while no session exists. */
    private final Integer clientId;

    private final boolean safeModeActive;

    private final Map<String, SubsystemHealth> subsystems;

    /** Transport implementation in use (SIMULATED or a live adapter name). */
    private final String transport;

    private final Instant checkedAt;

    @Getter
    @Builder
    public static class SubsystemHealth {
        private final String status;
        private final String message;
    }
}
