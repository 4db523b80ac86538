package com.tradinggateway.api.controller;

import com.tradinggateway.api.dto.response.HealthDetailedResponse;
import com.tradinggateway.degradation.DegradationCoordinator;
import com.tradinggateway.health.HealthMonitor;
import com.tradinggateway.session.SessionManager;
import com.tradinggateway.session.SessionSnapshot;
import com.tradinggateway.session.SessionState;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health check endpoints.
 *
 * <ul>
 *   <li>GET /api/health -- shallow check for the container probe; always UP while the process responds</li>
 *   <li>GET /api/health/detailed -- gateway session, market data and safe-mode status</li>
 * </ul>
 *
 * <p>The shallow endpoint does not look at the gateway, so a gateway outage never gets this
 * process restarted by its supervisor.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final SessionManager sessionManager;
    private final HealthMonitor healthMonitor;
    private final DegradationCoordinator degradationCoordinator;

    @Value("${gateway.transport:SIMULATED}")
    private String transport;

    public HealthController(
            SessionManager sessionManager, HealthMonitor healthMonitor, DegradationCoordinator degradationCoordinator) {
        this.sessionManager = sessionManager;
        this.healthMonitor = healthMonitor;
        this.degradationCoordinator = degradationCoordinator;
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> shallowHealth() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    @GetMapping("/detailed")
    public ResponseEntity<HealthDetailedResponse> detailedHealth() {
        Map<String, HealthDetailedResponse.SubsystemHealth> subsystems = new LinkedHashMap<>();

        SessionSnapshot session = sessionManager.snapshot();
        boolean ready = session.getState() == SessionState.READY;
        subsystems.put(
                "gatewaySession",
                HealthDetailedResponse.SubsystemHealth.builder()
                        .status(ready ? "UP" : "DOWN")
                        .message(ready
                                ? "READY with client id " + session.getClientId()
                                : "Session state: " + session.getState())
                        .build());

        Instant lastUpdate = healthMonitor.getLastMarketUpdate();
        int failures = healthMonitor.getConsecutiveFailures();
        subsystems.put(
                "marketData",
                HealthDetailedResponse.SubsystemHealth.builder()
                        .status(failures > 0 ? "DEGRADED" : "UP")
                        .message((lastUpdate != null ? "Last update " + lastUpdate : "No market data yet")
                                + ", consecutive failures " + failures)
                        .build());

        boolean safeMode = degradationCoordinator.isSafeModeActive();
        subsystems.put(
                "safeMode",
                HealthDetailedResponse.SubsystemHealth.builder()
                        .status(safeMode ? "DOWN" : "UP")
                        .message(degradationCoordinator.getOpenEvent()
                                .map(e -> "Active since " + e.getEnteredAt() + " (" + e.getTriggerReason() + ")")
                                .orElse("Inactive"))
                        .build());

        return ResponseEntity.ok(HealthDetailedResponse.builder()
                .status(deriveOverallStatus(subsystems))
                .sessionState(session.getState())
                .clientId(session.getClientId())
                .safeModeActive(safeMode)
                .subsystems(subsystems)
                .transport(transport)
                .checkedAt(Instant.now())
                .build());
    }

    private String deriveOverallStatus(Map<String, HealthDetailedResponse.SubsystemHealth> subsystems) {
        boolean anyDown = subsystems.values().stream().anyMatch(s -> "DOWN".equals(s.getStatus()));
        boolean anyDegraded = subsystems.values().stream().anyMatch(s -> "DEGRADED".equals(s.getStatus()));
        if (anyDown || anyDegraded) {
            return "DEGRADED";
        }
        return "UP";
    }
}
