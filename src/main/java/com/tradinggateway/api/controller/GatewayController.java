package com.tradinggateway.api.controller;

import com.tradinggateway.api.dto.request.AcknowledgeRequest;
import com.tradinggateway.api.dto.request.ManualOverrideRequest;
import com.tradinggateway.api.dto.request.RestartRequest;
import com.tradinggateway.api.dto.response.GatewayStatusResponse;
import com.tradinggateway.api.dto.response.SafeModeResponse;
import com.tradinggateway.config.GatewaySettings;
import com.tradinggateway.degradation.DegradationCoordinator;
import com.tradinggateway.degradation.DegradationEvent;
import com.tradinggateway.gate.RequestGate;
import com.tradinggateway.health.HealthMonitor;
import com.tradinggateway.session.SessionManager;
import com.tradinggateway.session.SessionSnapshot;
import com.tradinggateway.session.SessionState;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for the gateway session and capital-preservation mode.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/gateway/status -- session snapshot, safe-mode flag, health counters</li>
 *   <li>POST /api/gateway/connect -- start a connect cycle (non-blocking)</li>
 *   <li>POST /api/gateway/disconnect -- graceful disconnect</li>
 *   <li>POST /api/gateway/restart -- graceful disconnect followed by a fresh connect</li>
 *   <li>GET /api/gateway/safe-mode -- safe-mode flag, open event and recovery progress</li>
 *   <li>GET /api/gateway/safe-mode/history -- recently closed degradation events</li>
 *   <li>POST /api/gateway/safe-mode/override -- force safe mode</li>
 *   <li>POST /api/gateway/safe-mode/acknowledge -- acknowledge the open degradation event</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/gateway")
public class GatewayController {

    private static final Logger log = LoggerFactory.getLogger(GatewayController.class);

    private final SessionManager sessionManager;
    private final DegradationCoordinator degradationCoordinator;
    private final HealthMonitor healthMonitor;
    private final RequestGate requestGate;
    private final GatewaySettings settings;

    public GatewayController(
            SessionManager sessionManager,
            DegradationCoordinator degradationCoordinator,
            HealthMonitor healthMonitor,
            RequestGate requestGate,
            GatewaySettings settings) {
        this.sessionManager = sessionManager;
        this.degradationCoordinator = degradationCoordinator;
        this.healthMonitor = healthMonitor;
        this.requestGate = requestGate;
        this.settings = settings;
    }

    @GetMapping("/status")
    public ResponseEntity<GatewayStatusResponse> getStatus() {
        return ResponseEntity.ok(GatewayStatusResponse.builder()
                .session(sessionManager.snapshot())
                .safeModeActive(degradationCoordinator.isSafeModeActive())
                .openDegradation(degradationCoordinator.getOpenEvent().orElse(null))
                .consecutiveHealthFailures(healthMonitor.getConsecutiveFailures())
                .lastMarketUpdate(healthMonitor.getLastMarketUpdate())
                .inFlightRequests(requestGate.getInFlightCount())
                .build());
    }

    /**
     * Starts a connect cycle and returns immediately. Poll /status for the outcome.
     */
    @PostMapping("/connect")
    public ResponseEntity<Map<String, Object>> connect() {
        log.info("Connect requested via API");
        sessionManager.connectAsync();
        return ResponseEntity.accepted().body(Map.of("state", sessionManager.currentState()));
    }

    @PostMapping("/disconnect")
    public ResponseEntity<SessionSnapshot> disconnect() {
        log.info("Disconnect requested via API");
        sessionManager.disconnect("operator request");
        return ResponseEntity.ok(sessionManager.snapshot());
    }

    /**
     * Blocks until the restarted session is READY or the startup timeout elapses.
     */
    @PostMapping("/restart")
    public ResponseEntity<Map<String, Object>> restart(@RequestBody(required = false) RestartRequest request) {
        String reason = request != null && request.getReason() != null ? request.getReason() : "operator request";
        SessionState state = sessionManager.restart(reason);
        return ResponseEntity.ok(Map.of("state", state));
    }

    @GetMapping("/safe-mode")
    public ResponseEntity<SafeModeResponse> getSafeMode() {
        return ResponseEntity.ok(safeModeResponse());
    }

    @GetMapping("/safe-mode/history")
    public ResponseEntity<List<DegradationEvent>> getSafeModeHistory() {
        return ResponseEntity.ok(degradationCoordinator.history());
    }

    @PostMapping("/safe-mode/override")
    public ResponseEntity<SafeModeResponse> forceSafeMode(@Valid @RequestBody ManualOverrideRequest request) {
        log.warn("Manual safe-mode override by {}: {}", request.getOperator(), request.getReason());
        degradationCoordinator.enterManualOverride(request.getReason(), request.getOperator());
        return ResponseEntity.ok(safeModeResponse());
    }

    @PostMapping("/safe-mode/acknowledge")
    public ResponseEntity<DegradationEvent> acknowledge(@Valid @RequestBody AcknowledgeRequest request) {
        return ResponseEntity.ok(degradationCoordinator.acknowledge(request.getOperator()));
    }

    private SafeModeResponse safeModeResponse() {
        return SafeModeResponse.builder()
                .safeModeActive(degradationCoordinator.isSafeModeActive())
                .openDegradation(degradationCoordinator.getOpenEvent().orElse(null))
                .healthySamplesSinceReady(degradationCoordinator.getHealthySamplesSinceReady())
                .healthySamplesRequired(settings.getRecoveryHealthySamples())
                .build();
    }
}
