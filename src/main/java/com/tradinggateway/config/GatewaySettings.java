package com.tradinggateway.config;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import lombok.Builder;
import lombok.Getter;

/**
 * Immutable configuration for the gateway connectivity core.
 *
 * <p>Built once at startup by {@link GatewayConfig} from the {@code gateway.*}
 * properties and handed to every component through its constructor. Nothing in
 * the core reads configuration ad hoc after construction.
 *
 * <p>Defaults mirror the production deployment: 30 reconnect attempts, a 5s
 * health probe, a 3-failure degrading threshold, a 5-minute staleness threshold,
 * and historical windows capped at one RTH hour / 1000 bars.
 */
@Getter
@Builder(toBuilder = true)
public class GatewaySettings {

    // ==================== Connection ====================

    /** Gateway hostname (e.g. "gateway" inside the compose network, "localhost" for dev). */
    @Builder.Default
    private final String host = "localhost";

    /** Gateway API port (4002 paper, 4001 live). */
    @Builder.Default
    private final int port = 4002;

    /** Upper bound on how long {@code connect()} blocks the caller. */
    @Builder.Default
    private final Duration startupTimeout = Duration.ofMinutes(5);

    /** Timeout for a single open/authenticate handshake step. */
    @Builder.Default
    private final Duration handshakeTimeout = Duration.ofSeconds(30);

    // ==================== Retry / backoff ====================

    /** Maximum number of connection attempts per connect cycle. */
    @Builder.Default
    private final int maxReconnectAttempts = 30;

    /** First retry delay; later delays grow by {@link #backoffMultiplier}. */
    @Builder.Default
    private final Duration initialBackoff = Duration.ofSeconds(2);

    /** Upper bound on any computed backoff delay. */
    @Builder.Default
    private final Duration maxBackoff = Duration.ofSeconds(60);

    @Builder.Default
    private final double backoffMultiplier = 2.0;

    /** Jitter as a fraction of the computed delay, in [0, 1). */
    @Builder.Default
    private final double backoffJitter = 0.2;

    /** Fixed wait while the gateway login waits for out-of-band 2FA approval. */
    @Builder.Default
    private final Duration authenticationPendingWait = Duration.ofSeconds(90);

    // ==================== Health ====================

    @Builder.Default
    private final Duration probeInterval = Duration.ofSeconds(5);

    @Builder.Default
    private final Duration probeTimeout = Duration.ofSeconds(5);

    /** Consecutive non-ok samples that raise a DEGRADING signal. */
    @Builder.Default
    private final int unhealthyThreshold = 3;

    /** Number of samples kept in the health ring buffer. */
    @Builder.Default
    private final int sampleWindowSize = 50;

    /** Market data older than this raises a STALE signal. */
    @Builder.Default
    private final Duration stalenessThreshold = Duration.ofMinutes(5);

    /** Evaluate staleness only inside regular trading hours. */
    @Builder.Default
    private final boolean stalenessRthOnly = true;

    @Builder.Default
    private final ZoneId marketZone = ZoneId.of("America/New_York");

    @Builder.Default
    private final LocalTime marketOpen = LocalTime.of(9, 30);

    @Builder.Default
    private final LocalTime marketClose = LocalTime.of(16, 0);

    // ==================== Requests ====================

    /** Default per-request deadline when the caller does not specify one. */
    @Builder.Default
    private final Duration requestTimeout = Duration.ofSeconds(30);

    /** Timeout for one contract qualification round-trip. */
    @Builder.Default
    private final Duration qualificationTimeout = Duration.ofSeconds(10);

    /** Maximum concurrent gateway calls across all contracts. */
    @Builder.Default
    private final int maxInFlightRequests = 8;

    /** Largest historical window the gateway answers reliably. */
    @Builder.Default
    private final Duration maxHistoricalWindow = Duration.ofHours(1);

    @Builder.Default
    private final int maxHistoricalBars = 1000;

    // ==================== Degradation ====================

    /** Consecutive healthy samples after READY required to leave safe mode. */
    @Builder.Default
    private final int recoveryHealthySamples = 3;

    /** How long a STALE signal must persist before DATA_STALE safe mode is entered. */
    @Builder.Default
    private final Duration staleGracePeriod = Duration.ofSeconds(30);

    /** Number of closed degradation events kept for the status API. */
    @Builder.Default
    private final int degradationHistorySize = 100;

    public static GatewaySettings defaults() {
        return GatewaySettings.builder().build();
    }
}
