package com.tradinggateway.transport;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Low-level primitives offered by the gateway process. Every component that talks to
 * the gateway goes through this interface, and only the session manager, the request
 * gate and the health monitor hold a reference to it.
 *
 * <p>The interface deliberately has no streaming subscription method: market data is
 * only ever requested as a one-shot snapshot, because persistent subscriptions overflow
 * the gateway's buffers.
 *
 * <p>Every call takes an explicit timeout which implementations must propagate to the
 * underlying client call. Failures are reported as unchecked
 * {@link com.tradinggateway.exception.GatewayException} subtypes:
 * <ul>
 *   <li>{@link com.tradinggateway.exception.TransientConnectionException}: socket-level failure</li>
 *   <li>{@link com.tradinggateway.exception.AuthenticationException}: login rejected or pending 2FA</li>
 *   <li>{@link com.tradinggateway.exception.QualificationException}: unknown contract</li>
 *   <li>{@link com.tradinggateway.exception.RequestTimeoutException}: no answer within the timeout</li>
 * </ul>
 */
public interface GatewayTransport {

    // ---- Connection ----

    /**
     * Opens the API socket using the given client identity.
     *
     * @throws com.tradinggateway.exception.TransientConnectionException if the socket cannot be opened
     */
    void open(String host, int port, int clientId, Duration timeout);

    /**
     * Completes the API handshake (server version, managed accounts).
     *
     * @throws com.tradinggateway.exception.AuthenticationException if the login is rejected or
     *     waiting for 2FA approval
     */
    void authenticate(Duration timeout);

    /** Closes the socket. Safe to call when already closed. */
    void close();

    boolean isOpen();

    // ---- Contracts ----

    /**
     * Resolves a contract key (e.g. "SPY" or "SPY-20260206-C-450") to gateway contract details.
     *
     * @throws com.tradinggateway.exception.QualificationException if the gateway does not know the contract
     */
    ContractDetails qualifyContract(String contractKey, Duration timeout);

    // ---- Market data ----

    /** One-shot market data snapshot for a qualified contract. */
    MarketSnapshot requestSnapshot(ContractDetails contract, Duration timeout);

    /** Historical bars for a qualified contract over an RTH-only window. */
    List<HistoricalBar> requestHistoricalBars(ContractDetails contract, HistoricalWindow window, Duration timeout);

    // ---- Health ----

    /**
     * Lightweight round-trip (current server time) used by the health monitor.
     *
     * @return the gateway's clock reading
     */
    Instant probe(Duration timeout);
}
