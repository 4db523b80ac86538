package com.tradinggateway.unit.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradinggateway.exception.AuthenticationException;
import com.tradinggateway.exception.QualificationException;
import com.tradinggateway.exception.RequestTimeoutException;
import com.tradinggateway.exception.SessionClosedException;
import com.tradinggateway.exception.TransientConnectionException;
import com.tradinggateway.support.MutableClock;
import com.tradinggateway.transport.ContractDetails;
import com.tradinggateway.transport.HistoricalBar;
import com.tradinggateway.transport.HistoricalWindow;
import com.tradinggateway.transport.MarketSnapshot;
import com.tradinggateway.transport.SimulatedGatewayTransport;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SimulatedGatewayTransport covering the connection lifecycle, contract
 * qualification, generated market data and the failure-injection hooks.
 */
class SimulatedGatewayTransportTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private SimulatedGatewayTransport transport;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-14T15:00:00Z");
        transport = new SimulatedGatewayTransport(clock);
    }

    private void connect() {
        transport.open("localhost", 4002, 101, TIMEOUT);
        transport.authenticate(TIMEOUT);
    }

    @Nested
    @DisplayName("Connection")
    class Connection {

        @Test
        @DisplayName("Open then authenticate makes the transport usable")
        void openAndAuthenticate() {
            connect();

            assertThat(transport.isOpen()).isTrue();
            assertThat(transport.probe(TIMEOUT)).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("Calls before the handshake fail with SessionClosedException")
        void callsBeforeHandshake() {
            assertThatThrownBy(() -> transport.probe(TIMEOUT)).isInstanceOf(SessionClosedException.class);

            transport.open("localhost", 4002, 101, TIMEOUT);
            assertThatThrownBy(() -> transport.qualifyContract("SPY", TIMEOUT))
                    .isInstanceOf(SessionClosedException.class);
        }

        @Test
        @DisplayName("Close makes later calls fail")
        void closeEndsSession() {
            connect();

            transport.close();

            assertThat(transport.isOpen()).isFalse();
            assertThatThrownBy(() -> transport.probe(TIMEOUT)).isInstanceOf(SessionClosedException.class);
        }

        @Test
        @DisplayName("Injected open failures are consumed one per attempt")
        void failNextOpens() {
            transport.failNextOpens(2);

            assertThatThrownBy(() -> transport.open("localhost", 4002, 1, TIMEOUT))
                    .isInstanceOf(TransientConnectionException.class);
            assertThatThrownBy(() -> transport.open("localhost", 4002, 2, TIMEOUT))
                    .isInstanceOf(TransientConnectionException.class);
            transport.open("localhost", 4002, 3, TIMEOUT);

            assertThat(transport.isOpen()).isTrue();
        }

        @Test
        @DisplayName("Authentication can be held pending or rejected")
        void authenticationHooks() {
            transport.open("localhost", 4002, 101, TIMEOUT);

            transport.setAuthenticationPending(true);
            assertThatThrownBy(() -> transport.authenticate(TIMEOUT))
                    .isInstanceOfSatisfying(AuthenticationException.class, e -> assertThat(e.isPendingApproval()).isTrue());

            transport.setAuthenticationRejected(true);
            assertThatThrownBy(() -> transport.authenticate(TIMEOUT))
                    .isInstanceOfSatisfying(AuthenticationException.class, e -> assertThat(e.isPendingApproval()).isFalse());
        }

        @Test
        @DisplayName("Failing probe times out")
        void probeFailing() {
            connect();
            transport.setProbeFailing(true);

            assertThatThrownBy(() -> transport.probe(TIMEOUT)).isInstanceOf(RequestTimeoutException.class);
        }
    }

    @Nested
    @DisplayName("Contracts")
    class Contracts {

        @Test
        @DisplayName("Stock and option keys qualify with stable contract ids")
        void qualifiesStocksAndOptions() {
            connect();

            ContractDetails stock = transport.qualifyContract("SPY", TIMEOUT);
            ContractDetails option = transport.qualifyContract("SPY-20260206-C-450", TIMEOUT);

            assertThat(stock.isQualified()).isTrue();
            assertThat(stock.getSecType()).isEqualTo("STK");
            assertThat(option.getSecType()).isEqualTo("OPT");
            assertThat(option.getSymbol()).isEqualTo("SPY");
            assertThat(option.getConId()).isNotEqualTo(stock.getConId());
            assertThat(transport.qualifyContract("SPY", TIMEOUT).getConId()).isEqualTo(stock.getConId());
        }

        @Test
        @DisplayName("Malformed and unknown keys are rejected")
        void rejectsBadKeys() {
            connect();
            transport.markUnknown("ZZZZ");

            assertThatThrownBy(() -> transport.qualifyContract("spy lower", TIMEOUT))
                    .isInstanceOf(QualificationException.class);
            assertThatThrownBy(() -> transport.qualifyContract("ZZZZ", TIMEOUT))
                    .isInstanceOf(QualificationException.class);
        }
    }

    @Nested
    @DisplayName("Market Data")
    class MarketData {

        @Test
        @DisplayName("Snapshots are valid quotes stamped with the current time")
        void snapshotsValid() {
            connect();
            ContractDetails spy = transport.qualifyContract("SPY", TIMEOUT);

            MarketSnapshot snapshot = transport.requestSnapshot(spy, TIMEOUT);

            assertThat(snapshot.isValid()).isTrue();
            assertThat(snapshot.getBid()).isLessThan(snapshot.getAsk());
            assertThat(snapshot.getTimestamp()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("Frozen feed times out snapshot requests")
        void frozenFeed() {
            connect();
            ContractDetails spy = transport.qualifyContract("SPY", TIMEOUT);
            transport.setMarketDataFrozen(true);

            assertThatThrownBy(() -> transport.requestSnapshot(spy, TIMEOUT)).isInstanceOf(RequestTimeoutException.class);
        }

        @Test
        @DisplayName("Historical bars cover the window, pass OHLC checks and are deterministic")
        void historicalBars() {
            connect();
            ContractDetails spy = transport.qualifyContract("SPY", TIMEOUT);
            HistoricalWindow window = HistoricalWindow.lastHour(Instant.parse("2026-01-14T16:00:00Z"), Duration.ofMinutes(5));

            List<HistoricalBar> bars = transport.requestHistoricalBars(spy, window, TIMEOUT);
            List<HistoricalBar> again = transport.requestHistoricalBars(spy, window, TIMEOUT);

            assertThat(bars).hasSize(12).allMatch(HistoricalBar::isValid);
            assertThat(bars.get(0).getTimestamp()).isEqualTo(window.getStart());
            assertThat(again).extracting(HistoricalBar::getClose)
                    .containsExactlyElementsOf(bars.stream().map(HistoricalBar::getClose).collect(Collectors.toList()));
        }
    }
}
