package com.tradinggateway.transport;

import com.tradinggateway.exception.AuthenticationException;
import com.tradinggateway.exception.QualificationException;
import com.tradinggateway.exception.RequestTimeoutException;
import com.tradinggateway.exception.SessionClosedException;
import com.tradinggateway.exception.TransientConnectionException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-process implementation of {@link GatewayTransport} for paper mode and local development.
 *
 * <p>Accepts any well-formed contract key (stock "SPY", option "SPY-20260206-C-450")
 * except those explicitly marked unknown, and generates a per-contract random walk
 * for snapshots and historical bars. Failure injection hooks ({@link #failNextOpens},
 * {@link #setAuthenticationPending}, {@link #setProbeFailing}, {@link #setMarketDataFrozen})
 * let an operator rehearse reconnects and safe mode without a real gateway.
 *
 * <p>Active when {@code gateway.transport=SIMULATED} (the default). A live adapter
 * registers its own {@link GatewayTransport} bean and sets the property to its name.
 */
@Component
@ConditionalOnProperty(name = "gateway.transport", havingValue = "SIMULATED", matchIfMissing = true)
public class SimulatedGatewayTransport implements GatewayTransport {

    private static final Logger log = LoggerFactory.getLogger(SimulatedGatewayTransport.class);

    private static final Pattern STOCK_KEY = Pattern.compile("^([A-Z][A-Z.]{0,5})$");
    private static final Pattern OPTION_KEY = Pattern.compile("^([A-Z][A-Z.]{0,5})-(\\d{8})-([CP])-(\\d+(?:\\.\\d+)?)$");

    private static final BigDecimal HALF_SPREAD = new BigDecimal("0.01");

    private final Clock clock;

    private final AtomicBoolean open = new AtomicBoolean(false);
    private final AtomicBoolean authenticated = new AtomicBoolean(false);
    private final AtomicInteger remainingOpenFailures = new AtomicInteger(0);
    private final AtomicBoolean authenticationPending = new AtomicBoolean(false);
    private final AtomicBoolean authenticationRejected = new AtomicBoolean(false);
    private final AtomicBoolean probeFailing = new AtomicBoolean(false);
    private final AtomicBoolean marketDataFrozen = new AtomicBoolean(false);
    private final AtomicLong nextConId = new AtomicLong(100_000);

    private final Set<String> unknownContracts = ConcurrentHashMap.newKeySet();
    private final Map<String, Long> conIds = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    private volatile Integer activeClientId;

    public SimulatedGatewayTransport(Clock clock) {
        this.clock = clock;
    }

    // ==============================
    // CONNECTION
    // ==============================

    @Override
    public void open(String host, int port, int clientId, Duration timeout) {
        if (remainingOpenFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransientConnectionException("Simulated connection refused by " + host + ":" + port);
        }
        open.set(true);
        authenticated.set(false);
        activeClientId = clientId;
        log.info("Simulator: socket opened to {}:{} (clientId={})", host, port, clientId);
    }

    @Override
    public void authenticate(Duration timeout) {
        requireOpen();
        if (authenticationRejected.get()) {
            throw AuthenticationException.rejected("Simulated login rejected");
        }
        if (authenticationPending.get()) {
            throw AuthenticationException.pendingApproval("Simulated login waiting for 2FA approval");
        }
        authenticated.set(true);
        log.info("Simulator: handshake complete (clientId={})", activeClientId);
    }

    @Override
    public void close() {
        if (open.getAndSet(false)) {
            log.info("Simulator: socket closed (clientId={})", activeClientId);
        }
        authenticated.set(false);
        activeClientId = null;
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    // ==============================
    // CONTRACTS
    // ==============================

    @Override
    public ContractDetails qualifyContract(String contractKey, Duration timeout) {
        requireAuthenticated();
        if (contractKey == null || unknownContracts.contains(contractKey)) {
            throw new QualificationException(contractKey, "No security definition found for " + contractKey);
        }

        Matcher option = OPTION_KEY.matcher(contractKey);
        Matcher stock = STOCK_KEY.matcher(contractKey);
        String symbol;
        String secType;
        if (option.matches()) {
            symbol = option.group(1);
            secType = "OPT";
        } else if (stock.matches()) {
            symbol = stock.group(1);
            secType = "STK";
        } else {
            throw new QualificationException(contractKey, "Malformed contract key: " + contractKey);
        }

        long conId = conIds.computeIfAbsent(contractKey, k -> nextConId.incrementAndGet());
        return ContractDetails.builder()
                .contractKey(contractKey)
                .conId(conId)
                .symbol(symbol)
                .secType(secType)
                .exchange("SMART")
                .currency("USD")
                .build();
    }

    // ==============================
    // MARKET DATA
    // ==============================

    @Override
    public MarketSnapshot requestSnapshot(ContractDetails contract, Duration timeout) {
        requireAuthenticated();
        if (marketDataFrozen.get()) {
            throw new RequestTimeoutException("Simulated market data feed frozen for " + contract.getContractKey());
        }
        BigDecimal last = lastPrices.compute(contract.getContractKey(), (key, previous) -> step(contract, previous));
        return MarketSnapshot.builder()
                .contractKey(contract.getContractKey())
                .bid(last.subtract(HALF_SPREAD))
                .ask(last.add(HALF_SPREAD))
                .last(last)
                .volume(1_000L + (contract.getConId() % 500))
                .timestamp(clock.instant())
                .build();
    }

    @Override
    public List<HistoricalBar> requestHistoricalBars(
            ContractDetails contract, HistoricalWindow window, Duration timeout) {
        requireAuthenticated();
        Random random = new Random(contract.getConId() ^ window.getStart().toEpochMilli());
        BigDecimal price = startingPrice(contract);
        List<HistoricalBar> bars = new ArrayList<>();

        for (Instant barStart = window.getStart();
                barStart.isBefore(window.getEnd());
                barStart = barStart.plus(window.getBarSize())) {
            BigDecimal open = price;
            BigDecimal close = drift(open, random);
            BigDecimal high = open.max(close).add(HALF_SPREAD);
            BigDecimal low = open.min(close).subtract(HALF_SPREAD);
            bars.add(HistoricalBar.builder()
                    .timestamp(barStart)
                    .open(open)
                    .high(high)
                    .low(low)
                    .close(close)
                    .volume(100L + random.nextInt(900))
                    .average(open.add(close).divide(BigDecimal.valueOf(2), 4, RoundingMode.HALF_UP))
                    .barCount(1 + random.nextInt(50))
                    .build());
            price = close;
        }
        return bars;
    }

    // ==============================
    // HEALTH
    // ==============================

    @Override
    public Instant probe(Duration timeout) {
        requireOpen();
        if (probeFailing.get()) {
            throw new RequestTimeoutException("Simulated probe timed out after " + timeout.toMillis() + "ms");
        }
        return clock.instant();
    }

    // ==============================
    // FAILURE INJECTION
    // ==============================

    /** The next {@code count} open attempts fail with a transient connection error. */
    public void failNextOpens(int count) {
        remainingOpenFailures.set(count);
    }

    public void setAuthenticationPending(boolean pending) {
        authenticationPending.set(pending);
    }

    public void setAuthenticationRejected(boolean rejected) {
        authenticationRejected.set(rejected);
    }

    public void setProbeFailing(boolean failing) {
        probeFailing.set(failing);
    }

    /** Snapshot requests time out while frozen, modelling a gateway that stops delivering data. */
    public void setMarketDataFrozen(boolean frozen) {
        marketDataFrozen.set(frozen);
    }

    public void markUnknown(String contractKey) {
        unknownContracts.add(contractKey);
    }

    // ==============================
    // INTERNALS
    // ==============================

    private void requireOpen() {
        if (!open.get()) {
            throw new SessionClosedException("Simulated gateway socket is not open");
        }
    }

    private void requireAuthenticated() {
        requireOpen();
        if (!authenticated.get()) {
            throw new SessionClosedException("Simulated gateway handshake not completed");
        }
    }

    private BigDecimal step(ContractDetails contract, BigDecimal previous) {
        BigDecimal base = previous != null ? previous : startingPrice(contract);
        return drift(base, new Random(contract.getConId() ^ clock.millis()));
    }

    private static BigDecimal startingPrice(ContractDetails contract) {
        long seed = Math.abs(contract.getSymbol().hashCode() % 400);
        BigDecimal price = BigDecimal.valueOf(50 + seed);
        if ("OPT".equals(contract.getSecType())) {
            price = price.divide(BigDecimal.valueOf(40), 2, RoundingMode.HALF_UP);
        }
        return price.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal drift(BigDecimal price, Random random) {
        double pct = (random.nextDouble() - 0.5) * 0.002;
        BigDecimal next = price.multiply(BigDecimal.valueOf(1 + pct)).setScale(2, RoundingMode.HALF_UP);
        return next.signum() > 0 ? next : new BigDecimal("0.05");
    }
}
