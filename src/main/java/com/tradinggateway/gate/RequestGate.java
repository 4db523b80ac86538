package com.tradinggateway.gate;

import com.tradinggateway.config.GatewaySettings;
import com.tradinggateway.event.SafeModeEvent;
import com.tradinggateway.event.SafeModeEventType;
import com.tradinggateway.event.SessionEvent;
import com.tradinggateway.exception.GatewayException;
import com.tradinggateway.exception.QualificationException;
import com.tradinggateway.exception.RequestTimeoutException;
import com.tradinggateway.exception.SessionClosedException;
import com.tradinggateway.health.HealthMonitor;
import com.tradinggateway.health.SampleStatus;
import com.tradinggateway.observability.GatewayMetricsService;
import com.tradinggateway.session.QualificationResult;
import com.tradinggateway.session.SessionManager;
import com.tradinggateway.session.SessionState;
import com.tradinggateway.transport.ContractDetails;
import com.tradinggateway.transport.GatewayData;
import com.tradinggateway.transport.GatewayTransport;
import com.tradinggateway.transport.HistoricalBar;
import com.tradinggateway.transport.HistoricalBars;
import com.tradinggateway.transport.HistoricalWindow;
import com.tradinggateway.transport.MarketSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * The only path through which callers reach the gateway for data.
 *
 * <p>Validation runs in this order and rejects without any network call:
 * <ol>
 *   <li>mode must be SNAPSHOT, regardless of session state ({@code UNSAFE_MODE_REJECTED})</li>
 *   <li>historical windows must be RTH-only, at most one hour and at most 1000 bars
 *       ({@code RTH_ONLY_REQUIRED}, {@code WINDOW_TOO_LARGE}); never truncated</li>
 *   <li>the session must be READY ({@code SESSION_NOT_READY})</li>
 *   <li>the contract must be qualified in the current session; if it is not, the gate
 *       qualifies it through the session manager and proceeds once the qualification has
 *       been committed ({@code QUALIFICATION_FAILED} for contracts the gateway rejects)</li>
 * </ol>
 *
 * <p>Every accepted request gets a deadline, which bounds queueing, qualification and the
 * transport call, and is passed to the transport as its timeout. A request that misses its
 * deadline is cancelled, returned as {@code REQUEST_TIMEOUT}, and recorded as a TIMEOUT
 * health sample.
 *
 * <p>Concurrency: identical requests in flight are coalesced onto one gateway call; other
 * requests for the same contract are serialized; distinct contracts run concurrently up to
 * {@code maxInFlightRequests}. Every accepted request stays cancellable until it returns,
 * whether it is queued, qualifying, waiting on a coalesced call or at the gateway. When the
 * session leaves READY they are cancelled with {@code SESSION_CLOSED}; when safe mode is
 * entered, with {@code DEGRADED}.
 */
@Service
public class RequestGate {

    private static final Logger log = LoggerFactory.getLogger(RequestGate.class);

    private final GatewaySettings settings;
    private final SessionManager sessionManager;
    private final HealthMonitor healthMonitor;
    private final GatewayTransport transport;
    private final AsyncTaskExecutor ioExecutor;
    private final GatewayMetricsService metricsService;
    private final Clock clock;

    private final Semaphore inFlightPermits;
    private final Map<String, ContractLock> contractLocks = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<RequestResult<GatewayData>>> coalesced = new ConcurrentHashMap<>();
    private final Set<PendingRequest> pendingRequests = ConcurrentHashMap.newKeySet();

    public RequestGate(
            GatewaySettings settings,
            SessionManager sessionManager,
            HealthMonitor healthMonitor,
            GatewayTransport transport,
            @Qualifier("gatewayIoExecutor") AsyncTaskExecutor ioExecutor,
            GatewayMetricsService metricsService,
            Clock clock) {
        this.settings = settings;
        this.sessionManager = sessionManager;
        this.healthMonitor = healthMonitor;
        this.transport = transport;
        this.ioExecutor = ioExecutor;
        this.metricsService = metricsService;
        this.clock = clock;
        this.inFlightPermits = new Semaphore(settings.getMaxInFlightRequests(), true);
    }

    // ==============================
    // PUBLIC API
    // ==============================

    public RequestResult<MarketSnapshot> requestSnapshot(String contractKey) {
        return narrow(submit(DataRequest.snapshot(contractKey)), MarketSnapshot.class);
    }

    public RequestResult<HistoricalBars> requestHistoricalBars(String contractKey, HistoricalWindow window) {
        return narrow(submit(DataRequest.historicalBars(contractKey, window)), HistoricalBars.class);
    }

    public RequestResult<GatewayData> submit(DataRequest request) {
        RequestResult<GatewayData> rejection = validate(request);
        if (rejection != null) {
            log.warn("Request rejected ({}): {}", rejection.getErrorType(), rejection.getError().getMessage());
            metricsService.recordRequestFailure(rejection.getErrorType());
            return rejection;
        }

        Duration timeout = request.getTimeout() != null ? request.getTimeout() : settings.getRequestTimeout();
        Instant issuedAt = clock.instant();
        DataRequest accepted = request.toBuilder()
                .issuedAt(issuedAt)
                .deadline(issuedAt.plus(timeout))
                .build();
        long deadlineNanos = System.nanoTime() + timeout.toNanos();

        PendingRequest pending = new PendingRequest();
        pendingRequests.add(pending);
        RequestResult<GatewayData> result;
        try {
            result = coalesce(accepted, deadlineNanos, pending);
        } finally {
            pendingRequests.remove(pending);
        }
        if (!result.isSuccess()) {
            metricsService.recordRequestFailure(result.getErrorType());
        }
        return result;
    }

    /**
     * Cancels every accepted request that has not returned yet with the given reason. Never
     * waits on a request's progress; safe to call from event listeners running under another
     * component's lock.
     *
     * @return number of requests cancelled
     */
    public int cancelAll(RequestErrorType reason, String message) {
        int cancelled = 0;
        for (PendingRequest pending : pendingRequests) {
            if (pending.cancel(reason)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.warn("Cancelled {} pending gateway request(s) with {}: {}", cancelled, reason, message);
        }
        return cancelled;
    }

    /** Accepted requests that have not returned yet, queued ones included. */
    public int getInFlightCount() {
        return pendingRequests.size();
    }

    /** Contracts with a request currently holding or waiting for their serialization lock. */
    public int getContractLockCount() {
        return contractLocks.size();
    }

    // ==============================
    // CANCELLATION TRIGGERS
    // ==============================

    @EventListener
    public void onSessionEvent(SessionEvent event) {
        if (event.getPreviousState() == SessionState.READY && event.getNewState() != SessionState.READY) {
            cancelAll(RequestErrorType.SESSION_CLOSED, "session " + event.getEventType());
        }
    }

    @EventListener
    public void onSafeModeEvent(SafeModeEvent event) {
        if (event.getEventType() == SafeModeEventType.ENTERED) {
            cancelAll(RequestErrorType.DEGRADED, "safe mode entered: " + event.getDegradation().getTriggerReason());
        }
    }

    // ==============================
    // VALIDATION
    // ==============================

    private RequestResult<GatewayData> validate(DataRequest request) {
        if (request == null) {
            return RequestResult.failure(RequestErrorType.INVALID_REQUEST, "Request is null");
        }
        if (request.getMode() != DataMode.SNAPSHOT) {
            return RequestResult.failure(RequestErrorType.UNSAFE_MODE_REJECTED,
                    "Only snapshot market data is permitted, got " + request.getMode() + " for "
                            + request.getContractKey());
        }
        if (request.getContractKey() == null || request.getContractKey().isBlank()) {
            return RequestResult.failure(RequestErrorType.INVALID_REQUEST, "Contract key is required");
        }
        if (request.getTimeout() != null && (request.getTimeout().isZero() || request.getTimeout().isNegative())) {
            return RequestResult.failure(RequestErrorType.INVALID_REQUEST, "Timeout must be positive");
        }
        if (request.getType() == RequestType.HISTORICAL_BARS) {
            RequestResult<GatewayData> windowRejection = validateWindow(request.getWindow());
            if (windowRejection != null) {
                return windowRejection;
            }
        }
        if (!sessionManager.isReady()) {
            return RequestResult.failure(RequestErrorType.SESSION_NOT_READY,
                    "Gateway session is " + sessionManager.currentState());
        }
        return null;
    }

    private RequestResult<GatewayData> validateWindow(HistoricalWindow window) {
        if (window == null || !window.isWellFormed()) {
            return RequestResult.failure(RequestErrorType.INVALID_REQUEST, "Malformed historical window: " + window);
        }
        if (!window.isUseRth()) {
            return RequestResult.failure(RequestErrorType.RTH_ONLY_REQUIRED,
                    "Historical requests must be restricted to regular trading hours");
        }
        if (window.duration().compareTo(settings.getMaxHistoricalWindow()) > 0) {
            return RequestResult.failure(RequestErrorType.WINDOW_TOO_LARGE,
                    "Window " + window.duration() + " exceeds maximum " + settings.getMaxHistoricalWindow());
        }
        if (window.expectedBarCount() > settings.getMaxHistoricalBars()) {
            return RequestResult.failure(RequestErrorType.WINDOW_TOO_LARGE,
                    "Window yields " + window.expectedBarCount() + " bars, maximum is "
                            + settings.getMaxHistoricalBars());
        }
        return null;
    }

    // ==============================
    // EXECUTION
    // ==============================

    private RequestResult<GatewayData> coalesce(DataRequest request, long deadlineNanos, PendingRequest pending) {
        String key = request.dedupKey();
        while (true) {
            CompletableFuture<RequestResult<GatewayData>> mine = new CompletableFuture<>();
            CompletableFuture<RequestResult<GatewayData>> shared = coalesced.putIfAbsent(key, mine);
            if (shared == null) {
                return lead(request, key, mine, deadlineNanos, pending);
            }

            log.debug("Coalescing {} with in-flight request", key);
            RequestResult<GatewayData> result = awaitShared(request, shared, deadlineNanos, pending);
            // A shared call can time out on the deadline of the request that started it
            if (result.getErrorType() != RequestErrorType.REQUEST_TIMEOUT
                    || pending.isCancelled()
                    || remainingNanos(deadlineNanos) == 0) {
                return result;
            }
            log.debug("Shared call for {} timed out before this request's deadline, retrying", key);
        }
    }

    private RequestResult<GatewayData> lead(
            DataRequest request,
            String key,
            CompletableFuture<RequestResult<GatewayData>> mine,
            long deadlineNanos,
            PendingRequest pending) {
        RequestResult<GatewayData> result =
                RequestResult.failure(RequestErrorType.GATEWAY_ERROR, "Request did not complete");
        try {
            result = executeSerialized(request, deadlineNanos, pending);
            return result;
        } finally {
            coalesced.remove(key, mine);
            mine.complete(result);
        }
    }

    private RequestResult<GatewayData> awaitShared(
            DataRequest request,
            CompletableFuture<RequestResult<GatewayData>> shared,
            long deadlineNanos,
            PendingRequest pending) {
        if (!pending.beginWait()) {
            return cancelled(request, pending);
        }
        try {
            return shared.get(remainingNanos(deadlineNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            return timeout(request, "waiting for coalesced request");
        } catch (InterruptedException e) {
            if (pending.isCancelled()) {
                return cancelled(request, pending);
            }
            Thread.currentThread().interrupt();
            return timeout(request, "interrupted waiting for coalesced request");
        } catch (ExecutionException e) {
            return RequestResult.failure(RequestErrorType.GATEWAY_ERROR, e.getCause().getMessage());
        } finally {
            pending.endWait();
        }
    }

    private RequestResult<GatewayData> executeSerialized(DataRequest request, long deadlineNanos, PendingRequest pending) {
        String contractKey = request.getContractKey();
        ContractLock contractLock = retainContractLock(contractKey);
        try {
            if (!acquire(contractLock.semaphore, deadlineNanos, pending)) {
                return pending.isCancelled()
                        ? cancelled(request, pending)
                        : timeout(request, "waiting for an earlier request on the same contract");
            }
            try {
                if (!acquire(inFlightPermits, deadlineNanos, pending)) {
                    return pending.isCancelled()
                            ? cancelled(request, pending)
                            : timeout(request, "waiting for in-flight capacity");
                }
                try {
                    return execute(request, deadlineNanos, pending);
                } finally {
                    inFlightPermits.release();
                }
            } finally {
                contractLock.semaphore.release();
            }
        } finally {
            releaseContractLock(contractKey);
        }
    }

    private RequestResult<GatewayData> execute(DataRequest request, long deadlineNanos, PendingRequest pending) {
        if (pending.isCancelled()) {
            return cancelled(request, pending);
        }
        if (!sessionManager.isReady()) {
            return RequestResult.failure(RequestErrorType.SESSION_NOT_READY,
                    "Gateway session is " + sessionManager.currentState());
        }

        String contractKey = request.getContractKey();
        Optional<ContractDetails> contract = sessionManager.findQualified(contractKey);
        if (contract.isEmpty()) {
            log.debug("{} {} not qualified in current session, qualifying", RequestErrorType.NOT_QUALIFIED, contractKey);
            QualificationResult qualification = qualify(contractKey, deadlineNanos, pending);
            if (pending.isCancelled()) {
                return cancelled(request, pending);
            }
            if (!qualification.isQualified()) {
                return qualificationFailure(request, qualification);
            }
            contract = sessionManager.findQualified(contractKey);
            if (contract.isEmpty()) {
                return RequestResult.failure(RequestErrorType.SESSION_CLOSED,
                        "Session changed before " + contractKey + " could be used");
            }
        }
        if (pending.isCancelled()) {
            return cancelled(request, pending);
        }
        return call(request, contract.get(), deadlineNanos, pending);
    }

    private QualificationResult qualify(String contractKey, long deadlineNanos, PendingRequest pending) {
        if (!pending.beginWait()) {
            return QualificationResult.unavailable(contractKey, "Request cancelled before qualification");
        }
        try {
            Duration qualificationTimeout = min(settings.getQualificationTimeout(), remaining(deadlineNanos));
            return sessionManager.qualify(contractKey, qualificationTimeout);
        } finally {
            pending.endWait();
        }
    }

    private RequestResult<GatewayData> qualificationFailure(DataRequest request, QualificationResult qualification) {
        if (qualification.isCacheable()) {
            return RequestResult.failure(RequestErrorType.QUALIFICATION_FAILED,
                    "Contract " + request.getContractKey() + " is not valid: " + qualification.getFailureReason());
        }
        if (!sessionManager.isReady()) {
            return RequestResult.failure(RequestErrorType.SESSION_CLOSED, qualification.getFailureReason());
        }
        return timeout(request, "qualification did not complete: " + qualification.getFailureReason());
    }

    private RequestResult<GatewayData> call(
            DataRequest request, ContractDetails contract, long deadlineNanos, PendingRequest pending) {
        Duration remaining = remaining(deadlineNanos);
        if (remaining.isZero()) {
            return timeout(request, "deadline passed before the gateway call");
        }

        long startNanos = System.nanoTime();
        Future<GatewayData> future = ioExecutor.submit(() -> invokeTransport(request, contract, remaining));
        pending.attach(future);
        try {
            GatewayData data = future.get(remaining.toNanos(), TimeUnit.NANOSECONDS);
            return onResponse(request, data, Duration.ofNanos(System.nanoTime() - startNanos));
        } catch (TimeoutException e) {
            future.cancel(true);
            healthMonitor.recordRequestOutcome(SampleStatus.TIMEOUT, null, request.getContractKey());
            return timeout(request, "no gateway response within " + remaining.toMillis() + "ms");
        } catch (CancellationException e) {
            return cancelled(request, pending);
        } catch (ExecutionException e) {
            if (pending.isCancelled()) {
                return cancelled(request, pending);
            }
            return onCallFailure(request, e.getCause(), Duration.ofNanos(System.nanoTime() - startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return timeout(request, "caller interrupted");
        }
    }

    private GatewayData invokeTransport(DataRequest request, ContractDetails contract, Duration timeout) {
        if (request.getType() == RequestType.HISTORICAL_BARS) {
            List<HistoricalBar> bars = transport.requestHistoricalBars(contract, request.getWindow(), timeout);
            return new HistoricalBars(request.getContractKey(), request.getWindow(), bars);
        }
        return transport.requestSnapshot(contract, timeout);
    }

    private RequestResult<GatewayData> onResponse(DataRequest request, GatewayData data, Duration latency) {
        healthMonitor.recordRequestOutcome(SampleStatus.OK, latency, request.getContractKey());
        metricsService.recordRequestLatency(request.getType(), latency);

        if (data instanceof MarketSnapshot) {
            MarketSnapshot snapshot = (MarketSnapshot) data;
            if (!snapshot.isValid()) {
                log.warn("Invalid quote for {}: {}", request.getContractKey(), snapshot);
                return RequestResult.failure(RequestErrorType.INVALID_DATA,
                        "Gateway returned an invalid quote for " + request.getContractKey());
            }
            healthMonitor.recordMarketUpdate(clock.instant());
            return RequestResult.success(snapshot);
        }

        if (data instanceof HistoricalBars) {
            HistoricalBars received = (HistoricalBars) data;
            List<HistoricalBar> valid = received.getBars().stream()
                    .filter(HistoricalBar::isValid)
                    .collect(Collectors.toList());
            int dropped = received.size() - valid.size();
            if (dropped > 0) {
                log.warn("Dropped {} of {} historical bars for {} failing OHLC checks",
                        dropped, received.size(), request.getContractKey());
            }
            return RequestResult.success(new HistoricalBars(received.getContractKey(), received.getWindow(), valid));
        }

        return RequestResult.success(data);
    }

    private RequestResult<GatewayData> onCallFailure(DataRequest request, Throwable cause, Duration latency) {
        String contractKey = request.getContractKey();
        if (cause instanceof RequestTimeoutException) {
            healthMonitor.recordRequestOutcome(SampleStatus.TIMEOUT, null, contractKey);
            return timeout(request, cause.getMessage());
        }
        if (cause instanceof SessionClosedException) {
            return onConnectionClosed(request, cause, latency);
        }
        if (cause instanceof QualificationException) {
            return RequestResult.failure(RequestErrorType.QUALIFICATION_FAILED, cause.getMessage());
        }
        if (cause instanceof GatewayException) {
            log.warn("Gateway error for {} after {}ms: {}", contractKey, latency.toMillis(), cause.getMessage());
        } else {
            log.error("Unexpected error for {}: {}", contractKey, cause.getMessage(), cause);
        }
        healthMonitor.recordRequestOutcome(SampleStatus.ERROR, latency, contractKey + ": " + cause.getMessage());
        return RequestResult.failure(RequestErrorType.GATEWAY_ERROR, cause.getMessage());
    }

    /**
     * The gateway dropped the connection under a READY session. The request fails as a
     * gateway error, not a cancellation, and the session manager is told so it reconnects
     * without waiting for the next probe.
     */
    private RequestResult<GatewayData> onConnectionClosed(DataRequest request, Throwable cause, Duration latency) {
        String contractKey = request.getContractKey();
        if (!sessionManager.isReady()) {
            return RequestResult.failure(RequestErrorType.SESSION_CLOSED, cause.getMessage());
        }
        log.warn("Gateway closed the connection during {} for {}: {}", request.getType(), contractKey, cause.getMessage());
        healthMonitor.recordRequestOutcome(SampleStatus.ERROR, latency, contractKey + ": " + cause.getMessage());
        sessionManager.reportConnectionLost("connection closed during request for " + contractKey + ": "
                + cause.getMessage());
        return RequestResult.failure(RequestErrorType.GATEWAY_ERROR,
                "Gateway closed the connection: " + cause.getMessage());
    }

    // ==============================
    // HELPERS
    // ==============================

    private RequestResult<GatewayData> cancelled(DataRequest request, PendingRequest pending) {
        RequestErrorType reason = pending.getCancelReason() != null
                ? pending.getCancelReason()
                : RequestErrorType.SESSION_CLOSED;
        return RequestResult.failure(reason, "Request for " + request.getContractKey() + " cancelled: " + reason);
    }

    private ContractLock retainContractLock(String contractKey) {
        return contractLocks.compute(contractKey, (key, lock) -> {
            ContractLock retained = lock != null ? lock : new ContractLock();
            retained.users++;
            return retained;
        });
    }

    private void releaseContractLock(String contractKey) {
        contractLocks.computeIfPresent(contractKey, (key, lock) -> --lock.users == 0 ? null : lock);
    }

    private static boolean acquire(Semaphore semaphore, long deadlineNanos, PendingRequest pending) {
        if (!pending.beginWait()) {
            return false;
        }
        boolean acquired = false;
        try {
            acquired = semaphore.tryAcquire(remainingNanos(deadlineNanos), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            if (!pending.isCancelled()) {
                Thread.currentThread().interrupt();
            }
        } finally {
            pending.endWait();
        }
        if (acquired && pending.isCancelled()) {
            semaphore.release();
            return false;
        }
        return acquired;
    }

    private RequestResult<GatewayData> timeout(DataRequest request, String detail) {
        log.warn("Request {} for {} timed out: {}", request.getType(), request.getContractKey(), detail);
        return RequestResult.failure(RequestErrorType.REQUEST_TIMEOUT,
                "Request for " + request.getContractKey() + " timed out: " + detail);
    }

    private static long remainingNanos(long deadlineNanos) {
        return Math.max(0, deadlineNanos - System.nanoTime());
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(remainingNanos(deadlineNanos));
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static <T extends GatewayData> RequestResult<T> narrow(RequestResult<GatewayData> result, Class<T> type) {
        if (result.isSuccess()) {
            return RequestResult.success(type.cast(result.getData()));
        }
        return result.castFailure();
    }

    /** Per-contract serialization lock, dropped from the map once no request holds or awaits it. */
    private static final class ContractLock {

        private final Semaphore semaphore = new Semaphore(1, true);

        // Mutated only inside contractLocks.compute for this contract
        private int users;
    }

    /**
     * An accepted request, cancellable with a typed reason until it returns. A cancel
     * interrupts the caller only while it is inside a wait opened with {@link #beginWait()},
     * and {@link #endWait()} clears that interrupt again.
     */
    private static final class PendingRequest {

        private final Thread caller = Thread.currentThread();
        private volatile RequestErrorType cancelReason;

        // Guarded by this
        private boolean waiting;
        private Future<?> gatewayCall;

        synchronized boolean cancel(RequestErrorType reason) {
            if (cancelReason != null) {
                return false;
            }
            cancelReason = reason;
            if (gatewayCall != null) {
                gatewayCall.cancel(true);
            }
            if (waiting) {
                caller.interrupt();
            }
            return true;
        }

        synchronized boolean beginWait() {
            if (cancelReason != null) {
                return false;
            }
            waiting = true;
            return true;
        }

        synchronized void endWait() {
            waiting = false;
            if (cancelReason != null) {
                Thread.interrupted();
            }
        }

        synchronized void attach(Future<?> call) {
            gatewayCall = call;
            if (cancelReason != null) {
                call.cancel(true);
            }
        }

        boolean isCancelled() {
            return cancelReason != null;
        }

        RequestErrorType getCancelReason() {
            return cancelReason;
        }
    }
}
