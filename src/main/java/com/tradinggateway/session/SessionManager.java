package com.tradinggateway.session;

import com.tradinggateway.config.GatewaySettings;
import com.tradinggateway.event.EventPublisherHelper;
import com.tradinggateway.event.HealthSampleEvent;
import com.tradinggateway.event.SessionEventType;
import com.tradinggateway.exception.AuthenticationException;
import com.tradinggateway.exception.GatewayException;
import com.tradinggateway.exception.QualificationException;
import com.tradinggateway.health.HealthSample;
import com.tradinggateway.health.HealthSignal;
import com.tradinggateway.health.HealthSignalListener;
import com.tradinggateway.health.HealthSignalType;
import com.tradinggateway.transport.ContractDetails;
import com.tradinggateway.transport.GatewayTransport;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Owns the single logical gateway connection and drives its state machine.
 *
 * <p>All session mutations happen while holding {@code stateLock}, and every transition
 * publishes a {@link com.tradinggateway.event.SessionEvent} before the lock is released, so
 * listeners see transitions in a total order. Connection attempts run on one dedicated
 * supervisor thread; the retry delay between attempts comes from {@link RetryBackoffController}.
 * Gateway calls themselves (open, authenticate, qualify) run without the lock so that
 * {@link #disconnect()} and state reads never wait on the network. Qualification runs on the
 * gateway I/O executor, so a caller waits at most its timeout even when the transport does not.
 *
 * <p>A connect cycle is identified by a generation number. Disconnecting, giving up, or
 * starting a new cycle bumps the generation, which makes any attempt still scheduled or
 * running for an older cycle discard its result.
 *
 * <p>Reads ({@link #currentState()}, {@link #snapshot()}) never block.
 */
@Service
public class SessionManager implements HealthSignalListener {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final GatewaySettings settings;
    private final GatewayTransport transport;
    private final ClientIdAllocator clientIdAllocator;
    private final RetryBackoffController retryBackoffController;
    private final EventPublisherHelper eventPublisherHelper;
    private final AsyncTaskExecutor ioExecutor;
    private final Clock clock;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final ScheduledExecutorService supervisor;

    // Written under stateLock
    private SessionState state = SessionState.DISCONNECTED;
    private volatile Session session;
    private ConnectionAttempt currentAttempt;
    private long generation;
    private CompletableFuture<SessionState> cycleFuture;

    private volatile SessionState publishedState = SessionState.DISCONNECTED;
    private volatile SessionSnapshot snapshot;

    public SessionManager(
            GatewaySettings settings,
            GatewayTransport transport,
            ClientIdAllocator clientIdAllocator,
            RetryBackoffController retryBackoffController,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("gatewayIoExecutor") AsyncTaskExecutor ioExecutor,
            Clock clock) {
        this.settings = settings;
        this.transport = transport;
        this.clientIdAllocator = clientIdAllocator;
        this.retryBackoffController = retryBackoffController;
        this.eventPublisherHelper = eventPublisherHelper;
        this.ioExecutor = ioExecutor;
        this.clock = clock;
        this.supervisor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "session-supervisor");
            thread.setDaemon(true);
            return thread;
        });
        this.snapshot = SessionSnapshot.disconnected(retryBackoffController.getMaxAttempts(), clock.instant());
    }

    // ==============================
    // LIFECYCLE
    // ==============================

    /**
     * Starts a connect cycle and waits until the session is READY, the cycle gives up,
     * or the startup timeout elapses. A no-op when the session is already READY or a cycle
     * is already running (the caller then waits on that cycle).
     *
     * @return the session state when the wait ended
     */
    public SessionState connect() {
        CompletableFuture<SessionState> cycle = connectAsync();
        Duration timeout = settings.getStartupTimeout();
        try {
            return cycle.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Gateway session not READY within startup timeout {} (state={})", timeout, currentState());
            return currentState();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for gateway session");
            return currentState();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Connect cycle failed unexpectedly", e.getCause());
        }
    }

    /**
     * Non-blocking variant of {@link #connect()}. The returned future completes with READY
     * or DISCONNECTED when the cycle ends.
     */
    public CompletableFuture<SessionState> connectAsync() {
        stateLock.lock();
        try {
            if (state == SessionState.READY) {
                return CompletableFuture.completedFuture(SessionState.READY);
            }
            if (isCycleRunning()) {
                return cycleFuture;
            }
            startCycle(FailureClass.TRANSPORT, "connect requested");
            return cycleFuture;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Graceful disconnect: closes the transport, cancels any running connect cycle and moves
     * to DISCONNECTED without raising a degradation event. In-flight requests are cancelled
     * by the request gate when it observes the SESSION_SHUTDOWN event.
     */
    public void disconnect() {
        disconnect("disconnect requested");
    }

    public void disconnect(String reason) {
        stateLock.lock();
        try {
            generation++;
            transport.close();
            if (state != SessionState.DISCONNECTED) {
                currentAttempt = null;
                transition(SessionState.DISCONNECTED, SessionEventType.SESSION_SHUTDOWN, reason);
                session = null;
                refreshSnapshot();
                log.info("Gateway session disconnected: {}", reason);
            }
            completeCycle(SessionState.DISCONNECTED);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Graceful disconnect followed by a fresh connect cycle. Used for the gateway's
     * scheduled restarts; never raises a degradation event by itself.
     */
    public SessionState restart(String reason) {
        log.info("Restarting gateway session: {}", reason);
        disconnect("restart: " + reason);
        return connect();
    }

    @PreDestroy
    public void shutdown() {
        disconnect("application shutdown");
        supervisor.shutdownNow();
    }

    // ==============================
    // READS
    // ==============================

    public SessionState currentState() {
        return publishedState;
    }

    public boolean isReady() {
        return publishedState == SessionState.READY;
    }

    public SessionSnapshot snapshot() {
        return snapshot;
    }

    /**
     * Details of a contract already qualified in the current session. Lock-free.
     */
    public Optional<ContractDetails> findQualified(String contractKey) {
        Session current = session;
        if (current == null || publishedState != SessionState.READY) {
            return Optional.empty();
        }
        return current.qualifiedContract(contractKey);
    }

    // ==============================
    // QUALIFICATION
    // ==============================

    public QualificationResult qualify(String contractKey) {
        return qualify(contractKey, settings.getQualificationTimeout());
    }

    /**
     * Qualifies a contract against the current session, issuing at most one gateway
     * round-trip per contract per session. Concurrent callers for the same contract share
     * the pending round-trip. Definitive outcomes (qualified or rejected) are committed to
     * the session before this method returns them.
     */
    public QualificationResult qualify(String contractKey, Duration timeout) {
        Session current = session;
        if (current == null || publishedState != SessionState.READY) {
            return QualificationResult.unavailable(contractKey, "Session not READY");
        }

        QualificationResult cached = current.cachedQualification(contractKey);
        if (cached != null) {
            return cached;
        }

        CompletableFuture<QualificationResult> mine = new CompletableFuture<>();
        CompletableFuture<QualificationResult> pending =
                current.pendingQualifications().putIfAbsent(contractKey, mine);
        if (pending != null) {
            return awaitQualification(contractKey, pending, timeout);
        }

        QualificationResult result = QualificationResult.unavailable(contractKey, "Qualification did not complete");
        try {
            result = qualifyOnGateway(contractKey, timeout);
            result = commitQualification(current, result);
            return result;
        } finally {
            current.pendingQualifications().remove(contractKey, mine);
            mine.complete(result);
        }
    }

    private QualificationResult qualifyOnGateway(String contractKey, Duration timeout) {
        Future<ContractDetails> future = ioExecutor.submit(() -> transport.qualifyContract(contractKey, timeout));
        try {
            ContractDetails details = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (details == null || !details.isQualified()) {
                return QualificationResult.rejected(contractKey, "Gateway returned no contract id for " + contractKey);
            }
            log.info("Contract {} qualified (conId={})", contractKey, details.getConId());
            return QualificationResult.qualified(details);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Qualification of {} got no answer within {}ms", contractKey, timeout.toMillis());
            return QualificationResult.unavailable(contractKey, "No qualification answer within " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return QualificationResult.unavailable(contractKey, "Interrupted during qualification");
        } catch (CancellationException e) {
            return QualificationResult.unavailable(contractKey, "Qualification cancelled");
        } catch (ExecutionException e) {
            return qualificationFailure(contractKey, e.getCause());
        }
    }

    private QualificationResult qualificationFailure(String contractKey, Throwable cause) {
        if (cause instanceof QualificationException) {
            log.warn("Contract {} rejected by gateway: {}", contractKey, cause.getMessage());
            return QualificationResult.rejected(contractKey, cause.getMessage());
        }
        if (cause instanceof GatewayException) {
            log.warn("Qualification of {} did not complete: {}", contractKey, cause.getMessage());
        } else {
            log.error("Unexpected error qualifying {}: {}", contractKey, cause.getMessage(), cause);
        }
        return QualificationResult.unavailable(contractKey, cause.getMessage());
    }

    private QualificationResult commitQualification(Session origin, QualificationResult result) {
        stateLock.lock();
        try {
            if (session != origin || state != SessionState.READY) {
                return QualificationResult.unavailable(result.getContractKey(), "Session closed during qualification");
            }
            if (result.isCacheable()) {
                origin.commit(result);
                refreshSnapshot();
            }
            return result;
        } finally {
            stateLock.unlock();
        }
    }

    private QualificationResult awaitQualification(
            String contractKey, CompletableFuture<QualificationResult> pending, Duration timeout) {
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return QualificationResult.unavailable(contractKey, "Timed out waiting for qualification");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return QualificationResult.unavailable(contractKey, "Interrupted waiting for qualification");
        } catch (ExecutionException e) {
            return QualificationResult.unavailable(contractKey, e.getCause().getMessage());
        }
    }

    // ==============================
    // HEALTH INPUTS
    // ==============================

    /**
     * A DEGRADING or STALE verdict from the health monitor forces a READY session into
     * RECONNECTING and starts a fresh attempt budget. Ignored in any other state.
     */
    @Override
    public void onHealthSignal(HealthSignal signal) {
        stateLock.lock();
        try {
            if (state != SessionState.READY) {
                log.debug("Ignoring {} signal in state {}", signal.getType(), state);
                return;
            }
            FailureClass failureClass =
                    signal.getType() == HealthSignalType.DEGRADING ? FailureClass.HEALTH_DEGRADED : FailureClass.DATA_STALE;
            log.warn("Health signal {} on READY session: {}", signal.getType(), signal.getMessage());
            transport.close();
            transition(SessionState.RECONNECTING, SessionEventType.SESSION_RECONNECTING, signal.getMessage());
            startCycle(failureClass, "health signal " + signal.getType());
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * The transport reported the connection closed while serving a request. Handled like a
     * health signal: a READY session is moved to RECONNECTING with a fresh attempt budget.
     * Ignored in any other state.
     */
    public void reportConnectionLost(String reason) {
        stateLock.lock();
        try {
            if (state != SessionState.READY) {
                log.debug("Ignoring connection loss in state {}: {}", state, reason);
                return;
            }
            log.warn("Gateway connection lost on READY session: {}", reason);
            transport.close();
            transition(SessionState.RECONNECTING, SessionEventType.SESSION_RECONNECTING, reason);
            startCycle(FailureClass.TRANSPORT, "connection lost");
        } finally {
            stateLock.unlock();
        }
    }

    @EventListener
    public void onHealthSample(HealthSampleEvent event) {
        HealthSample sample = event.getSample();
        if (!sample.isOk()) {
            return;
        }
        stateLock.lock();
        try {
            if (state == SessionState.READY && session != null) {
                session.heartbeat(sample.getTimestamp());
                refreshSnapshot();
            }
        } finally {
            stateLock.unlock();
        }
    }

    // ==============================
    // CONNECT CYCLE (supervisor thread)
    // ==============================

    /** Caller holds stateLock. */
    private void startCycle(FailureClass failureClass, String reason) {
        generation++;
        if (cycleFuture == null || cycleFuture.isDone()) {
            cycleFuture = new CompletableFuture<>();
        }
        log.info("Starting gateway connect cycle ({}), budget {} attempts", reason, retryBackoffController.getMaxAttempts());
        scheduleAttempt(generation, 1, failureClass);
    }

    /** Caller holds stateLock. */
    private void scheduleAttempt(long cycle, int attemptNumber, FailureClass previousFailure) {
        BackoffDecision decision = retryBackoffController.decide(attemptNumber, previousFailure);
        if (decision.isGiveUp()) {
            giveUp(decision.getGiveUpReason());
            return;
        }
        Duration delay = decision.getDelay();
        if (attemptNumber > 1) {
            log.info("Next gateway connection attempt {}/{} in {}ms",
                    attemptNumber, retryBackoffController.getMaxAttempts(), delay.toMillis());
        }
        supervisor.schedule(() -> runAttempt(cycle, attemptNumber), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runAttempt(long cycle, int attemptNumber) {
        ConnectionAttempt attempt;
        stateLock.lock();
        try {
            if (cycle != generation) {
                return;
            }
            ClientId clientId = clientIdAllocator.next();
            attempt = new ConnectionAttempt(attemptNumber, clientId, clock.instant());
            currentAttempt = attempt;
            session = new Session(clientId, attempt.getStartedAt());
            transition(SessionState.CONNECTING, SessionEventType.SESSION_CONNECTING,
                    "Attempt " + attemptNumber + " with client id " + clientId);
        } finally {
            stateLock.unlock();
        }

        FailureClass stage = FailureClass.TRANSPORT;
        try {
            transport.open(settings.getHost(), settings.getPort(), attempt.getClientId().getValue(),
                    settings.getHandshakeTimeout());
            if (!advance(cycle, SessionState.AUTHENTICATING, SessionEventType.SESSION_AUTHENTICATING, "Socket open")) {
                return;
            }
            stage = FailureClass.HANDSHAKE;
            transport.authenticate(settings.getHandshakeTimeout());
            markReady(cycle, attempt);
        } catch (AuthenticationException e) {
            FailureClass failureClass = e.isPendingApproval()
                    ? FailureClass.AUTHENTICATION_PENDING
                    : FailureClass.AUTHENTICATION_REJECTED;
            onAttemptFailed(cycle, attempt, failureClass, e.getMessage());
        } catch (GatewayException e) {
            onAttemptFailed(cycle, attempt, stage, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error during gateway connection attempt {}: {}", attemptNumber, e.getMessage(), e);
            onAttemptFailed(cycle, attempt, stage, e.toString());
        }
    }

    private boolean advance(long cycle, SessionState next, SessionEventType eventType, String message) {
        stateLock.lock();
        try {
            if (cycle != generation) {
                transport.close();
                return false;
            }
            transition(next, eventType, message);
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    private void markReady(long cycle, ConnectionAttempt attempt) {
        stateLock.lock();
        try {
            if (cycle != generation) {
                transport.close();
                return;
            }
            attempt.succeeded();
            session.markReady(clock.instant());
            transition(SessionState.READY, SessionEventType.SESSION_READY,
                    "Session READY after " + attempt.getAttemptNumber() + " attempt(s)");
            log.info("Gateway session READY (clientId={}, attempt={})",
                    attempt.getClientId(), attempt.getAttemptNumber());
            currentAttempt = null;
            refreshSnapshot();
            completeCycle(SessionState.READY);
        } finally {
            stateLock.unlock();
        }
    }

    private void onAttemptFailed(long cycle, ConnectionAttempt attempt, FailureClass failureClass, String message) {
        stateLock.lock();
        try {
            if (cycle != generation) {
                return;
            }
            attempt.failed(failureClass, message);
            transport.close();
            log.warn("Gateway connection attempt {}/{} failed ({}): {}",
                    attempt.getAttemptNumber(), retryBackoffController.getMaxAttempts(), failureClass, message);

            if (failureClass == FailureClass.AUTHENTICATION_REJECTED) {
                giveUp(GiveUpReason.NOT_RETRYABLE);
                return;
            }
            transition(SessionState.RECONNECTING, SessionEventType.SESSION_RECONNECTING,
                    "Attempt " + attempt.getAttemptNumber() + " failed: " + message);
            scheduleAttempt(cycle, attempt.getAttemptNumber() + 1, failureClass);
        } finally {
            stateLock.unlock();
        }
    }

    /** Caller holds stateLock. */
    private void giveUp(GiveUpReason reason) {
        generation++;
        transport.close();
        String lastFailure = currentAttempt != null ? currentAttempt.getFailureMessage() : null;
        int attempts = currentAttempt != null ? currentAttempt.getAttemptNumber() : 0;
        session = null;

        if (reason == GiveUpReason.NOT_RETRYABLE) {
            log.error("Gateway rejected authentication, not retrying: {}", lastFailure);
            transition(SessionState.DISCONNECTED, SessionEventType.SESSION_AUTH_FAILED,
                    "Authentication rejected: " + lastFailure);
        } else {
            log.error("Gateway connection budget exhausted after {} attempts, last failure: {}", attempts, lastFailure);
            transition(SessionState.DISCONNECTED, SessionEventType.SESSION_EXHAUSTED,
                    "Gave up after " + attempts + " attempts: " + lastFailure);
        }
        completeCycle(SessionState.DISCONNECTED);
    }

    // ==============================
    // INTERNALS
    // ==============================

    private boolean isCycleRunning() {
        return cycleFuture != null && !cycleFuture.isDone();
    }

    /** Caller holds stateLock. */
    private void completeCycle(SessionState outcome) {
        if (cycleFuture != null && !cycleFuture.isDone()) {
            cycleFuture.complete(outcome);
        }
    }

    /** Caller holds stateLock. Publishes while still holding it to keep events in transition order. */
    private void transition(SessionState next, SessionEventType eventType, String message) {
        SessionState previous = state;
        state = next;
        publishedState = next;
        refreshSnapshot();
        Integer clientId = session != null ? session.getClientId().getValue() : null;
        int attemptNumber = currentAttempt != null ? currentAttempt.getAttemptNumber() : 0;
        log.debug("Session transition {} -> {} ({})", previous, next, message);
        eventPublisherHelper.publishSessionTransition(
                this, eventType, previous, next, clientId, attemptNumber, message, clock.instant());
    }

    /** Caller holds stateLock. */
    private void refreshSnapshot() {
        Session current = session;
        ConnectionAttempt attempt = currentAttempt;
        SessionSnapshot.SessionSnapshotBuilder builder = SessionSnapshot.builder()
                .state(state)
                .maxAttempts(retryBackoffController.getMaxAttempts())
                .attemptNumber(attempt != null ? attempt.getAttemptNumber() : 0)
                .lastFailureClass(attempt != null ? attempt.getFailureClass() : null)
                .lastFailureMessage(attempt != null ? attempt.getFailureMessage() : null)
                .updatedAt(clock.instant());
        if (current != null) {
            builder.clientId(current.getClientId().getValue())
                    .sessionCreatedAt(current.getCreatedAt())
                    .readyAt(current.getReadyAt())
                    .lastHeartbeatAt(current.getLastHeartbeatAt())
                    .qualifiedContracts(current.qualifiedKeys())
                    .rejectedContracts(current.rejectedKeys());
        }
        snapshot = builder.build();
    }
}
