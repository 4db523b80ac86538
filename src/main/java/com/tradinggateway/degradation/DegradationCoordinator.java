package com.tradinggateway.degradation;

import com.tradinggateway.config.GatewaySettings;
import com.tradinggateway.event.EventPublisherHelper;
import com.tradinggateway.event.HealthSampleEvent;
import com.tradinggateway.event.HealthSignalEvent;
import com.tradinggateway.event.SessionEvent;
import com.tradinggateway.exception.BusinessException;
import com.tradinggateway.exception.ErrorCode;
import com.tradinggateway.health.HealthSignal;
import com.tradinggateway.health.HealthSignalType;
import com.tradinggateway.session.SessionManager;
import com.tradinggateway.session.SessionState;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Process-wide arbiter of whether it is safe to act.
 *
 * <p>Holds the {@code safeModeActive} flag and the open {@link DegradationEvent}. Safe mode
 * is entered immediately, without waiting for the trigger to resolve, on:
 * <ul>
 *   <li>CONNECTION_EXHAUSTED: the session manager gave up reconnecting</li>
 *   <li>DATA_STALE: a STALE health signal persisted beyond the grace period</li>
 *   <li>AUTHENTICATION_FAILED: the gateway rejected the login</li>
 *   <li>MANUAL_OVERRIDE: an operator forced it</li>
 * </ul>
 *
 * <p>Recovery requires the session to be READY and {@code recoveryHealthySamples} consecutive
 * healthy samples observed while READY after entry; a non-ok sample, any health signal, or the
 * session leaving READY resets the count. AUTHENTICATION_FAILED and MANUAL_OVERRIDE also need
 * an operator {@link #acknowledge}.
 *
 * <p>While safe mode is active, the session is DISCONNECTED and no acknowledgement is pending,
 * a scheduled recovery tick asks the session manager to start a new connect cycle.
 *
 * <p>The coordinator lock is never held while calling into the session manager.
 */
@Service
public class DegradationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DegradationCoordinator.class);

    private final GatewaySettings settings;
    private final SessionManager sessionManager;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong eventIds = new AtomicLong(0);
    private final Deque<DegradationEvent> history = new ArrayDeque<>();

    private volatile boolean safeModeActive;
    private volatile DegradationEvent openEvent;

    // Guarded by lock
    private boolean sessionReady;
    private int healthySamples;

    public DegradationCoordinator(
            GatewaySettings settings,
            SessionManager sessionManager,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.settings = settings;
        this.sessionManager = sessionManager;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ==============================
    // READS
    // ==============================

    public boolean isSafeModeActive() {
        return safeModeActive;
    }

    public Optional<DegradationEvent> getOpenEvent() {
        return Optional.ofNullable(openEvent);
    }

    /** Closed degradation events, newest first. */
    public List<DegradationEvent> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    public int getHealthySamplesSinceReady() {
        lock.lock();
        try {
            return healthySamples;
        } finally {
            lock.unlock();
        }
    }

    // ==============================
    // TRIGGERS
    // ==============================

    @EventListener
    public void onSessionEvent(SessionEvent event) {
        lock.lock();
        try {
            sessionReady = event.getNewState() == SessionState.READY;
            healthySamples = 0;

            switch (event.getEventType()) {
                case SESSION_EXHAUSTED -> enter(TriggerReason.CONNECTION_EXHAUSTED, event.getMessage());
                case SESSION_AUTH_FAILED -> enter(TriggerReason.AUTHENTICATION_FAILED, event.getMessage());
                default -> {
                    // other transitions only affect the recovery count
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @EventListener
    public void onHealthSignal(HealthSignalEvent event) {
        HealthSignal signal = event.getSignal();
        lock.lock();
        try {
            healthySamples = 0;
            if (signal.getType() != HealthSignalType.STALE || signal.getStaleSince() == null) {
                return;
            }
            Duration staleFor = Duration.between(signal.getStaleSince(), signal.getRaisedAt());
            if (staleFor.compareTo(settings.getStaleGracePeriod()) >= 0) {
                enter(TriggerReason.DATA_STALE, signal.getMessage());
            } else {
                log.debug("Data stale for {}s, within grace period {}", staleFor.toSeconds(),
                        settings.getStaleGracePeriod());
            }
        } finally {
            lock.unlock();
        }
    }

    /** Operator-forced safe mode. Leaving it requires an acknowledgement. */
    public DegradationEvent enterManualOverride(String reason, String operator) {
        lock.lock();
        try {
            enter(TriggerReason.MANUAL_OVERRIDE, "Forced by " + operator + ": " + reason);
            return openEvent;
        } finally {
            lock.unlock();
        }
    }

    /** Caller holds lock. */
    private void enter(TriggerReason reason, String message) {
        if (safeModeActive && openEvent != null) {
            DegradationEvent current = openEvent;
            if (reason.isAcknowledgementRequired() && !current.isAwaitingAcknowledgement()) {
                openEvent = current.toBuilder()
                        .acknowledgementRequired(true)
                        .acknowledgedAt(null)
                        .acknowledgedBy(null)
                        .message(current.getMessage() + "; then " + reason + ": " + message)
                        .build();
            }
            log.warn("Safe mode already active ({}), additional trigger {}: {}",
                    current.getTriggerReason(), reason, message);
            return;
        }

        DegradationEvent event = DegradationEvent.builder()
                .id(eventIds.incrementAndGet())
                .triggerReason(reason)
                .enteredAt(clock.instant())
                .message(message)
                .acknowledgementRequired(reason.isAcknowledgementRequired())
                .build();
        openEvent = event;
        safeModeActive = true;
        healthySamples = 0;
        log.error("SAFE MODE ENTERED ({}): {}", reason, message);
        eventPublisherHelper.publishSafeModeEntered(this, event);
    }

    // ==============================
    // RECOVERY
    // ==============================

    @EventListener
    public void onHealthSample(HealthSampleEvent event) {
        lock.lock();
        try {
            if (!safeModeActive || !sessionReady) {
                return;
            }
            if (event.getSample().isOk()) {
                healthySamples++;
                tryRecover();
            } else {
                healthySamples = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records an operator acknowledgement of the open degradation event and closes it if the
     * health conditions are already met.
     *
     * @throws BusinessException if safe mode is not active
     */
    public DegradationEvent acknowledge(String operator) {
        lock.lock();
        try {
            DegradationEvent current = openEvent;
            if (!safeModeActive || current == null) {
                throw new BusinessException(ErrorCode.CONFLICT, "Safe mode is not active, nothing to acknowledge");
            }
            DegradationEvent acknowledged = current.toBuilder()
                    .acknowledgedAt(clock.instant())
                    .acknowledgedBy(operator)
                    .build();
            openEvent = acknowledged;
            log.info("Degradation event {} ({}) acknowledged by {}", acknowledged.getId(),
                    acknowledged.getTriggerReason(), operator);
            eventPublisherHelper.publishSafeModeAcknowledged(this, acknowledged);
            tryRecover();
            return openEvent != null ? openEvent : history.peekFirst();
        } finally {
            lock.unlock();
        }
    }

    /** Caller holds lock. */
    private void tryRecover() {
        DegradationEvent current = openEvent;
        if (!safeModeActive || current == null || !sessionReady) {
            return;
        }
        if (healthySamples < Math.max(1, settings.getRecoveryHealthySamples())) {
            return;
        }
        if (current.isAwaitingAcknowledgement()) {
            log.info("Session healthy but {} requires operator acknowledgement before leaving safe mode",
                    current.getTriggerReason());
            return;
        }

        DegradationEvent closed = current.toBuilder().recoveredAt(clock.instant()).build();
        history.addFirst(closed);
        while (history.size() > settings.getDegradationHistorySize()) {
            history.pollLast();
        }
        openEvent = null;
        safeModeActive = false;
        healthySamples = 0;
        log.info("Safe mode cleared after {} healthy samples (was {} since {})",
                settings.getRecoveryHealthySamples(), closed.getTriggerReason(), closed.getEnteredAt());
        eventPublisherHelper.publishSafeModeRecovered(this, closed);
    }

    @Scheduled(
            fixedDelayString = "${gateway.degradation.recovery-check-ms:15000}",
            initialDelayString = "${gateway.degradation.recovery-check-ms:15000}")
    public void scheduledRecoveryCheck() {
        recoveryTick();
    }

    /**
     * Testable version: reconnects when safe mode is active, the session is DISCONNECTED and
     * no acknowledgement is pending.
     *
     * @return true if a connect cycle was requested
     */
    public boolean recoveryTick() {
        DegradationEvent current;
        lock.lock();
        try {
            current = openEvent;
            if (!safeModeActive || current == null || current.isAwaitingAcknowledgement()) {
                return false;
            }
        } finally {
            lock.unlock();
        }

        if (sessionManager.currentState() != SessionState.DISCONNECTED) {
            return false;
        }
        log.info("Safe mode active ({}), requesting gateway reconnect", current.getTriggerReason());
        sessionManager.connectAsync();
        return true;
    }
}
