package com.tradinggateway.health;

import com.tradinggateway.config.GatewaySettings;
import com.tradinggateway.event.EventPublisherHelper;
import com.tradinggateway.event.SessionEvent;
import com.tradinggateway.exception.RequestTimeoutException;
import com.tradinggateway.session.SessionState;
import com.tradinggateway.transport.GatewayTransport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Independent probe loop that classifies the gateway session as healthy, degrading or stale.
 *
 * <p>Each cycle issues one lightweight round-trip against the READY session and records a
 * {@link HealthSample}. Request outcomes reported by the request gate are recorded the same
 * way. When the number of consecutive non-ok samples reaches the configured threshold the
 * monitor raises a DEGRADING signal.
 *
 * <p>Independently, the monitor tracks the age of the most recent market update. The
 * gateway can stay connected while silently stopping delivery, so data older than the
 * staleness threshold raises a STALE signal even when probes succeed. The staleness
 * baseline is the last market update seen by the process (or the first READY time when
 * none has arrived yet) and is not reset by reconnects. With {@code stalenessRthOnly}
 * staleness is only evaluated during regular trading hours, and never measured from
 * before the current day's opening bell.
 *
 * <p>Signals are published as {@link com.tradinggateway.event.HealthSignalEvent}s every cycle
 * and delivered to the {@link HealthSignalListener} (the session manager). For STALE the
 * listener is notified once per stale episode so the session is not reconnected every cycle;
 * the degradation coordinator uses the published events to measure how long staleness persists.
 *
 * <p>The monitor never mutates session state and never holds its lock while publishing.
 */
@Service
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final GatewaySettings settings;
    private final GatewayTransport transport;
    private final HealthSignalListener signalListener;
    private final EventPublisherHelper eventPublisherHelper;
    private final AsyncTaskExecutor ioExecutor;
    private final Clock clock;
    private final RegularTradingHours tradingHours;

    private final ReentrantLock sampleLock = new ReentrantLock();
    private final Deque<HealthSample> samples;
    private int consecutiveFailures;

    private volatile boolean sessionReady;
    private volatile Instant firstReadyAt;
    private volatile Instant lastMarketUpdate;
    private volatile Instant notifiedStaleSince;

    public HealthMonitor(
            GatewaySettings settings,
            GatewayTransport transport,
            HealthSignalListener signalListener,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("gatewayIoExecutor") AsyncTaskExecutor ioExecutor,
            Clock clock) {
        this.settings = settings;
        this.transport = transport;
        this.signalListener = signalListener;
        this.eventPublisherHelper = eventPublisherHelper;
        this.ioExecutor = ioExecutor;
        this.clock = clock;
        this.tradingHours = RegularTradingHours.from(settings);
        this.samples = new ArrayDeque<>(settings.getSampleWindowSize());
    }

    // ==============================
    // PROBE LOOP
    // ==============================

    @Scheduled(
            fixedRateString = "${gateway.health.probe-interval-ms:5000}",
            initialDelayString = "${gateway.health.probe-interval-ms:5000}")
    public void scheduledProbe() {
        runProbeCycle();
    }

    /**
     * Testable version: one probe plus one staleness evaluation. Does nothing unless the
     * session is READY.
     */
    public void runProbeCycle() {
        if (!sessionReady) {
            return;
        }
        HealthSample sample = probeOnce();
        if (sample != null) {
            record(sample);
        }
        evaluateStaleness();
    }

    private HealthSample probeOnce() {
        Duration timeout = settings.getProbeTimeout();
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        Future<Instant> probe = ioExecutor.submit(() -> transport.probe(timeout));
        try {
            probe.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return sample(startedAt, Duration.ofNanos(System.nanoTime() - startNanos), SampleStatus.OK,
                    SampleSource.PROBE, null);
        } catch (TimeoutException e) {
            probe.cancel(true);
            return sample(startedAt, null, SampleStatus.TIMEOUT, SampleSource.PROBE,
                    "No probe response within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            SampleStatus status =
                    cause instanceof RequestTimeoutException ? SampleStatus.TIMEOUT : SampleStatus.ERROR;
            return sample(startedAt, null, status, SampleSource.PROBE, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            probe.cancel(true);
            log.warn("Health probe interrupted");
            return null;
        }
    }

    // ==============================
    // INPUTS FROM THE REQUEST GATE
    // ==============================

    /** Records the outcome of a real data request as a health sample. */
    public void recordRequestOutcome(SampleStatus status, Duration latency, String detail) {
        record(sample(clock.instant(), latency, status, SampleSource.REQUEST, detail));
    }

    /** A valid market data update arrived; resets the staleness clock. */
    public void recordMarketUpdate(Instant receivedAt) {
        Instant previous = lastMarketUpdate;
        if (previous == null || receivedAt.isAfter(previous)) {
            lastMarketUpdate = receivedAt;
        }
    }

    // ==============================
    // VERDICTS
    // ==============================

    private void record(HealthSample sample) {
        HealthSignal degrading = null;
        sampleLock.lock();
        try {
            if (samples.size() >= settings.getSampleWindowSize()) {
                samples.pollFirst();
            }
            samples.addLast(sample);

            if (sample.isOk()) {
                consecutiveFailures = 0;
            } else {
                consecutiveFailures++;
                log.warn("Health sample {} from {} ({}/{}): {}", sample.getStatus(), sample.getSource(),
                        consecutiveFailures, settings.getUnhealthyThreshold(), sample.getDetail());
                if (consecutiveFailures >= settings.getUnhealthyThreshold() && sessionReady) {
                    degrading = HealthSignal.builder()
                            .type(HealthSignalType.DEGRADING)
                            .raisedAt(sample.getTimestamp())
                            .consecutiveFailures(consecutiveFailures)
                            .message(consecutiveFailures + " consecutive failed health samples, last: "
                                    + sample.getDetail())
                            .build();
                    consecutiveFailures = 0;
                }
            }
        } finally {
            sampleLock.unlock();
        }

        log.debug("Health sample: {}", sample);
        eventPublisherHelper.publishHealthSample(this, sample);
        if (degrading != null) {
            raise(degrading, true);
        }
    }

    private void evaluateStaleness() {
        if (!sessionReady) {
            return;
        }
        Instant now = clock.instant();
        if (settings.isStalenessRthOnly() && !tradingHours.isOpen(now)) {
            return;
        }

        Instant baseline = lastMarketUpdate != null ? lastMarketUpdate : firstReadyAt;
        if (baseline == null) {
            return;
        }
        if (settings.isStalenessRthOnly()) {
            Instant opening = tradingHours.sessionOpen(now);
            if (baseline.isBefore(opening)) {
                baseline = opening;
            }
        }

        Duration threshold = settings.getStalenessThreshold();
        Duration age = Duration.between(baseline, now);
        if (age.compareTo(threshold) <= 0) {
            return;
        }

        Instant staleSince = baseline.plus(threshold);
        HealthSignal stale = HealthSignal.builder()
                .type(HealthSignalType.STALE)
                .raisedAt(now)
                .lastMarketUpdate(baseline)
                .staleSince(staleSince)
                .message("No market data for " + age.toSeconds() + "s (threshold " + threshold.toSeconds() + "s)")
                .build();

        boolean firstInEpisode = !staleSince.equals(notifiedStaleSince);
        if (firstInEpisode) {
            notifiedStaleSince = staleSince;
            log.warn("Market data stale: {}", stale.getMessage());
        }
        raise(stale, firstInEpisode);
    }

    private void raise(HealthSignal signal, boolean notifyListener) {
        eventPublisherHelper.publishHealthSignal(this, signal);
        if (notifyListener) {
            signalListener.onHealthSignal(signal);
        }
    }

    // ==============================
    // SESSION TRACKING
    // ==============================

    @EventListener
    public void onSessionEvent(SessionEvent event) {
        boolean ready = event.getNewState() == SessionState.READY;
        if (ready && firstReadyAt == null) {
            firstReadyAt = event.getOccurredAt();
        }
        if (ready != sessionReady) {
            sampleLock.lock();
            try {
                consecutiveFailures = 0;
            } finally {
                sampleLock.unlock();
            }
        }
        sessionReady = ready;
    }

    // ==============================
    // READS
    // ==============================

    public List<HealthSample> getRecentSamples() {
        sampleLock.lock();
        try {
            return List.copyOf(samples);
        } finally {
            sampleLock.unlock();
        }
    }

    public int getConsecutiveFailures() {
        sampleLock.lock();
        try {
            return consecutiveFailures;
        } finally {
            sampleLock.unlock();
        }
    }

    public Instant getLastMarketUpdate() {
        return lastMarketUpdate;
    }

    public boolean isSessionReady() {
        return sessionReady;
    }

    private HealthSample sample(
            Instant timestamp, Duration latency, SampleStatus status, SampleSource source, String detail) {
        return HealthSample.builder()
                .timestamp(timestamp)
                .roundTripLatency(latency)
                .status(status)
                .source(source)
                .detail(detail)
                .build();
    }
}
