package com.tradinggateway.unit.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradinggateway.config.GatewaySettings;
import com.tradinggateway.event.EventPublisherHelper;
import com.tradinggateway.event.HealthSampleEvent;
import com.tradinggateway.event.HealthSignalEvent;
import com.tradinggateway.event.SessionEvent;
import com.tradinggateway.event.SessionEventType;
import com.tradinggateway.exception.RequestTimeoutException;
import com.tradinggateway.exception.SessionClosedException;
import com.tradinggateway.health.HealthMonitor;
import com.tradinggateway.health.HealthSample;
import com.tradinggateway.health.HealthSignal;
import com.tradinggateway.health.HealthSignalListener;
import com.tradinggateway.health.HealthSignalType;
import com.tradinggateway.health.SampleSource;
import com.tradinggateway.health.SampleStatus;
import com.tradinggateway.session.SessionState;
import com.tradinggateway.support.MutableClock;
import com.tradinggateway.support.RecordingEventPublisher;
import com.tradinggateway.transport.GatewayTransport;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Unit tests for HealthMonitor covering probe sampling, the DEGRADING threshold,
 * market-data staleness and the regular-trading-hours window.
 *
 * <p>Probes run synchronously on the calling thread unless a test needs a real timeout.
 * 2026-01-14 is a Wednesday; 15:00Z is 10:00 in New York.
 */
class HealthMonitorTest {

    private static final Instant RTH_MORNING = Instant.parse("2026-01-14T15:00:00Z");

    private GatewayTransport transport;
    private HealthSignalListener listener;
    private RecordingEventPublisher publisher;
    private MutableClock clock;
    private HealthMonitor healthMonitor;
    private ThreadPoolTaskExecutor realExecutor;

    @BeforeEach
    void setUp() {
        transport = mock(GatewayTransport.class);
        listener = mock(HealthSignalListener.class);
        publisher = new RecordingEventPublisher();
        clock = new MutableClock(RTH_MORNING);
        healthMonitor = newMonitor(GatewaySettings.defaults(), new TaskExecutorAdapter(Runnable::run));
        when(transport.probe(any(Duration.class))).thenAnswer(invocation -> clock.instant());
    }

    @AfterEach
    void tearDown() {
        if (realExecutor != null) {
            realExecutor.shutdown();
        }
    }

    private HealthMonitor newMonitor(GatewaySettings settings, AsyncTaskExecutor executor) {
        return new HealthMonitor(settings, transport, listener, new EventPublisherHelper(publisher), executor, clock);
    }

    private void sessionReady(HealthMonitor monitor) {
        monitor.onSessionEvent(new SessionEvent(this, SessionEventType.SESSION_READY, SessionState.AUTHENTICATING,
                SessionState.READY, 101, 1, "ready", clock.instant()));
    }

    private List<HealthSignal> publishedSignals() {
        return publisher.eventsOfType(HealthSignalEvent.class).stream()
                .map(HealthSignalEvent::getSignal)
                .collect(Collectors.toList());
    }

    // ==============================
    // PROBES
    // ==============================

    @Nested
    @DisplayName("Probe Sampling")
    class ProbeSampling {

        @Test
        @DisplayName("No probe is issued while the session is not READY")
        void noProbeWhenNotReady() {
            healthMonitor.runProbeCycle();

            verify(transport, never()).probe(any(Duration.class));
            assertThat(healthMonitor.getRecentSamples()).isEmpty();
        }

        @Test
        @DisplayName("Successful probe records an OK sample and publishes it")
        void okProbeRecorded() {
            sessionReady(healthMonitor);

            healthMonitor.runProbeCycle();

            assertThat(healthMonitor.getRecentSamples()).singleElement().satisfies(sample -> {
                assertThat(sample.getStatus()).isEqualTo(SampleStatus.OK);
                assertThat(sample.getSource()).isEqualTo(SampleSource.PROBE);
                assertThat(sample.getRoundTripLatency()).isNotNull();
            });
            assertThat(publisher.eventsOfType(HealthSampleEvent.class)).hasSize(1);
        }

        @Test
        @DisplayName("Probe timing out inside the gateway records TIMEOUT; other failures record ERROR")
        void failureClassification() {
            sessionReady(healthMonitor);
            when(transport.probe(any(Duration.class)))
                    .thenThrow(new RequestTimeoutException("probe timed out"))
                    .thenThrow(new SessionClosedException("socket closed"));

            healthMonitor.runProbeCycle();
            healthMonitor.runProbeCycle();

            assertThat(healthMonitor.getRecentSamples())
                    .extracting(HealthSample::getStatus)
                    .containsExactly(SampleStatus.TIMEOUT, SampleStatus.ERROR);
            assertThat(healthMonitor.getConsecutiveFailures()).isEqualTo(2);
        }

        @Test
        @DisplayName("Probe that does not answer within the probe timeout is cancelled and recorded as TIMEOUT")
        void hungProbeTimesOut() {
            realExecutor = new ThreadPoolTaskExecutor();
            realExecutor.setCorePoolSize(1);
            realExecutor.initialize();
            HealthMonitor monitor = newMonitor(
                    GatewaySettings.builder().probeTimeout(Duration.ofMillis(50)).build(), realExecutor);
            sessionReady(monitor);
            when(transport.probe(any(Duration.class))).thenAnswer(invocation -> {
                Thread.sleep(2_000);
                return clock.instant();
            });

            monitor.runProbeCycle();

            assertThat(monitor.getRecentSamples()).singleElement()
                    .satisfies(sample -> assertThat(sample.getStatus()).isEqualTo(SampleStatus.TIMEOUT));
        }

        @Test
        @DisplayName("Sample buffer keeps only the configured window")
        void ringBufferBounded() {
            HealthMonitor monitor = newMonitor(
                    GatewaySettings.builder().sampleWindowSize(5).build(), new TaskExecutorAdapter(Runnable::run));
            sessionReady(monitor);

            for (int i = 0; i < 12; i++) {
                monitor.runProbeCycle();
            }

            assertThat(monitor.getRecentSamples()).hasSize(5);
        }
    }

    // ==============================
    // DEGRADING
    // ==============================

    @Nested
    @DisplayName("Degrading Threshold")
    class DegradingThreshold {

        @Test
        @DisplayName("Three consecutive failed probes raise DEGRADING to the session manager")
        void threeFailuresRaiseDegrading() {
            sessionReady(healthMonitor);
            when(transport.probe(any(Duration.class))).thenThrow(new RequestTimeoutException("probe timed out"));

            healthMonitor.runProbeCycle();
            healthMonitor.runProbeCycle();
            verify(listener, never()).onHealthSignal(any());

            healthMonitor.runProbeCycle();

            ArgumentCaptor<HealthSignal> captor = ArgumentCaptor.forClass(HealthSignal.class);
            verify(listener).onHealthSignal(captor.capture());
            assertThat(captor.getValue().getType()).isEqualTo(HealthSignalType.DEGRADING);
            assertThat(captor.getValue().getConsecutiveFailures()).isEqualTo(3);
            assertThat(publishedSignals()).extracting(HealthSignal::getType).containsExactly(HealthSignalType.DEGRADING);
            assertThat(healthMonitor.getConsecutiveFailures()).isZero();
        }

        @Test
        @DisplayName("An OK sample resets the consecutive failure count")
        void okResetsCount() {
            sessionReady(healthMonitor);
            when(transport.probe(any(Duration.class)))
                    .thenThrow(new RequestTimeoutException("t1"))
                    .thenThrow(new RequestTimeoutException("t2"))
                    .thenAnswer(invocation -> clock.instant())
                    .thenThrow(new RequestTimeoutException("t3"));

            for (int i = 0; i < 4; i++) {
                healthMonitor.runProbeCycle();
            }

            assertThat(healthMonitor.getConsecutiveFailures()).isEqualTo(1);
            verify(listener, never()).onHealthSignal(any());
        }

        @Test
        @DisplayName("Request timeouts reported by the gate count towards the threshold")
        void requestOutcomesCount() {
            sessionReady(healthMonitor);

            healthMonitor.recordRequestOutcome(SampleStatus.TIMEOUT, null, "SPY");
            healthMonitor.recordRequestOutcome(SampleStatus.ERROR, Duration.ofMillis(40), "QQQ");
            healthMonitor.recordRequestOutcome(SampleStatus.TIMEOUT, null, "SPY");

            ArgumentCaptor<HealthSignal> captor = ArgumentCaptor.forClass(HealthSignal.class);
            verify(listener).onHealthSignal(captor.capture());
            assertThat(captor.getValue().getType()).isEqualTo(HealthSignalType.DEGRADING);
            assertThat(healthMonitor.getRecentSamples())
                    .extracting(HealthSample::getSource)
                    .containsOnly(SampleSource.REQUEST);
        }

        @Test
        @DisplayName("No DEGRADING signal is raised while the session is not READY")
        void noSignalWhenNotReady() {
            healthMonitor.recordRequestOutcome(SampleStatus.TIMEOUT, null, "SPY");
            healthMonitor.recordRequestOutcome(SampleStatus.TIMEOUT, null, "SPY");
            healthMonitor.recordRequestOutcome(SampleStatus.TIMEOUT, null, "SPY");

            verify(listener, never()).onHealthSignal(any());
        }

        @Test
        @DisplayName("Leaving READY resets the consecutive failure count")
        void sessionChangeResetsCount() {
            sessionReady(healthMonitor);
            healthMonitor.recordRequestOutcome(SampleStatus.TIMEOUT, null, "SPY");
            healthMonitor.recordRequestOutcome(SampleStatus.TIMEOUT, null, "SPY");

            healthMonitor.onSessionEvent(new SessionEvent(this, SessionEventType.SESSION_RECONNECTING,
                    SessionState.READY, SessionState.RECONNECTING, 101, 0, "lost", clock.instant()));

            assertThat(healthMonitor.getConsecutiveFailures()).isZero();
            assertThat(healthMonitor.isSessionReady()).isFalse();
        }
    }

    // ==============================
    // STALENESS
    // ==============================

    @Nested
    @DisplayName("Market Data Staleness")
    class Staleness {

        @Test
        @DisplayName("Six minutes without market data during RTH raises STALE even though probes succeed")
        void staleDuringRth() {
            sessionReady(healthMonitor);
            healthMonitor.recordMarketUpdate(clock.instant());

            clock.advance(Duration.ofMinutes(6));
            healthMonitor.runProbeCycle();

            ArgumentCaptor<HealthSignal> captor = ArgumentCaptor.forClass(HealthSignal.class);
            verify(listener).onHealthSignal(captor.capture());
            HealthSignal signal = captor.getValue();
            assertThat(signal.getType()).isEqualTo(HealthSignalType.STALE);
            assertThat(signal.getLastMarketUpdate()).isEqualTo(RTH_MORNING);
            assertThat(signal.getStaleSince()).isEqualTo(RTH_MORNING.plus(Duration.ofMinutes(5)));
            assertThat(healthMonitor.getRecentSamples()).extracting(HealthSample::getStatus)
                    .containsExactly(SampleStatus.OK);
        }

        @Test
        @DisplayName("Fresh data within the threshold raises nothing")
        void freshDataNotStale() {
            sessionReady(healthMonitor);
            clock.advance(Duration.ofMinutes(4));
            healthMonitor.recordMarketUpdate(clock.instant());
            clock.advance(Duration.ofMinutes(4));

            healthMonitor.runProbeCycle();

            verify(listener, never()).onHealthSignal(any());
            assertThat(publishedSignals()).isEmpty();
        }

        @Test
        @DisplayName("Without any market data the first READY time is the baseline")
        void firstReadyIsBaseline() {
            sessionReady(healthMonitor);
            clock.advance(Duration.ofMinutes(5).plusSeconds(1));

            healthMonitor.runProbeCycle();

            ArgumentCaptor<HealthSignal> captor = ArgumentCaptor.forClass(HealthSignal.class);
            verify(listener).onHealthSignal(captor.capture());
            assertThat(captor.getValue().getType()).isEqualTo(HealthSignalType.STALE);
        }

        @Test
        @DisplayName("STALE is published every cycle but the session manager is told once per episode")
        void listenerNotifiedOncePerEpisode() {
            sessionReady(healthMonitor);
            healthMonitor.recordMarketUpdate(clock.instant());

            clock.advance(Duration.ofMinutes(6));
            healthMonitor.runProbeCycle();
            clock.advance(Duration.ofSeconds(5));
            healthMonitor.runProbeCycle();
            clock.advance(Duration.ofSeconds(5));
            healthMonitor.runProbeCycle();

            verify(listener, times(1)).onHealthSignal(any());
            assertThat(publishedSignals()).hasSize(3).allMatch(s -> s.getType() == HealthSignalType.STALE);
        }

        @Test
        @DisplayName("A new stale episode after data resumed notifies the session manager again")
        void newEpisodeNotifiesAgain() {
            sessionReady(healthMonitor);
            healthMonitor.recordMarketUpdate(clock.instant());
            clock.advance(Duration.ofMinutes(6));
            healthMonitor.runProbeCycle();

            healthMonitor.recordMarketUpdate(clock.instant());
            clock.advance(Duration.ofMinutes(6));
            healthMonitor.runProbeCycle();

            verify(listener, times(2)).onHealthSignal(any());
        }

        @Test
        @DisplayName("Staleness is not evaluated outside regular trading hours")
        void notEvaluatedAfterClose() {
            clock.set(Instant.parse("2026-01-14T22:00:00Z"));
            sessionReady(healthMonitor);
            healthMonitor.recordMarketUpdate(Instant.parse("2026-01-14T20:59:00Z"));

            clock.advance(Duration.ofMinutes(30));
            healthMonitor.runProbeCycle();

            verify(listener, never()).onHealthSignal(any());
        }

        @Test
        @DisplayName("Staleness is not evaluated on weekends")
        void notEvaluatedOnWeekend() {
            clock.set(Instant.parse("2026-01-17T15:00:00Z"));
            sessionReady(healthMonitor);

            clock.advance(Duration.ofHours(1));
            healthMonitor.runProbeCycle();

            verify(listener, never()).onHealthSignal(any());
        }

        @Test
        @DisplayName("Data from the previous day is measured from today's opening bell")
        void baselineClampedToOpen() {
            clock.set(Instant.parse("2026-01-14T14:31:00Z"));
            sessionReady(healthMonitor);
            healthMonitor.recordMarketUpdate(Instant.parse("2026-01-13T20:59:00Z"));

            clock.set(Instant.parse("2026-01-14T14:33:00Z"));
            healthMonitor.runProbeCycle();
            verify(listener, never()).onHealthSignal(any());

            clock.set(Instant.parse("2026-01-14T14:36:00Z"));
            healthMonitor.runProbeCycle();

            ArgumentCaptor<HealthSignal> captor = ArgumentCaptor.forClass(HealthSignal.class);
            verify(listener).onHealthSignal(captor.capture());
            assertThat(captor.getValue().getStaleSince()).isEqualTo(Instant.parse("2026-01-14T14:35:00Z"));
        }

        @Test
        @DisplayName("With RTH-only disabled staleness is evaluated around the clock")
        void evaluatedAroundTheClock() {
            clock.set(Instant.parse("2026-01-17T03:00:00Z"));
            HealthMonitor monitor = newMonitor(
                    GatewaySettings.builder().stalenessRthOnly(false).build(), new TaskExecutorAdapter(Runnable::run));
            sessionReady(monitor);
            monitor.recordMarketUpdate(clock.instant());

            clock.advance(Duration.ofMinutes(10));
            monitor.runProbeCycle();

            verify(listener).onHealthSignal(any());
        }

        @Test
        @DisplayName("Older market updates never move the staleness clock backwards")
        void marketUpdateMonotonic() {
            healthMonitor.recordMarketUpdate(RTH_MORNING);
            healthMonitor.recordMarketUpdate(RTH_MORNING.minusSeconds(30));

            assertThat(healthMonitor.getLastMarketUpdate()).isEqualTo(RTH_MORNING);
        }
    }
}
