package com.tradinggateway.unit.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.tradinggateway.degradation.DegradationEvent;
import com.tradinggateway.degradation.TriggerReason;
import com.tradinggateway.event.EventPublisherHelper;
import com.tradinggateway.event.HealthSampleEvent;
import com.tradinggateway.event.HealthSignalEvent;
import com.tradinggateway.event.SafeModeEvent;
import com.tradinggateway.event.SafeModeEventType;
import com.tradinggateway.event.SessionEvent;
import com.tradinggateway.event.SessionEventType;
import com.tradinggateway.health.HealthSample;
import com.tradinggateway.health.HealthSignal;
import com.tradinggateway.health.HealthSignalType;
import com.tradinggateway.health.SampleSource;
import com.tradinggateway.health.SampleStatus;
import com.tradinggateway.session.SessionState;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for {@link EventPublisherHelper}.
 *
 * <p>Verifies that each typed publish method creates the correct event type
 * with the expected fields and delegates to Spring's ApplicationEventPublisher.
 */
@ExtendWith(MockitoExtension.class)
class EventPublisherHelperTest {

    private static final Instant NOW = Instant.parse("2026-01-14T15:00:00Z");

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private EventPublisherHelper eventPublisherHelper;

    @BeforeEach
    void setUp() {
        eventPublisherHelper = new EventPublisherHelper(applicationEventPublisher);
    }

    private DegradationEvent degradation() {
        return DegradationEvent.builder()
                .id(7L)
                .triggerReason(TriggerReason.DATA_STALE)
                .enteredAt(NOW)
                .build();
    }

    @Test
    @DisplayName("publishSessionTransition creates SessionEvent with states, client id and attempt")
    void publishSessionTransition() {
        eventPublisherHelper.publishSessionTransition(this, SessionEventType.SESSION_RECONNECTING,
                SessionState.CONNECTING, SessionState.RECONNECTING, 402800123, 2, "Attempt 1 failed", NOW);

        ArgumentCaptor<SessionEvent> captor = ArgumentCaptor.forClass(SessionEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());

        SessionEvent event = captor.getValue();
        assertThat(event.getSource()).isSameAs(this);
        assertThat(event.getEventType()).isEqualTo(SessionEventType.SESSION_RECONNECTING);
        assertThat(event.getPreviousState()).isEqualTo(SessionState.CONNECTING);
        assertThat(event.getNewState()).isEqualTo(SessionState.RECONNECTING);
        assertThat(event.getClientId()).isEqualTo(402800123);
        assertThat(event.getAttemptNumber()).isEqualTo(2);
        assertThat(event.getMessage()).isEqualTo("Attempt 1 failed");
        assertThat(event.getOccurredAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("publishHealthSample wraps the sample")
    void publishHealthSample() {
        HealthSample sample = HealthSample.builder()
                .timestamp(NOW)
                .roundTripLatency(Duration.ofMillis(12))
                .status(SampleStatus.OK)
                .source(SampleSource.PROBE)
                .build();

        eventPublisherHelper.publishHealthSample(this, sample);

        ArgumentCaptor<HealthSampleEvent> captor = ArgumentCaptor.forClass(HealthSampleEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getSample()).isSameAs(sample);
    }

    @Test
    @DisplayName("publishHealthSignal wraps the signal")
    void publishHealthSignal() {
        HealthSignal signal = HealthSignal.builder()
                .type(HealthSignalType.DEGRADING)
                .raisedAt(NOW)
                .consecutiveFailures(3)
                .build();

        eventPublisherHelper.publishHealthSignal(this, signal);

        ArgumentCaptor<HealthSignalEvent> captor = ArgumentCaptor.forClass(HealthSignalEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getSignal()).isSameAs(signal);
    }

    @Test
    @DisplayName("publishSafeModeEntered marks safe mode active")
    void publishSafeModeEntered() {
        DegradationEvent degradation = degradation();

        eventPublisherHelper.publishSafeModeEntered(this, degradation);

        ArgumentCaptor<SafeModeEvent> captor = ArgumentCaptor.forClass(SafeModeEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo(SafeModeEventType.ENTERED);
        assertThat(captor.getValue().getDegradation()).isSameAs(degradation);
        assertThat(captor.getValue().isSafeModeActive()).isTrue();
    }

    @Test
    @DisplayName("publishSafeModeAcknowledged keeps safe mode active")
    void publishSafeModeAcknowledged() {
        eventPublisherHelper.publishSafeModeAcknowledged(this, degradation());

        ArgumentCaptor<SafeModeEvent> captor = ArgumentCaptor.forClass(SafeModeEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo(SafeModeEventType.ACKNOWLEDGED);
        assertThat(captor.getValue().isSafeModeActive()).isTrue();
    }

    @Test
    @DisplayName("publishSafeModeRecovered clears safe mode")
    void publishSafeModeRecovered() {
        DegradationEvent recovered = degradation().toBuilder().recoveredAt(NOW.plusSeconds(60)).build();

        eventPublisherHelper.publishSafeModeRecovered(this, recovered);

        ArgumentCaptor<SafeModeEvent> captor = ArgumentCaptor.forClass(SafeModeEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo(SafeModeEventType.RECOVERED);
        assertThat(captor.getValue().isSafeModeActive()).isFalse();
        assertThat(captor.getValue().getDegradation().isOpen()).isFalse();
    }
}
