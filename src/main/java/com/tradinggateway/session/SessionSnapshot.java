package com.tradinggateway.session;

import java.time.Instant;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable point-in-time view of the session, safe to hand to any thread.
 */
@Getter
@Builder
@ToString
public class SessionSnapshot {

    private final SessionState state;

    /** Null when no session exists. */
    private final Integer clientId;

    private final Instant sessionCreatedAt;
    private final Instant readyAt;
    private final Instant lastHeartbeatAt;

    @Builder.Default
    private final Set<String> qualifiedContracts = Set.of();

    @Builder.Default
    private final Set<String> rejectedContracts = Set.of();

    /** Attempt number within the running connect cycle, 0 when none is running. */
    private final int attemptNumber;

    private final int maxAttempts;
    private final FailureClass lastFailureClass;
    private final String lastFailureMessage;
    private final Instant updatedAt;

    public static SessionSnapshot disconnected(int maxAttempts, Instant at) {
        return SessionSnapshot.builder()
                .state(SessionState.DISCONNECTED)
                .maxAttempts(maxAttempts)
                .updatedAt(at)
                .build();
    }
}
