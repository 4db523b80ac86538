package com.tradinggateway.session;

import java.time.Instant;
import lombok.Getter;
import lombok.ToString;

/**
 * One try at bringing a session to READY. Created by the session manager, read by the
 * backoff controller, and discarded once READY is reached or the budget is exhausted.
 */
@Getter
@ToString
public class ConnectionAttempt {

    private final int attemptNumber;
    private final ClientId clientId;
    private final Instant startedAt;
    private AttemptOutcome outcome = AttemptOutcome.PENDING;
    private FailureClass failureClass;
    private String failureMessage;

    public ConnectionAttempt(int attemptNumber, ClientId clientId, Instant startedAt) {
        this.attemptNumber = attemptNumber;
        this.clientId = clientId;
        this.startedAt = startedAt;
    }

    void succeeded() {
        this.outcome = AttemptOutcome.SUCCESS;
    }

    void failed(FailureClass failureClass, String message) {
        this.outcome = AttemptOutcome.FAILURE;
        this.failureClass = failureClass;
        this.failureMessage = message;
    }
}
