package com.tradinggateway.session;

import java.time.Duration;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of {@link RetryBackoffController#decide}: either wait and try again, or stop.
 *
 * <p>Use the static factories {@link #retryAfter} and {@link #giveUp}.
 */
@Getter
@ToString
public class BackoffDecision {

    private final boolean retry;
    private final Duration delay;
    private final GiveUpReason giveUpReason;

    private BackoffDecision(boolean retry, Duration delay, GiveUpReason giveUpReason) {
        this.retry = retry;
        this.delay = delay;
        this.giveUpReason = giveUpReason;
    }

    public static BackoffDecision retryAfter(Duration delay) {
        return new BackoffDecision(true, delay, null);
    }

    public static BackoffDecision giveUp(GiveUpReason reason) {
        return new BackoffDecision(false, null, reason);
    }

    public boolean isGiveUp() {
        return !retry;
    }
}
