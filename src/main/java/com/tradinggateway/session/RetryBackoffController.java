package com.tradinggateway.session;

import com.tradinggateway.config.GatewaySettings;
import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Decides whether, and after what delay, the next connection attempt may be made.
 *
 * <p>Delays follow an exponential curve with random jitter (Resilience4j's
 * {@link IntervalFunction#ofExponentialRandomBackoff}), clamped to the configured maximum.
 * The first attempt of a cycle is always immediate. Once the attempt number exceeds the
 * configured budget the controller gives up and the session drops to DISCONNECTED.
 *
 * <p>Special cases:
 * <ul>
 *   <li>AUTHENTICATION_PENDING: fixed long wait, since the login needs a human to approve it</li>
 *   <li>AUTHENTICATION_REJECTED: never retried</li>
 * </ul>
 *
 * <p>Holds no mutable state. Attempt bookkeeping lives with the caller.
 */
@Component
public class RetryBackoffController {

    private final int maxAttempts;
    private final Duration maxBackoff;
    private final Duration authenticationPendingWait;
    private final IntervalFunction intervalFunction;

    public RetryBackoffController(GatewaySettings settings) {
        this.maxAttempts = settings.getMaxReconnectAttempts();
        this.maxBackoff = settings.getMaxBackoff();
        this.authenticationPendingWait = settings.getAuthenticationPendingWait();
        this.intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Math.max(1, settings.getInitialBackoff().toMillis()),
                settings.getBackoffMultiplier(),
                settings.getBackoffJitter(),
                Math.max(1, settings.getMaxBackoff().toMillis()));
    }

    /**
     * @param attemptNumber 1-based number of the attempt about to be made
     * @param failureClass why the previous attempt failed; ignored for attempt 1
     */
    public BackoffDecision decide(int attemptNumber, FailureClass failureClass) {
        if (attemptNumber > maxAttempts) {
            return BackoffDecision.giveUp(GiveUpReason.BUDGET_EXHAUSTED);
        }
        if (failureClass == FailureClass.AUTHENTICATION_REJECTED) {
            return BackoffDecision.giveUp(GiveUpReason.NOT_RETRYABLE);
        }
        if (attemptNumber <= 1) {
            return BackoffDecision.retryAfter(Duration.ZERO);
        }
        if (failureClass == FailureClass.AUTHENTICATION_PENDING) {
            return BackoffDecision.retryAfter(authenticationPendingWait);
        }

        long delayMillis = intervalFunction.apply(attemptNumber - 1);
        return BackoffDecision.retryAfter(Duration.ofMillis(Math.min(delayMillis, maxBackoff.toMillis())));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
