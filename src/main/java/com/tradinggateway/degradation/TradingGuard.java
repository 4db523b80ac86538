package com.tradinggateway.degradation;

import com.tradinggateway.exception.SafeModeActiveException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Veto consulted before any order-affecting action.
 *
 * <p>Order submission, modification and strategy arming call {@link #requireSafeToTrade()}
 * first. While capital-preservation mode is active the call throws, which is an absolute
 * veto. Data requests do not go through this guard.
 */
@Component
public class TradingGuard {

    private final DegradationCoordinator degradationCoordinator;

    public TradingGuard(DegradationCoordinator degradationCoordinator) {
        this.degradationCoordinator = degradationCoordinator;
    }

    /**
     * @throws SafeModeActiveException if safe mode is active
     */
    public void requireSafeToTrade() {
        if (!degradationCoordinator.isSafeModeActive()) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        String reason = "UNKNOWN";
        DegradationEvent open = degradationCoordinator.getOpenEvent().orElse(null);
        if (open != null) {
            reason = open.getTriggerReason().name();
            details.put("triggerReason", reason);
            details.put("enteredAt", open.getEnteredAt().toString());
            details.put("acknowledgementRequired", open.isAwaitingAcknowledgement());
        }
        throw new SafeModeActiveException("Capital-preservation mode is active (" + reason + "), trading vetoed",
                details);
    }

    public boolean isSafeToTrade() {
        return !degradationCoordinator.isSafeModeActive();
    }
}
