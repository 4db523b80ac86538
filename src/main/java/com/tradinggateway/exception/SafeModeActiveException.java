package com.tradinggateway.exception;

import java.util.Map;

/**
 * Thrown by {@link com.tradinggateway.degradation.TradingGuard} when an order-affecting
 * action is attempted while capital-preservation mode is active.
 */
public class SafeModeActiveException extends BaseException {

    public SafeModeActiveException(String message, Map<String, Object> details) {
        super(ErrorCode.SAFE_MODE_ACTIVE, message, details);
    }
}
