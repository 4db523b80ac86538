package com.tradinggateway.exception;

/**
 * Raised when an operation needs a READY gateway session and none exists, or the
 * session was closed while the operation was pending.
 */
public class SessionClosedException extends GatewayException {

    public SessionClosedException(String message) {
        super(ErrorCode.GATEWAY_UNAVAILABLE, message);
    }
}
