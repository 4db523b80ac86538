package com.tradinggateway.exception;

/**
 * Socket refused, reset, or handshake dropped. Retried with backoff by the session manager.
 */
public class TransientConnectionException extends GatewayException {

    public TransientConnectionException(String message) {
        super(ErrorCode.GATEWAY_UNAVAILABLE, message);
    }

    public TransientConnectionException(String message, Throwable cause) {
        super(ErrorCode.GATEWAY_UNAVAILABLE, message, cause);
    }
}
