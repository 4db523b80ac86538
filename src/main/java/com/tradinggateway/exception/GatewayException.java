package com.tradinggateway.exception;

/**
 * Base type for failures reported by a {@link com.tradinggateway.transport.GatewayTransport}.
 *
 * <p>Transport implementations wrap their client library's checked exceptions into
 * this hierarchy so the session manager can classify failures without knowing the
 * underlying API.
 */
public class GatewayException extends BaseException {

    public GatewayException(String message) {
        super(ErrorCode.GATEWAY_ERROR, message);
    }

    public GatewayException(String message, Throwable cause) {
        super(ErrorCode.GATEWAY_ERROR, message, cause);
    }

    protected GatewayException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    protected GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
