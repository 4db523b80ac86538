package com.tradinggateway.exception;

public class RequestTimeoutException extends GatewayException {

    public RequestTimeoutException(String message) {
        super(ErrorCode.GATEWAY_TIMEOUT, message);
    }
}
