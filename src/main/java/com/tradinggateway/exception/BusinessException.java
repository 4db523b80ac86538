package com.tradinggateway.exception;

import java.util.Map;

/**
 * An operator request that conflicts with the current gateway or safe-mode state.
 */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
