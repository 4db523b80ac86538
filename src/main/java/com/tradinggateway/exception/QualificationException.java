package com.tradinggateway.exception;

import lombok.Getter;

/**
 * The gateway does not recognise the contract. Cached as a negative qualification
 * for the lifetime of the session; never escalated to safe mode.
 */
@Getter
public class QualificationException extends GatewayException {

    private final String contractKey;

    public QualificationException(String contractKey, String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.contractKey = contractKey;
    }
}
