package com.tradinggateway.exception;

import lombok.Getter;

/**
 * Error codes carried by {@link BaseException} and rendered in {@code ApiErrorResponse}.
 *
 * <p>{@code retryable} marks conditions caused by the gateway being unreachable or slow,
 * where the same call can succeed later without any change on the caller's side.
 */
@Getter
public enum ErrorCode {
    VALIDATION_ERROR(400, false),
    BAD_REQUEST(400, false),
    NOT_FOUND(404, false),
    CONFLICT(409, false),
    SAFE_MODE_ACTIVE(423, false),
    INTERNAL_ERROR(500, false),
    GATEWAY_ERROR(502, true),
    GATEWAY_UNAVAILABLE(503, true),
    // needs a human to fix credentials or approve the login
    GATEWAY_AUTH_FAILED(503, false),
    GATEWAY_TIMEOUT(504, true);

    private final int httpStatus;
    private final boolean retryable;

    ErrorCode(int httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public String getCode() {
        return name();
    }
}
