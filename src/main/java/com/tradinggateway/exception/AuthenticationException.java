package com.tradinggateway.exception;

import lombok.Getter;

/**
 * The gateway refused the login.
 *
 * <p>When {@code pendingApproval} is true the login is waiting for out-of-band 2FA
 * approval and the attempt is retried after a long fixed wait. Otherwise the
 * credentials were rejected: no automatic retry, the session goes to DISCONNECTED
 * and the degradation coordinator enters AUTHENTICATION_FAILED.
 */
@Getter
public class AuthenticationException extends GatewayException {

    private final boolean pendingApproval;

    public AuthenticationException(String message, boolean pendingApproval) {
        super(ErrorCode.GATEWAY_AUTH_FAILED, message);
        this.pendingApproval = pendingApproval;
    }

    public static AuthenticationException rejected(String message) {
        return new AuthenticationException(message, false);
    }

    public static AuthenticationException pendingApproval(String message) {
        return new AuthenticationException(message, true);
    }
}
