package com.tradinggateway.gate;

import lombok.ToString;

/**
 * Outcome of {@link RequestGate#submit}: either data or a typed {@link RequestError}.
 * Request-scoped failures are always returned this way, never thrown.
 *
 * <p>Use the static factories {@link #success} and {@link #failure}.
 */
@ToString
public class RequestResult<T> {

    private final T data;
    private final RequestError error;

    private RequestResult(T data, RequestError error) {
        this.data = data;
        this.error = error;
    }

    public static <T> RequestResult<T> success(T data) {
        return new RequestResult<>(data, null);
    }

    public static <T> RequestResult<T> failure(RequestErrorType type, String message) {
        return new RequestResult<>(null, new RequestError(type, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getData() {
        return data;
    }

    public RequestError getError() {
        return error;
    }

    /** Error type, or null on success. */
    public RequestErrorType getErrorType() {
        return error != null ? error.getType() : null;
    }

    /** Re-types a failure for a different payload type. */
    @SuppressWarnings("unchecked")
    <R> RequestResult<R> castFailure() {
        if (isSuccess()) {
            throw new IllegalStateException("Not a failure: " + this);
        }
        return (RequestResult<R>) this;
    }
}
