package com.tradinggateway.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradinggateway.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope: {@code {"success": false, "error": {...}}}.
 *
 * <p>{@code error.retryable} tells API clients whether the failure was the gateway being
 * unavailable (retry later) or a problem with the request or safe-mode state (do not).
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorBody error;

    private ApiErrorResponse(ErrorBody error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorBody.builder()
                .code(errorCode.getCode())
                .message(message)
                .retryable(errorCode.isRetryable())
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .timestamp(Instant.now())
                .build());
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {
        private final String code;
        private final String message;
        private final boolean retryable;
        private final Map<String, Object> details;
        private final String path;
        private final Instant timestamp;
    }
}
