package com.tradinggateway.exception;

import com.tradinggateway.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions raised by the gateway API to {@link ApiErrorResponse}.
 *
 * <ul>
 *   <li>Bean Validation and unreadable bodies: 400</li>
 *   <li>{@link SafeModeActiveException}: 423 with the open degradation in {@code details}</li>
 *   <li>{@link GatewayException}: 502/503/504; retryable ones carry a {@code Retry-After} header</li>
 *   <li>Other {@link BaseException}s: the status of their {@link ErrorCode}</li>
 *   <li>Anything else: 500, logged with stack trace</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String RETRY_AFTER_SECONDS = "5";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fe -> fieldErrors.put(fe.getField(), fe.getDefaultMessage()));
        log.debug("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), fieldErrors);
        return respond(ErrorCode.VALIDATION_ERROR, "Request validation failed", fieldErrors, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return respond(ErrorCode.BAD_REQUEST, "Request body is missing or not valid JSON", null, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(ErrorCode.NOT_FOUND, "No endpoint " + request.getRequestURI(), null, request);
    }

    @ExceptionHandler(SafeModeActiveException.class)
    public ResponseEntity<ApiErrorResponse> handleSafeMode(SafeModeActiveException ex, HttpServletRequest request) {
        log.warn("Vetoed {} {} while in safe mode: {}", request.getMethod(), request.getRequestURI(), ex.getDetails());
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ApiErrorResponse> handleGateway(GatewayException ex, HttpServletRequest request) {
        if (ex.isRetryable()) {
            log.warn("Gateway call failed ({}): {}", ex.getErrorCode(), ex.getMessage());
            return ResponseEntity.status(ex.getErrorCode().getHttpStatus())
                    .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                    .body(ApiErrorResponse.of(
                            ex.getErrorCode(), ex.getMessage(), ex.getDetails(), request.getRequestURI()));
        }
        log.error("Gateway call failed ({}): {}", ex.getErrorCode(), ex.getMessage(), ex);
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleBase(BaseException ex, HttpServletRequest request) {
        if (ex.getErrorCode().getHttpStatus() >= 500) {
            log.error("{} on {}: {}", ex.getErrorCode(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("{} on {}: {}", ex.getErrorCode(), request.getRequestURI(), ex.getMessage());
        }
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "Internal error", null, request);
    }

    private ResponseEntity<ApiErrorResponse> respond(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        return ResponseEntity.status(errorCode.getHttpStatus())
                .body(ApiErrorResponse.of(errorCode, message, details, request.getRequestURI()));
    }
}
