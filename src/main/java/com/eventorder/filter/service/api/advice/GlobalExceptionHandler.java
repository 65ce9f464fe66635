package com.eventorder.filter.service.api.advice;

import com.eventorder.filter.service.api.dto.ApiResponse;
import com.eventorder.filter.service.filter.FilterConstructionException;
import com.eventorder.filter.service.routing.RoutingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Maps domain exceptions to the response envelope and an HTTP status.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(
            MethodArgumentNotValidException ex) {

        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", details);

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Validation failed", ApiResponse.VALIDATION_ERROR, details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Malformed request body", ApiResponse.VALIDATION_ERROR));
    }

    /**
     * Routing failures: backpressure, stopped lanes and a completed router.
     */
    @ExceptionHandler(RoutingException.class)
    public ResponseEntity<ApiResponse<Void>> handleRoutingException(RoutingException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case RoutingException.QUEUE_FULL -> HttpStatus.TOO_MANY_REQUESTS;
            case RoutingException.QUERY_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case RoutingException.RESEQUENCER_UNAVAILABLE,
                 RoutingException.ROUTER_COMPLETED,
                 RoutingException.INTAKE_DISABLED -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        log.warn("Routing error: {} [{}] aggregateId={}", ex.getMessage(), ex.getErrorCode(), ex.getAggregateId());

        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode(), aggregateDetails(ex.getAggregateId())));
    }

    @ExceptionHandler(FilterConstructionException.class)
    public ResponseEntity<ApiResponse<Void>> handleFilterConstructionException(FilterConstructionException ex) {
        log.error("Membership filter could not be built: {} [{}]", ex.getMessage(), ex.getErrorCode());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(
            NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Resource not found", "NOT_FOUND"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(
            IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(
                        "An unexpected error occurred",
                        "INTERNAL_ERROR",
                        ex.getMessage()
                ));
    }

    private static String aggregateDetails(String aggregateId) {
        return aggregateId == null ? null : "aggregateId: " + aggregateId;
    }
}
