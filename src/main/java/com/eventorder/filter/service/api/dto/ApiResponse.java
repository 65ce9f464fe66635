package com.eventorder.filter.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope returned by every endpoint of the filter service.
 *
 * Exactly one of {@code data} and {@code error} is present.
 *
 * @param <T> the type of the response data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String QUEUE_FULL = "QUEUE_FULL";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    private boolean success;
    private T data;
    private ErrorInfo error;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> error(String message, String code) {
        return error(message, code, null);
    }

    /**
     * Creates a failure response; {@code details} may be null.
     */
    public static <T> ApiResponse<T> error(String message, String code, String details) {
        return ApiResponse.<T>builder()
                .success(false)
                .error(new ErrorInfo(message, code, details))
                .build();
    }

    /**
     * Backpressure answer for intake whose routing lane stayed full.
     */
    public static <T> ApiResponse<T> queueFull(String details) {
        return error("Routing lane is full, please retry later", QUEUE_FULL, details);
    }

    /**
     * @param code machine-readable code, e.g. a {@code RoutingException} error code
     * @param details free-form context such as the aggregate id, may be null
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorInfo(String message, String code, String details) {
    }
}
