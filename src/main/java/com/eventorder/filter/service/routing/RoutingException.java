package com.eventorder.filter.service.routing;

/**
 * Exception thrown when routing or querying an aggregate fails.
 */
public class RoutingException extends RuntimeException {

    public static final String QUEUE_FULL = "QUEUE_FULL";
    public static final String QUERY_TIMEOUT = "QUERY_TIMEOUT";
    public static final String RESEQUENCER_UNAVAILABLE = "RESEQUENCER_UNAVAILABLE";
    public static final String ROUTER_COMPLETED = "ROUTER_COMPLETED";
    public static final String INTAKE_DISABLED = "INTAKE_DISABLED";

    private final String aggregateId;
    private final String errorCode;

    public RoutingException(String message, String aggregateId, String errorCode) {
        super(message);
        this.aggregateId = aggregateId;
        this.errorCode = errorCode;
    }

    public RoutingException(String message, String aggregateId, String errorCode, Throwable cause) {
        super(message, cause);
        this.aggregateId = aggregateId;
        this.errorCode = errorCode;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
