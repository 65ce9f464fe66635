package com.eventorder.filter.service.resequencer;

/**
 * Thrown when a resequencer's internal invariants no longer hold.
 *
 * Signals a logic defect, never bad input.
 */
public class ConsistencyViolationException extends IllegalStateException {

    private final String aggregateId;
    private final long version;

    public ConsistencyViolationException(String message, String aggregateId, long version) {
        super(message + " [aggregateId=" + aggregateId + ", version=" + version + "]");
        this.aggregateId = aggregateId;
        this.version = version;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getVersion() {
        return version;
    }
}
