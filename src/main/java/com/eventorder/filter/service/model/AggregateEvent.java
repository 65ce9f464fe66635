package com.eventorder.filter.service.model;

/**
 * An event published by an aggregate.
 *
 * Versions start at 1 and grow by one for every event the aggregate publishes,
 * so (aggregateId, version) identifies an event. The type is a stable
 * discriminator used for interest filtering only.
 */
public interface AggregateEvent {

    /**
     * Gets the aggregate identity the event belongs to.
     */
    String aggregateId();

    /**
     * Gets the per-aggregate version of the event.
     */
    long version();

    /**
     * Gets the event type tag.
     */
    String type();
}
