package com.eventorder.filter.service.model;

import java.util.Objects;

/**
 * Plain event value received over the HTTP surface.
 */
public record TypedEvent(
        String aggregateId,
        long version,
        String type
) implements AggregateEvent {

    public TypedEvent {
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(type, "type");
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, was " + version);
        }
    }
}
