package com.eventorder.filter.service.model;

import java.util.Objects;

/**
 * Immutable wrapper giving an event its identity and ordering.
 *
 * Two wrapped events are equal when they share aggregate id and version; the
 * type tag is ignored since an aggregate never publishes two different events
 * at the same version. Ordering is by aggregate id, then by version.
 */
public final class SortableEvent implements Comparable<SortableEvent> {

    private final AggregateEvent event;

    private SortableEvent(AggregateEvent event) {
        this.event = Objects.requireNonNull(event, "event");
    }

    public static SortableEvent of(AggregateEvent event) {
        return new SortableEvent(event);
    }

    public AggregateEvent value() {
        return event;
    }

    public String aggregateId() {
        return event.aggregateId();
    }

    public long version() {
        return event.version();
    }

    @Override
    public int compareTo(SortableEvent other) {
        int byAggregate = event.aggregateId().compareTo(other.event.aggregateId());
        if (byAggregate != 0) {
            return byAggregate;
        }
        return Long.compare(event.version(), other.event.version());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SortableEvent other)) return false;
        return event == other.event
                || (event.version() == other.event.version()
                && event.aggregateId().equals(other.event.aggregateId()));
    }

    @Override
    public int hashCode() {
        return (event.aggregateId().hashCode() * 397) ^ Long.hashCode(event.version());
    }

    @Override
    public String toString() {
        return event.aggregateId() + "@" + event.version() + "[" + event.type() + "]";
    }
}
