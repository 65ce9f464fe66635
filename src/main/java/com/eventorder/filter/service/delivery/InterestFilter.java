package com.eventorder.filter.service.delivery;

import com.eventorder.filter.service.model.AggregateEvent;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Predicates over event type tags derived from a declared interest set.
 *
 * Applied after resequencing, so events nobody is interested in still advance
 * their aggregate's book-keeping.
 */
public final class InterestFilter {

    private InterestFilter() {
    }

    /**
     * Matches events whose type is one of the given tags.
     */
    public static Predicate<AggregateEvent> of(Collection<String> interestedTypes) {
        Objects.requireNonNull(interestedTypes, "interestedTypes");
        Set<String> types = Set.copyOf(interestedTypes);
        return event -> types.contains(event.type());
    }

    /**
     * Matches events the consumer declares interest in.
     */
    public static Predicate<AggregateEvent> of(EventConsumer consumer) {
        return of(consumer.interestedTypes());
    }

    /**
     * Matches every event.
     */
    public static Predicate<AggregateEvent> all() {
        return event -> true;
    }
}
