package com.eventorder.filter.service.delivery;

import com.eventorder.filter.service.model.AggregateEvent;

import java.util.Set;

/**
 * Downstream consumer of accepted events.
 *
 * Callbacks for different aggregates may arrive concurrently from different
 * lanes; callbacks for one aggregate arrive in version order from one thread
 * at a time.
 */
public interface EventConsumer {

    /**
     * Gets the event type tags this consumer wants delivered.
     */
    Set<String> interestedTypes();

    /**
     * Receives an accepted event matching {@link #interestedTypes()}.
     */
    void onEvent(AggregateEvent event);

    /**
     * Called once when no further events will be delivered.
     */
    default void onCompleted() {
    }
}
