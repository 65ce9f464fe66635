package com.eventorder.filter.service.routing;

import com.eventorder.filter.service.model.AggregateEvent;
import com.eventorder.filter.service.resequencer.EventResequencer;
import com.eventorder.filter.service.resequencer.ResequencerState;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Sealed interface for messages queued on a routing lane.
 *
 * Both kinds carry the target resequencer so the lane never touches the
 * router's key map.
 */
public sealed interface RoutingWorkItem permits
        RoutingWorkItem.InsertWorkItem,
        RoutingWorkItem.QueryWorkItem {

    /**
     * Gets the resequencer this item is addressed to.
     */
    EventResequencer resequencer();

    /**
     * Gets the timestamp when this item was created.
     */
    Instant getCreatedAt();

    default String getAggregateId() {
        return resequencer().getAggregateId();
    }

    /**
     * Work item inserting one event.
     */
    record InsertWorkItem(
            EventResequencer resequencer,
            AggregateEvent event,
            Instant createdAt
    ) implements RoutingWorkItem {

        public InsertWorkItem(EventResequencer resequencer, AggregateEvent event) {
            this(resequencer, event, Instant.now());
        }

        @Override
        public Instant getCreatedAt() {
            return createdAt;
        }
    }

    /**
     * Work item reading the book-keeping state, answered through {@code reply}.
     */
    record QueryWorkItem(
            EventResequencer resequencer,
            CompletableFuture<ResequencerState> reply,
            Instant createdAt
    ) implements RoutingWorkItem {

        public QueryWorkItem(EventResequencer resequencer, CompletableFuture<ResequencerState> reply) {
            this(resequencer, reply, Instant.now());
        }

        @Override
        public Instant getCreatedAt() {
            return createdAt;
        }
    }
}
