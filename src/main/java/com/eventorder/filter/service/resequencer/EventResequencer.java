package com.eventorder.filter.service.resequencer;

import com.eventorder.filter.service.filter.MembershipFilter;
import com.eventorder.filter.service.model.AggregateEvent;
import com.eventorder.filter.service.model.SortableEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Book-keeping state machine for a single aggregate.
 *
 * Accepts in-order events immediately, counts duplicates, and buffers events
 * that arrive ahead of a gap until the gap closes, then drains them in version
 * order. Not thread-safe: every call for a given instance must come from the
 * same serialized execution context.
 */
@Slf4j
public class EventResequencer {

    private final String aggregateId;
    private final MembershipFilter<SortableEvent> bufferedFilter;
    private final ResequencerListener listener;
    private final int pendingWarnThreshold;

    private final TreeSet<SortableEvent> futureSet = new TreeSet<>();

    private long maxAccepted;
    // only meaningful while futureSet is non-empty
    private long minPending;
    private long duplicates;
    private boolean thresholdExceeded;

    /**
     * @param aggregateId the key this resequencer owns
     * @param bufferedFilter pre-check for buffered futures, may be null
     * @param listener outcome callbacks
     * @param pendingWarnThreshold buffer size that triggers a warning, 0 to disable
     */
    public EventResequencer(String aggregateId,
                            MembershipFilter<SortableEvent> bufferedFilter,
                            ResequencerListener listener,
                            int pendingWarnThreshold) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
        this.bufferedFilter = bufferedFilter;
        this.listener = listener != null ? listener : ResequencerListener.NONE;
        this.pendingWarnThreshold = pendingWarnThreshold;
    }

    public EventResequencer(String aggregateId) {
        this(aggregateId, null, ResequencerListener.NONE, 0);
    }

    // ==================== Operations ====================

    /**
     * Classifies the event and updates book-keeping.
     *
     * Every event accepted by this call, the inserted one and any buffered ones
     * released by it, is handed to {@code onAccepted} in increasing version order.
     *
     * @param event an event for this resequencer's aggregate
     * @param onAccepted receives accepted events
     * @return how the inserted event was classified
     * @throws IllegalArgumentException if the event belongs to another aggregate
     * @throws ConsistencyViolationException if internal invariants are broken
     */
    public BookKeepingChange insert(AggregateEvent event, Consumer<? super AggregateEvent> onAccepted) {
        Objects.requireNonNull(event, "event");
        if (!aggregateId.equals(event.aggregateId())) {
            throw new IllegalArgumentException("Event for aggregate " + event.aggregateId()
                    + " routed to resequencer of " + aggregateId);
        }

        BookKeepingChange change = updateBookKeeping(event.version());
        switch (change) {
            case DUPLICATE -> {
                log.trace("Duplicate event ignored: aggregateId={}, version={}, duplicates={}",
                        aggregateId, event.version(), duplicates);
                listener.onDuplicate(aggregateId, event.version());
            }
            case NEXT -> onAccepted.accept(event);
            case GAP_CLOSED -> {
                onAccepted.accept(event);
                flushBuffer(onAccepted);
            }
            case FUTURE -> {
                log.debug("Message reordering, got future event: aggregateId={}, version={}, expected={}",
                        aggregateId, event.version(), maxAccepted + 1);
                bufferFuture(SortableEvent.of(event));
                listener.onFuture(aggregateId, event.version());
            }
        }
        return change;
    }

    /**
     * Gets a snapshot of the current book-keeping.
     */
    public ResequencerState state() {
        return new ResequencerState(
                aggregateId,
                maxAccepted,
                futureSet.isEmpty() ? OptionalLong.empty() : OptionalLong.of(minPending),
                duplicates,
                futureSet.size(),
                bufferedFilter != null ? bufferedFilter.truthiness() : 0.0
        );
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public int pendingCount() {
        return futureSet.size();
    }

    // ==================== Book-keeping ====================

    private BookKeepingChange updateBookKeeping(long version) {
        if (version <= maxAccepted) {
            duplicates++;
            return BookKeepingChange.DUPLICATE;
        }

        if (version == maxAccepted + 1) {
            boolean nextIsBuffered = !futureSet.isEmpty() && minPending == maxAccepted + 2;
            maxAccepted++;
            return nextIsBuffered ? BookKeepingChange.GAP_CLOSED : BookKeepingChange.NEXT;
        }

        return BookKeepingChange.FUTURE;
    }

    private void bufferFuture(SortableEvent future) {
        boolean firstPending = futureSet.isEmpty();
        if (isBuffered(future)) {
            log.debug("Future event already buffered: {}", future);
        } else {
            futureSet.add(future);
            if (bufferedFilter != null) {
                bufferedFilter.add(future);
            }
            checkPendingThreshold();
        }

        minPending = firstPending ? future.version() : Math.min(minPending, future.version());

        long bufferedMin = futureSet.first().version();
        if (bufferedMin != minPending) {
            throw new ConsistencyViolationException(
                    "Buffered minimum " + bufferedMin + " differs from min pending " + minPending,
                    aggregateId, future.version());
        }
    }

    private boolean isBuffered(SortableEvent future) {
        if (bufferedFilter != null && !bufferedFilter.contains(future)) {
            return false;
        }
        return futureSet.contains(future);
    }

    /**
     * Releases buffered events while the smallest one is next in line.
     */
    private void flushBuffer(Consumer<? super AggregateEvent> onAccepted) {
        while (!futureSet.isEmpty()) {
            SortableEvent head = futureSet.first();
            BookKeepingChange secondChange = updateBookKeeping(head.version());

            if (secondChange == BookKeepingChange.FUTURE) {
                break;
            }
            if (secondChange == BookKeepingChange.DUPLICATE) {
                throw new ConsistencyViolationException(
                        "Buffered event at or below max accepted " + maxAccepted,
                        aggregateId, head.version());
            }

            futureSet.pollFirst();
            onAccepted.accept(head.value());
        }

        minPending = futureSet.isEmpty() ? 0L : futureSet.first().version();
        if (thresholdExceeded && futureSet.size() <= pendingWarnThreshold) {
            thresholdExceeded = false;
        }
        log.debug("Buffer drained: aggregateId={}, maxAccepted={}, stillPending={}",
                aggregateId, maxAccepted, futureSet.size());
    }

    private void checkPendingThreshold() {
        if (pendingWarnThreshold <= 0 || thresholdExceeded) {
            return;
        }
        if (futureSet.size() > pendingWarnThreshold) {
            thresholdExceeded = true;
            log.warn("Future buffer exceeded {} events: aggregateId={}, maxAccepted={}, minPending={}",
                    pendingWarnThreshold, aggregateId, maxAccepted, minPending);
            listener.onPendingThresholdExceeded(aggregateId, futureSet.size());
        }
    }
}
