package com.eventorder.filter.service.resequencer;

/**
 * Classification of one event against a resequencer's current book-keeping.
 */
public enum BookKeepingChange {

    /**
     * Version at or below the highest accepted one; counted and dropped.
     */
    DUPLICATE,

    /**
     * Exactly the next expected version; accepted and emitted.
     */
    NEXT,

    /**
     * The next expected version, and the version after it is already buffered;
     * accepted, emitted, then the buffer is drained.
     */
    GAP_CLOSED,

    /**
     * Ahead of the next expected version; buffered until the gap closes.
     */
    FUTURE;

    public boolean isAccepted() {
        return this == NEXT || this == GAP_CLOSED;
    }
}
