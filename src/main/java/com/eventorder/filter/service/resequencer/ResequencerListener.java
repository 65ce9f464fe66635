package com.eventorder.filter.service.resequencer;

/**
 * Callbacks for book-keeping outcomes that are not emissions.
 */
public interface ResequencerListener {

    ResequencerListener NONE = new ResequencerListener() {
    };

    default void onDuplicate(String aggregateId, long version) {
    }

    default void onFuture(String aggregateId, long version) {
    }

    /**
     * Called once when the future buffer of a key grows past the warn threshold.
     */
    default void onPendingThresholdExceeded(String aggregateId, int pendingCount) {
    }
}
