package com.eventorder.filter.service.resequencer;

import java.util.OptionalLong;

/**
 * Diagnostic snapshot of one aggregate's book-keeping.
 *
 * @param aggregateId the aggregate key
 * @param maxAcceptedItem highest accepted version, 0 when none
 * @param minPendingItem lowest buffered future version, empty when nothing is buffered
 * @param duplicates events seen at or below {@code maxAcceptedItem}
 * @param pendingCount number of buffered future events
 * @param filterTruthiness fill ratio of the key's membership filter, 0 when disabled
 */
public record ResequencerState(
        String aggregateId,
        long maxAcceptedItem,
        OptionalLong minPendingItem,
        long duplicates,
        int pendingCount,
        double filterTruthiness
) {

    /**
     * State reported for a key that has never been routed.
     */
    public static ResequencerState empty(String aggregateId) {
        return new ResequencerState(aggregateId, 0L, OptionalLong.empty(), 0L, 0, 0.0);
    }

    public boolean hasPending() {
        return minPendingItem.isPresent();
    }
}
