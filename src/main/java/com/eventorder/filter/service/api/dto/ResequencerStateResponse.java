package com.eventorder.filter.service.api.dto;

import com.eventorder.filter.service.resequencer.ResequencerState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for one aggregate's book-keeping.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResequencerStateResponse {

    private String aggregateId;
    private long maxAcceptedItem;

    /**
     * Lowest buffered version, null when nothing is buffered.
     */
    private Long minPendingItem;

    private long duplicates;
    private int pendingCount;
    private double filterTruthiness;

    public static ResequencerStateResponse from(ResequencerState state) {
        return ResequencerStateResponse.builder()
                .aggregateId(state.aggregateId())
                .maxAcceptedItem(state.maxAcceptedItem())
                .minPendingItem(state.hasPending() ? state.minPendingItem().getAsLong() : null)
                .duplicates(state.duplicates())
                .pendingCount(state.pendingCount())
                .filterTruthiness(state.filterTruthiness())
                .build();
    }
}
