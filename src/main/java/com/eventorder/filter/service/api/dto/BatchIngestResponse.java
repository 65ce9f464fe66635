package com.eventorder.filter.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a batch submission.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestResponse {

    private int submitted;

    /**
     * Events queued before the first rejection.
     */
    private int routed;
}
