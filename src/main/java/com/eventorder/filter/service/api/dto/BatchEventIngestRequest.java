package com.eventorder.filter.service.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for submitting several events at once, routed in list order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchEventIngestRequest {

    @NotEmpty(message = "events cannot be empty")
    private List<@Valid EventIngestRequest> events;
}
