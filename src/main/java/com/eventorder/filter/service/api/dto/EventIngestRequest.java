package com.eventorder.filter.service.api.dto;

import com.eventorder.filter.service.model.TypedEvent;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for a single inbound event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventIngestRequest {

    /**
     * Key of the aggregate the event belongs to.
     */
    @NotBlank(message = "aggregateId is required")
    private String aggregateId;

    /**
     * Per-aggregate sequence number, starting at 1.
     */
    @Min(value = 1, message = "version must be at least 1")
    private long version;

    /**
     * Type tag consumers filter on.
     */
    @NotBlank(message = "type is required")
    private String type;

    public TypedEvent toEvent() {
        return new TypedEvent(aggregateId, version, type);
    }
}
