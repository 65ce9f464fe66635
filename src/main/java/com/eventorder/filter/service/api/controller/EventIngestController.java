package com.eventorder.filter.service.api.controller;

import com.eventorder.filter.service.api.dto.ApiResponse;
import com.eventorder.filter.service.api.dto.BatchEventIngestRequest;
import com.eventorder.filter.service.api.dto.BatchIngestResponse;
import com.eventorder.filter.service.api.dto.EventIngestRequest;
import com.eventorder.filter.service.model.TypedEvent;
import com.eventorder.filter.service.routing.KeyRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for event intake.
 *
 * Events are queued on their aggregate's routing lane; acceptance happens asynchronously.
 */
@Slf4j
@RestController
@RequestMapping("/events")
@Tag(name = "Event Intake", description = "Endpoints for submitting aggregate events in any order")
@RequiredArgsConstructor
public class EventIngestController {

    private final KeyRouter keyRouter;

    /**
     * Submits one event.
     *
     * @return 202 with the aggregate id if queued, 429 if the lane is full
     */
    @PostMapping
    @Operation(
            summary = "Submit an event",
            description = "Queues an event for per-aggregate resequencing. Accepted events are delivered in version order."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Event queued"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid event"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Routing lane full"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Router completed or intake disabled")
    })
    public ResponseEntity<ApiResponse<String>> submitEvent(@Valid @RequestBody EventIngestRequest request) {
        TypedEvent event = request.toEvent();
        log.debug("Received event: aggregateId={}, version={}, type={}",
                event.aggregateId(), event.version(), event.type());

        if (!keyRouter.route(event)) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(ApiResponse.queueFull("aggregateId: " + event.aggregateId()));
        }

        return ResponseEntity.accepted()
                .body(ApiResponse.success(event.aggregateId()));
    }

    /**
     * Submits events in list order, stopping at the first that cannot be queued.
     *
     * @return 202 with submitted and routed counts, 429 if nothing was queued
     */
    @PostMapping("/batch")
    @Operation(
            summary = "Submit a batch of events",
            description = "Queues events in list order. Routing stops at the first event whose lane stays full."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Some or all events queued"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid batch"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "No event could be queued"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Router completed or intake disabled")
    })
    public ResponseEntity<ApiResponse<BatchIngestResponse>> submitBatch(
            @Valid @RequestBody BatchEventIngestRequest request) {

        List<TypedEvent> events = request.getEvents().stream()
                .map(EventIngestRequest::toEvent)
                .toList();
        int routed = keyRouter.routeAll(events);

        BatchIngestResponse body = BatchIngestResponse.builder()
                .submitted(events.size())
                .routed(routed)
                .build();

        if (routed == 0) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(ApiResponse.queueFull("0 of " + events.size() + " events queued"));
        }
        if (routed < events.size()) {
            log.warn("Batch partially queued: {} of {} events", routed, events.size());
        } else {
            log.debug("Batch queued: {} events", routed);
        }
        return ResponseEntity.accepted()
                .body(ApiResponse.success(body));
    }
}
