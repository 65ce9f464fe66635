package com.eventorder.filter.service.api.controller;

import com.eventorder.filter.service.api.dto.ApiResponse;
import com.eventorder.filter.service.api.dto.ResequencerStateResponse;
import com.eventorder.filter.service.routing.KeyRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for per-aggregate book-keeping diagnostics.
 */
@Slf4j
@RestController
@RequestMapping("/aggregates")
@Tag(name = "Aggregates", description = "Endpoints for inspecting resequencer book-keeping")
@RequiredArgsConstructor
public class AggregateController {

    private final KeyRouter keyRouter;

    @GetMapping
    @Operation(summary = "List all aggregates", description = "Returns book-keeping for every aggregate seen so far, ordered by id")
    public ResponseEntity<ApiResponse<List<ResequencerStateResponse>>> listAggregates() {
        List<ResequencerStateResponse> states = keyRouter.queryAll().stream()
                .map(ResequencerStateResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(states));
    }

    /**
     * Reads one aggregate's book-keeping. Unknown aggregates report zero state.
     */
    @GetMapping("/{aggregateId}/internals")
    @Operation(summary = "Get aggregate internals", description = "Returns highest accepted version, lowest pending version and duplicate count")
    public ResponseEntity<ApiResponse<ResequencerStateResponse>> getInternals(
            @Parameter(description = "Aggregate ID") @PathVariable String aggregateId) {
        log.debug("Querying internals: {}", aggregateId);
        return ResponseEntity.ok(ApiResponse.success(
                ResequencerStateResponse.from(keyRouter.queryInternals(aggregateId))));
    }
}
