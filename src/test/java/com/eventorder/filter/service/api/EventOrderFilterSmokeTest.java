package com.eventorder.filter.service.api;

import com.eventorder.filter.service.api.dto.BatchEventIngestRequest;
import com.eventorder.filter.service.api.dto.EventIngestRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Smoke tests for the Event Order Filter Service.
 *
 * Tests basic functionality of all endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class EventOrderFilterSmokeTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads() {
        // Context loads successfully
    }

    @Test
    void healthEndpointReportsRoutingLanes() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").exists())
                .andExpect(jsonPath("$.components.routingLanes.status").value("UP"))
                .andExpect(jsonPath("$.components.routingLanes.details.laneCount").value(2));
    }

    @Test
    void swaggerUiAvailable() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    @Test
    void apiDocsDescribeRoutingSettings() throws Exception {
        mockMvc.perform(get("/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title").value("Event Order Filter Service API"))
                .andExpect(jsonPath("$.info.description").value(containsString("Routing lanes: 2 x 1000 queued items")))
                .andExpect(jsonPath("$.info.description").value(containsString("above 100 pending events")))
                .andExpect(jsonPath("$.tags[?(@.name == 'Event Intake')]").exists());
    }

    @Test
    void submitEvent_validRequest_returns202() throws Exception {
        EventIngestRequest request = event("smoke-1", 1, "A");

        mockMvc.perform(post("/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").value("smoke-1"));
    }

    @Test
    void submitEvent_missingAggregateId_returns400() throws Exception {
        EventIngestRequest request = EventIngestRequest.builder()
                .version(1)
                .type("A")
                .build();

        mockMvc.perform(post("/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details").value(containsString("aggregateId")));
    }

    @Test
    void submitEvent_versionZero_returns400() throws Exception {
        mockMvc.perform(post("/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(event("smoke-2", 0, "A"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void submitEvent_malformedBody_returns400() throws Exception {
        mockMvc.perform(post("/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void submitBatch_returnsCounts() throws Exception {
        BatchEventIngestRequest request = BatchEventIngestRequest.builder()
                .events(List.of(event("smoke-batch", 2, "A"), event("smoke-batch", 1, "A")))
                .build();

        mockMvc.perform(post("/events/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.submitted").value(2))
                .andExpect(jsonPath("$.data.routed").value(2));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                mockMvc.perform(get("/aggregates/smoke-batch/internals"))
                        .andExpect(jsonPath("$.data.maxAcceptedItem").value(2)));
    }

    @Test
    void submitBatch_emptyList_returns400() throws Exception {
        mockMvc.perform(post("/events/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void internals_unknownAggregate_returnsZeroState() throws Exception {
        mockMvc.perform(get("/aggregates/never-routed/internals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.aggregateId").value("never-routed"))
                .andExpect(jsonPath("$.data.maxAcceptedItem").value(0))
                .andExpect(jsonPath("$.data.duplicates").value(0))
                .andExpect(jsonPath("$.data.minPendingItem").value(nullValue()));
    }

    @Test
    void listAggregates_returnsArray() throws Exception {
        mockMvc.perform(get("/aggregates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").isArray());
    }

    @Test
    void unknownPath_returns404Envelope() throws Exception {
        mockMvc.perform(get("/no-such-endpoint"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    private static EventIngestRequest event(String aggregateId, long version, String type) {
        return EventIngestRequest.builder()
                .aggregateId(aggregateId)
                .version(version)
                .type(type)
                .build();
    }
}
