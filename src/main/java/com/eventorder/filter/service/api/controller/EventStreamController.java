package com.eventorder.filter.service.api.controller;

import com.eventorder.filter.service.delivery.AcceptedEventPublisher;
import com.eventorder.filter.service.delivery.EventConsumer;
import com.eventorder.filter.service.delivery.InterestFilter;
import com.eventorder.filter.service.delivery.Subscription;
import com.eventorder.filter.service.model.AggregateEvent;
import com.eventorder.filter.service.model.TypedEvent;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Streams accepted events to HTTP clients as server-sent events.
 */
@Slf4j
@RestController
@RequestMapping("/events")
@Tag(name = "Event Stream", description = "Server-sent stream of accepted events")
@RequiredArgsConstructor
public class EventStreamController {

    private final AcceptedEventPublisher publisher;

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(
            summary = "Stream accepted events",
            description = "Emits accepted events in per-aggregate version order, filtered by type. All types when none given."
    )
    public SseEmitter stream(
            @Parameter(description = "Event types of interest")
            @RequestParam(name = "types", required = false) List<String> types) {

        SseEmitter emitter = new SseEmitter(0L);
        Set<String> interest = types == null ? Set.of() : Set.copyOf(types);
        SseConsumer consumer = new SseConsumer(emitter, interest);

        Subscription subscription = interest.isEmpty()
                ? publisher.subscribe(consumer, InterestFilter.all())
                : publisher.subscribe(consumer);

        emitter.onCompletion(subscription::cancel);
        emitter.onTimeout(subscription::cancel);
        emitter.onError(e -> subscription.cancel());

        log.debug("Stream opened, types={}", interest.isEmpty() ? "*" : interest);
        return emitter;
    }

    /**
     * Writes events to one emitter. Send failures end the stream.
     */
    private static final class SseConsumer implements EventConsumer {

        private final SseEmitter emitter;
        private final Set<String> interestedTypes;

        SseConsumer(SseEmitter emitter, Set<String> interestedTypes) {
            this.emitter = emitter;
            this.interestedTypes = interestedTypes;
        }

        @Override
        public Set<String> interestedTypes() {
            return interestedTypes;
        }

        @Override
        public void onEvent(AggregateEvent event) {
            try {
                emitter.send(SseEmitter.event()
                        .id(event.aggregateId() + "@" + event.version())
                        .name(event.type())
                        .data(new TypedEvent(event.aggregateId(), event.version(), event.type()),
                                MediaType.APPLICATION_JSON));
            } catch (IOException e) {
                emitter.completeWithError(e);
                throw new IllegalStateException("Stream client disconnected", e);
            }
        }

        @Override
        public void onCompleted() {
            emitter.complete();
        }

        @Override
        public String toString() {
            return "SseConsumer" + interestedTypes;
        }
    }
}
