package com.eventorder.filter.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the Event Order Filter Service.
 *
 * Provides custom metrics for routing, book-keeping, and delivery.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter eventsRouted;
    private final Counter eventsAccepted;
    private final Counter duplicateEvents;
    private final Counter futureEvents;
    private final Counter deliveryFailures;
    private final Counter pendingThresholdExceeded;
    private final Counter consistencyViolations;

    // Timers
    private final Timer routeTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.eventsRouted = Counter.builder("eventorder.events.routed")
                .description("Number of events handed to the key router")
                .register(registry);

        this.eventsAccepted = Counter.builder("eventorder.events.accepted")
                .description("Number of events accepted in version order")
                .register(registry);

        this.duplicateEvents = Counter.builder("eventorder.events.duplicate")
                .description("Number of events at or below the accepted version")
                .register(registry);

        this.futureEvents = Counter.builder("eventorder.events.future")
                .description("Number of events that arrived ahead of a gap")
                .register(registry);

        this.deliveryFailures = Counter.builder("eventorder.delivery.failed")
                .description("Number of subscriber callbacks that threw")
                .register(registry);

        this.pendingThresholdExceeded = Counter.builder("eventorder.pending.threshold.exceeded")
                .description("Number of times a key's future buffer outgrew the warn threshold")
                .register(registry);

        this.consistencyViolations = Counter.builder("eventorder.consistency.violations")
                .description("Number of broken resequencer invariants")
                .register(registry);

        this.routeTimer = Timer.builder("eventorder.route.duration")
                .description("Time taken to book-keep one event on its lane")
                .register(registry);
    }

    /**
     * Registers a gauge for lane depth monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerLaneGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }

    /**
     * Registers a gauge for router size monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerRouterGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
