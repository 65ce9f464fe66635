package com.eventorder.filter.service.delivery;

import com.eventorder.filter.service.config.MetricsConfig;
import com.eventorder.filter.service.model.AggregateEvent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Pushes accepted events to registered consumers.
 *
 * Each subscription carries its own interest predicate. A consumer that throws
 * is logged and counted; delivery to the others continues and book-keeping is
 * unaffected. After {@link #complete()} every consumer has received
 * {@code onCompleted} exactly once and nothing else is delivered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AcceptedEventPublisher {

    private final MetricsConfig metricsConfig;

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final AtomicBoolean completed = new AtomicBoolean(false);

    @PostConstruct
    void init() {
        metricsConfig.registerRouterGauge(
                "eventorder.delivery.subscribers",
                "Number of active subscribers",
                registrations::size
        );
    }

    /**
     * Registers a consumer filtered by its declared interest set.
     */
    public Subscription subscribe(EventConsumer consumer) {
        return subscribe(consumer, InterestFilter.of(consumer));
    }

    /**
     * Registers a consumer with an explicit filter.
     *
     * A consumer registered after completion is completed immediately.
     */
    public Subscription subscribe(EventConsumer consumer, Predicate<AggregateEvent> filter) {
        Objects.requireNonNull(consumer, "consumer");
        Objects.requireNonNull(filter, "filter");

        Registration registration = new Registration(consumer, filter);
        registrations.add(registration);

        if (completed.get()) {
            // lost the race with complete(), or subscribed late
            registration.completeOnce();
            return registration;
        }

        log.debug("Subscriber registered: {}, interestedTypes={}", consumer, consumer.interestedTypes());
        return registration;
    }

    /**
     * Delivers an accepted event to every interested, active subscriber.
     */
    public void publish(AggregateEvent event) {
        if (completed.get()) {
            log.warn("Publish after completion ignored: aggregateId={}, version={}",
                    event.aggregateId(), event.version());
            return;
        }
        for (Registration registration : registrations) {
            registration.deliver(event);
        }
    }

    /**
     * Signals that no further events will be published.
     */
    public void complete() {
        if (!completed.compareAndSet(false, true)) {
            return;
        }
        for (Registration registration : registrations) {
            registration.completeOnce();
        }
        log.info("Publisher completed, {} subscribers notified", registrations.size());
        registrations.clear();
    }

    public boolean isCompleted() {
        return completed.get();
    }

    public int subscriberCount() {
        return registrations.size();
    }

    // ==================== Registration ====================

    private final class Registration implements Subscription {

        private final EventConsumer consumer;
        private final Predicate<AggregateEvent> filter;
        private final AtomicBoolean active = new AtomicBoolean(true);

        Registration(EventConsumer consumer, Predicate<AggregateEvent> filter) {
            this.consumer = consumer;
            this.filter = filter;
        }

        void deliver(AggregateEvent event) {
            if (!active.get() || !filter.test(event)) {
                return;
            }
            try {
                consumer.onEvent(event);
            } catch (Exception e) {
                metricsConfig.getDeliveryFailures().increment();
                log.error("Subscriber failed on event: subscriber={}, aggregateId={}, version={}",
                        consumer, event.aggregateId(), event.version(), e);
            }
        }

        void completeOnce() {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            registrations.remove(this);
            try {
                consumer.onCompleted();
            } catch (Exception e) {
                log.error("Subscriber failed on completion: subscriber={}", consumer, e);
            }
        }

        @Override
        public void cancel() {
            if (active.compareAndSet(true, false)) {
                registrations.remove(this);
                log.debug("Subscriber cancelled: {}", consumer);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
