package com.eventorder.filter.service.routing;

import com.eventorder.filter.service.config.FilterConfig;
import com.eventorder.filter.service.config.MetricsConfig;
import com.eventorder.filter.service.config.RoutingConfig;
import com.eventorder.filter.service.delivery.AcceptedEventPublisher;
import com.eventorder.filter.service.model.AggregateEvent;
import com.eventorder.filter.service.resequencer.ConsistencyViolationException;
import com.eventorder.filter.service.resequencer.EventResequencer;
import com.eventorder.filter.service.resequencer.ResequencerFactory;
import com.eventorder.filter.service.resequencer.ResequencerState;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Supervisor that fans the inbound event stream out to one resequencer per aggregate.
 *
 * The router owns the key to resequencer map and nothing else. Each resequencer
 * is only ever touched by the lane its key hashes to, so book-keeping for one
 * key is serialized without locks and different keys proceed in parallel.
 * Accepted events are handed to the {@link AcceptedEventPublisher}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeyRouter {

    private final ResequencerFactory resequencerFactory;
    private final AcceptedEventPublisher publisher;
    private final RoutingConfig routingConfig;
    private final MetricsConfig metricsConfig;
    private final FilterConfig filterConfig;

    private final Map<String, EventResequencer> resequencers = new ConcurrentHashMap<>();
    private final AtomicBoolean accepting = new AtomicBoolean(false);
    private final AtomicBoolean completed = new AtomicBoolean(false);
    // read side: check-then-enqueue; write side: closing intake
    private final ReadWriteLock intakeLock = new ReentrantReadWriteLock();
    private List<RoutingLane> lanes = List.of();

    // ==================== Lifecycle ====================

    @PostConstruct
    void start() {
        int laneCount = Math.max(1, routingConfig.getLanes().getCount());
        int capacity = routingConfig.getLanes().getQueueCapacity();
        long pollMs = routingConfig.getTimeout().getPollMs();

        List<RoutingLane> created = new ArrayList<>(laneCount);
        for (int i = 0; i < laneCount; i++) {
            RoutingLane lane = new RoutingLane(i, capacity, pollMs, this::handle);
            lane.start();
            created.add(lane);
        }
        lanes = List.copyOf(created);
        accepting.set(true);

        metricsConfig.registerRouterGauge(
                "eventorder.router.aggregates",
                "Number of aggregates with a resequencer",
                this::knownAggregateCount
        );
        metricsConfig.registerLaneGauge(
                "eventorder.router.lanes.queued",
                "Work items queued across all routing lanes",
                () -> lanes.stream().mapToInt(RoutingLane::size).sum()
        );

        log.info("KeyRouter started with {} lanes, lane capacity: {}", laneCount, capacity);
    }

    @PreDestroy
    void stop() {
        complete();
    }

    /**
     * Stops accepting events, lets every lane finish its queue, then completes
     * the publisher. Idempotent.
     *
     * Every event for which {@link #route} returned true is processed before
     * subscribers see completion.
     */
    public void complete() {
        if (!completed.compareAndSet(false, true)) {
            return;
        }
        intakeLock.writeLock().lock();
        try {
            accepting.set(false);
        } finally {
            intakeLock.writeLock().unlock();
        }
        long shutdownSeconds = routingConfig.getTimeout().getShutdownSeconds();
        for (RoutingLane lane : lanes) {
            lane.stop(shutdownSeconds);
        }
        publisher.complete();
        log.info("KeyRouter completed. Aggregates tracked: {}", resequencers.size());
    }

    public boolean isCompleted() {
        return completed.get();
    }

    // ==================== Routing ====================

    /**
     * Routes an event to its aggregate's resequencer, creating it on first sight.
     *
     * @param event the inbound event
     * @return true if queued, false if the key's lane stayed full past the enqueue timeout
     * @throws RoutingException if the router has completed or intake is disabled
     * @throws com.eventorder.filter.service.filter.FilterConstructionException if a new resequencer cannot be built
     */
    public boolean route(AggregateEvent event) {
        Objects.requireNonNull(event, "event");
        String aggregateId = event.aggregateId();

        boolean enqueued;
        intakeLock.readLock().lock();
        try {
            ensureAccepting(aggregateId);

            EventResequencer resequencer = resequencers.computeIfAbsent(aggregateId, id -> {
                log.debug("Haven't seen events from aggregate {} before, creating resequencer", id);
                return resequencerFactory.create(id);
            });

            log.trace("Routing event: aggregateId={}, version={}, type={}", aggregateId, event.version(), event.type());
            enqueued = laneFor(aggregateId).enqueue(
                    new RoutingWorkItem.InsertWorkItem(resequencer, event),
                    routingConfig.getTimeout().getEnqueueMs());
        } finally {
            intakeLock.readLock().unlock();
        }
        if (enqueued) {
            metricsConfig.getEventsRouted().increment();
        }
        return enqueued;
    }

    /**
     * Routes events in order, stopping at the first one that cannot be queued.
     *
     * @return number of events queued
     */
    public int routeAll(List<? extends AggregateEvent> events) {
        int routed = 0;
        for (AggregateEvent event : events) {
            if (!route(event)) {
                break;
            }
            routed++;
        }
        return routed;
    }

    // ==================== Queries ====================

    /**
     * Reads one aggregate's book-keeping through its lane.
     *
     * An aggregate that was never routed reports empty state and is not created.
     *
     * @throws RoutingException if the lane has stopped, is full, or does not answer in time
     */
    public ResequencerState queryInternals(String aggregateId) {
        log.trace("Querying internals for aggregate: {}", aggregateId);

        EventResequencer resequencer = resequencers.get(aggregateId);
        if (resequencer == null) {
            return ResequencerState.empty(aggregateId);
        }

        CompletableFuture<ResequencerState> reply = new CompletableFuture<>();
        boolean enqueued;
        intakeLock.readLock().lock();
        try {
            if (!accepting.get()) {
                throw new RoutingException("Resequencer is no longer running for aggregate: " + aggregateId,
                        aggregateId, RoutingException.RESEQUENCER_UNAVAILABLE);
            }
            enqueued = laneFor(aggregateId).enqueue(new RoutingWorkItem.QueryWorkItem(resequencer, reply),
                    routingConfig.getTimeout().getEnqueueMs());
        } finally {
            intakeLock.readLock().unlock();
        }
        if (!enqueued) {
            throw new RoutingException("Routing lane is full, please retry later",
                    aggregateId, RoutingException.QUEUE_FULL);
        }
        return awaitReply(aggregateId, reply);
    }

    /**
     * Reads the book-keeping of every known aggregate, ordered by aggregate id.
     */
    public List<ResequencerState> queryAll() {
        return resequencers.keySet().stream()
                .sorted(Comparator.naturalOrder())
                .map(this::queryInternals)
                .collect(Collectors.toList());
    }

    public int knownAggregateCount() {
        return resequencers.size();
    }

    public List<LaneStatus> laneStatuses() {
        return lanes.stream()
                .map(lane -> new LaneStatus(
                        lane.getIndex(),
                        lane.size(),
                        lane.getCapacity(),
                        lane.getUtilizationPercent(),
                        lane.isRunning()))
                .collect(Collectors.toList());
    }

    // ==================== Lane Dispatch ====================

    private void handle(RoutingWorkItem item) {
        if (item instanceof RoutingWorkItem.InsertWorkItem insert) {
            handleInsert(insert);
        } else if (item instanceof RoutingWorkItem.QueryWorkItem query) {
            query.reply().complete(query.resequencer().state());
        }
    }

    private void handleInsert(RoutingWorkItem.InsertWorkItem item) {
        AggregateEvent event = item.event();
        try {
            metricsConfig.getRouteTimer().record(() -> {
                item.resequencer().insert(event, this::onAccepted);
            });
        } catch (ConsistencyViolationException e) {
            metricsConfig.getConsistencyViolations().increment();
            log.error("Resequencer invariant broken: aggregateId={}, version={}, type={}, state={}",
                    e.getAggregateId(), e.getVersion(), event.type(), item.resequencer().state(), e);
        }
    }

    private void onAccepted(AggregateEvent event) {
        metricsConfig.getEventsAccepted().increment();
        log.trace("Event accepted: aggregateId={}, version={}", event.aggregateId(), event.version());
        publisher.publish(event);
    }

    // ==================== Helper Methods ====================

    private RoutingLane laneFor(String aggregateId) {
        return lanes.get(Math.floorMod(aggregateId.hashCode(), lanes.size()));
    }

    private void ensureAccepting(String aggregateId) {
        if (!accepting.get()) {
            throw new RoutingException("Router has completed and accepts no further events",
                    aggregateId, RoutingException.ROUTER_COMPLETED);
        }
        if (!filterConfig.isEnabled()) {
            throw new RoutingException("Event intake is disabled",
                    aggregateId, RoutingException.INTAKE_DISABLED);
        }
    }

    private ResequencerState awaitReply(String aggregateId, CompletableFuture<ResequencerState> reply) {
        try {
            return reply.get(routingConfig.getTimeout().getQueryMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new RoutingException("Timed out querying aggregate: " + aggregateId,
                    aggregateId, RoutingException.QUERY_TIMEOUT, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoutingException("Interrupted querying aggregate: " + aggregateId,
                    aggregateId, RoutingException.RESEQUENCER_UNAVAILABLE, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RoutingException routingException) {
                throw routingException;
            }
            throw new RoutingException("Failed querying aggregate: " + aggregateId,
                    aggregateId, RoutingException.RESEQUENCER_UNAVAILABLE, e.getCause());
        }
    }
}
