package com.eventorder.filter.service.routing;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Bounded queue drained by exactly one worker thread.
 *
 * Every key is hashed to one lane, so all work for a key runs sequentially in
 * arrival order while different lanes run in parallel. The queue provides
 * backpressure when a lane falls behind.
 */
@Slf4j
class RoutingLane {

    private final int index;
    private final int capacity;
    private final long pollTimeoutMs;
    private final BlockingQueue<RoutingWorkItem> queue;
    private final Consumer<RoutingWorkItem> handler;
    private final ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    RoutingLane(int index, int capacity, long pollTimeoutMs, Consumer<RoutingWorkItem> handler) {
        this.index = index;
        this.capacity = capacity;
        this.pollTimeoutMs = pollTimeoutMs;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.handler = handler;
        this.executorService = Executors.newSingleThreadExecutor(this::createLaneThread);
    }

    // ==================== Lifecycle ====================

    void start() {
        running.set(true);
        executorService.submit(this::processLoop);
        log.debug("Routing lane {} started with capacity {}", index, capacity);
    }

    /**
     * Stops taking new work, processes what is already queued, then stops the worker.
     */
    void stop(long timeoutSeconds) {
        running.set(false);
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Forcing shutdown of routing lane {} with {} items queued", index, queue.size());
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
        failStranded();
    }

    private Thread createLaneThread(Runnable runnable) {
        var thread = new Thread(runnable);
        thread.setName("routing-lane-" + index);
        thread.setDaemon(true);
        return thread;
    }

    // ==================== Queue ====================

    /**
     * Attempts to enqueue a work item with timeout.
     *
     * @return true if enqueued, false if the lane stayed full
     */
    boolean enqueue(RoutingWorkItem item, long timeoutMs) {
        try {
            boolean offered = queue.offer(item, timeoutMs, TimeUnit.MILLISECONDS);
            if (!offered) {
                log.warn("Lane {} full, rejecting work item for aggregate: {}", index, item.getAggregateId());
            }
            return offered;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while enqueuing work item for aggregate: {}", item.getAggregateId(), e);
            return false;
        }
    }

    private Optional<RoutingWorkItem> dequeue() {
        try {
            return Optional.ofNullable(queue.poll(pollTimeoutMs, TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while dequeuing on lane {}", index);
            return Optional.empty();
        }
    }

    // ==================== Processing Loop ====================

    private void processLoop() {
        while ((running.get() || !queue.isEmpty()) && !Thread.currentThread().isInterrupted()) {
            dequeue().ifPresent(this::processWorkItem);
        }
        log.debug("Routing lane {} worker exited", index);
    }

    private void processWorkItem(RoutingWorkItem item) {
        if (log.isTraceEnabled()) {
            log.trace("Lane {} picked up work for aggregate {} after {} ms", index, item.getAggregateId(),
                    Duration.between(item.getCreatedAt(), Instant.now()).toMillis());
        }
        try {
            handler.accept(item);
        } catch (Exception e) {
            log.error("Unexpected error on lane {} for aggregate: {}", index, item.getAggregateId(), e);
        }
    }

    /**
     * Handles work left behind by a forced shutdown: queries fail so callers do
     * not wait out their timeout, inserts are reported as lost.
     */
    private void failStranded() {
        List<RoutingWorkItem> stranded = new ArrayList<>();
        queue.drainTo(stranded);
        int lostInserts = 0;
        for (RoutingWorkItem item : stranded) {
            if (item instanceof RoutingWorkItem.QueryWorkItem query) {
                query.reply().completeExceptionally(new RoutingException(
                        "Routing lane stopped", item.getAggregateId(), RoutingException.RESEQUENCER_UNAVAILABLE));
            } else if (item instanceof RoutingWorkItem.InsertWorkItem insert) {
                lostInserts++;
                log.error("Event lost on forced stop of lane {}: aggregateId={}, version={}",
                        index, insert.getAggregateId(), insert.event().version());
            }
        }
        if (!stranded.isEmpty()) {
            log.warn("Dropped {} work items ({} inserts) from stopped lane {}", stranded.size(), lostInserts, index);
        }
    }

    // ==================== Monitoring ====================

    int getIndex() {
        return index;
    }

    boolean isRunning() {
        return running.get();
    }

    int size() {
        return queue.size();
    }

    int getCapacity() {
        return capacity;
    }

    int getUtilizationPercent() {
        return capacity > 0 ? (size() * 100) / capacity : 0;
    }
}
