package com.eventorder.filter.service.resequencer;

import com.eventorder.filter.service.config.FilterConfig;
import com.eventorder.filter.service.config.MetricsConfig;
import com.eventorder.filter.service.config.ResequencerConfig;
import com.eventorder.filter.service.filter.BloomFilter;
import com.eventorder.filter.service.filter.MembershipFilter;
import com.eventorder.filter.service.model.SortableEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds a configured resequencer for a newly seen aggregate key.
 *
 * Construction errors from the Bloom filter parameters surface here, at the
 * moment the first event of a key is routed.
 */
@Slf4j
@Component
public class ResequencerFactory {

    private final FilterConfig filterConfig;
    private final ResequencerConfig resequencerConfig;
    private final ResequencerListener metricsListener;

    public ResequencerFactory(FilterConfig filterConfig,
                              ResequencerConfig resequencerConfig,
                              MetricsConfig metricsConfig) {
        this.filterConfig = filterConfig;
        this.resequencerConfig = resequencerConfig;
        this.metricsListener = new ResequencerListener() {
            @Override
            public void onDuplicate(String aggregateId, long version) {
                metricsConfig.getDuplicateEvents().increment();
            }

            @Override
            public void onFuture(String aggregateId, long version) {
                metricsConfig.getFutureEvents().increment();
            }

            @Override
            public void onPendingThresholdExceeded(String aggregateId, int pendingCount) {
                metricsConfig.getPendingThresholdExceeded().increment();
            }
        };

        log.info("ResequencerFactory initialized, initial capacity: {}, bloom pre-filter: {}, pending warn threshold: {}",
                resequencerConfig.getInitialCapacity(),
                filterConfig.getFeatures().isBloomPrefilterEnabled(),
                resequencerConfig.getPendingWarnThreshold());
    }

    /**
     * Creates the resequencer for a key.
     *
     * @param aggregateId the aggregate key
     * @return a fresh resequencer with empty book-keeping
     * @throws com.eventorder.filter.service.filter.FilterConstructionException if the filter parameters are invalid
     */
    public EventResequencer create(String aggregateId) {
        log.debug("Creating resequencer for aggregate: {}", aggregateId);
        return new EventResequencer(
                aggregateId,
                createFilter(),
                metricsListener,
                resequencerConfig.getPendingWarnThreshold()
        );
    }

    // TODO: re-create the filter once a key has buffered more than initialCapacity futures
    private MembershipFilter<SortableEvent> createFilter() {
        if (!filterConfig.getFeatures().isBloomPrefilterEnabled()) {
            return null;
        }
        int capacity = resequencerConfig.getInitialCapacity();
        Double errorRate = resequencerConfig.getErrorRate();
        if (errorRate == null) {
            return BloomFilter.create(SortableEvent.class, capacity, ResequencerFactory::hashSortable);
        }
        return BloomFilter.create(SortableEvent.class, capacity, errorRate, ResequencerFactory::hashSortable);
    }

    static int hashSortable(SortableEvent event) {
        return BloomFilter.hashString(event.aggregateId() + '#' + event.version());
    }
}
