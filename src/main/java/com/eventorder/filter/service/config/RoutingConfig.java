package com.eventorder.filter.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the key router.
 *
 * Controls lane count, lane queue sizes, backpressure thresholds, and timeouts.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "eventorder.routing")
public class RoutingConfig {

    /**
     * Lane configuration.
     */
    private LaneConfig lanes = new LaneConfig();

    /**
     * Timeout settings.
     */
    private TimeoutConfig timeout = new TimeoutConfig();

    @Getter
    @Setter
    public static class LaneConfig {

        /**
         * Number of single-threaded lanes keys are hashed onto.
         */
        private int count = 4;

        /**
         * Maximum queued work items per lane (default: 10,000).
         */
        private int queueCapacity = 10000;

        /**
         * Lane utilization threshold for backpressure alerts (percentage).
         */
        private int backpressureThreshold = 80;
    }

    @Getter
    @Setter
    public static class TimeoutConfig {

        /**
         * Enqueue timeout in milliseconds.
         */
        private long enqueueMs = 5000;

        /**
         * Poll timeout in milliseconds.
         */
        private long pollMs = 100;

        /**
         * Internals query timeout in milliseconds.
         */
        private long queryMs = 5000;

        /**
         * Time allowed for lanes to drain on shutdown.
         */
        private long shutdownSeconds = 30;
    }
}
