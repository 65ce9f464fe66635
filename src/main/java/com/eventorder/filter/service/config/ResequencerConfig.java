package com.eventorder.filter.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for per-aggregate resequencers.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "eventorder.resequencer")
public class ResequencerConfig {

    /**
     * Design capacity of each key's Bloom filter.
     */
    private int initialCapacity = 10240;

    /**
     * Bloom filter false-positive rate; null means 1/initialCapacity.
     */
    private Double errorRate;

    /**
     * Buffered future events per key before a warning is raised (0 = never).
     */
    private int pendingWarnThreshold = 1000;
}
