package com.eventorder.filter.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for the Event Order Filter Service.
 *
 * Contains the service toggle and feature flags.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "eventorder")
public class FilterConfig {

    /**
     * Enable or disable event intake.
     */
    private boolean enabled = true;

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    @Getter
    @Setter
    public static class Features {

        /**
         * Check a per-key Bloom filter before probing the future buffer.
         */
        private boolean bloomPrefilterEnabled = true;
    }
}
