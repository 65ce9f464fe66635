package com.eventorder.filter.service.routing;

/**
 * Point-in-time view of one routing lane.
 */
public record LaneStatus(
        int index,
        int queueSize,
        int queueCapacity,
        int utilizationPercent,
        boolean running
) {
}
