package com.eventorder.filter.service.api.health;

import com.eventorder.filter.service.config.RoutingConfig;
import com.eventorder.filter.service.routing.KeyRouter;
import com.eventorder.filter.service.routing.LaneStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for the routing lanes.
 *
 * DOWN when any lane has stopped or sits at or above the backpressure threshold.
 */
@Component("routingLanes")
@RequiredArgsConstructor
public class RoutingLaneHealthIndicator implements HealthIndicator {

    private final KeyRouter keyRouter;
    private final RoutingConfig config;

    @Override
    public Health health() {
        List<LaneStatus> lanes = keyRouter.laneStatuses();
        int threshold = config.getLanes().getBackpressureThreshold();

        int maxUtilization = lanes.stream().mapToInt(LaneStatus::utilizationPercent).max().orElse(0);
        boolean allRunning = lanes.stream().allMatch(LaneStatus::running);

        Health.Builder builder = allRunning && !lanes.isEmpty() && maxUtilization < threshold
                ? Health.up()
                : Health.down();

        return builder
                .withDetail("laneCount", lanes.size())
                .withDetail("queuedTotal", lanes.stream().mapToInt(LaneStatus::queueSize).sum())
                .withDetail("maxUtilizationPercent", maxUtilization)
                .withDetail("backpressureThreshold", threshold)
                .withDetail("knownAggregates", keyRouter.knownAggregateCount())
                .withDetail("completed", keyRouter.isCompleted())
                .withDetail("lanes", lanes)
                .build();
    }
}
