package com.eventorder.filter.service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI document for the filter service.
 *
 * The description carries the effective routing and buffering settings so
 * clients can see how much backpressure headroom a deployment has.
 */
@Configuration
@RequiredArgsConstructor
public class OpenApiConfig {

    private final RoutingConfig routingConfig;
    private final ResequencerConfig resequencerConfig;

    @Value("${spring.application.name:event-order-filter-service}")
    private String applicationName;

    @Bean
    public OpenAPI eventOrderFilterOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Event Order Filter Service API")
                        .version("1.0.0")
                        .description(describeDeployment()))
                .tags(List.of(
                        new Tag().name("Event Intake")
                                .description("Submit events in any order; 429 when the aggregate's lane is full"),
                        new Tag().name("Aggregates")
                                .description("Per-aggregate max accepted, min pending and duplicate counts"),
                        new Tag().name("Event Stream")
                                .description("Accepted events in per-aggregate version order, filtered by type")));
    }

    private String describeDeployment() {
        RoutingConfig.LaneConfig lanes = routingConfig.getLanes();
        return String.format(
                "%s re-emits each aggregate's events exactly once in version order. "
                        + "Routing lanes: %d x %d queued items, backpressure at %d%%. "
                        + "Future buffer warns above %d pending events per aggregate.",
                applicationName,
                lanes.getCount(),
                lanes.getQueueCapacity(),
                lanes.getBackpressureThreshold(),
                resequencerConfig.getPendingWarnThreshold());
    }
}
