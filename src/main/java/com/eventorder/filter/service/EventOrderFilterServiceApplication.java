package com.eventorder.filter.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Event Order Filter Service Application - Entry point for the Spring Boot application.
 *
 * Receives aggregate events in arbitrary order and releases them to subscribers
 * in strict per-aggregate version order:
 * - Duplicates are dropped and counted
 * - Events ahead of a gap are buffered until the gap closes
 * - Subscribers only see the event types they are interested in
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.eventorder.filter.service.config")
public class EventOrderFilterServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventOrderFilterServiceApplication.class, args);
    }
}
