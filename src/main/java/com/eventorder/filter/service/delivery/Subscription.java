package com.eventorder.filter.service.delivery;

/**
 * Handle for a registered consumer.
 */
public interface Subscription {

    /**
     * Stops delivery to the consumer. Idempotent.
     */
    void cancel();

    boolean isActive();
}
