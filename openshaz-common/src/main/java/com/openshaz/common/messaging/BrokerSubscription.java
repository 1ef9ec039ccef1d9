package com.openshaz.common.messaging;

/**
 * Handle on a running consumer.
 */
public interface BrokerSubscription {

    String queueName();

    boolean isActive();

    /**
     * Stops accepting deliveries and waits for the in-flight handler to finish.
     */
    void stop();
}
