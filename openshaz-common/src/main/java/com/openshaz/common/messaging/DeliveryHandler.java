package com.openshaz.common.messaging;

/**
 * Callback for a consumed message. Implementations own the outcome: every delivery
 * must end in an ack or a nack on {@code channel}.
 */
@FunctionalInterface
public interface DeliveryHandler {

    void handle(Delivery delivery, BrokerChannel channel);
}
