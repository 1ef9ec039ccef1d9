package com.openshaz.common.messaging;

/**
 * Operations bound to the channel a delivery arrived on. Acknowledgements must go
 * through the same channel that received the message.
 */
public interface BrokerChannel {

    /**
     * Publish to {@code exchange} ("" is the default exchange, routing by queue name).
     */
    void publish(String exchange, String routingKey, QueueMessage message);

    void ack(long deliveryTag);

    /**
     * @param requeue {@code false} drops the message, or dead-letters it when the queue has a DLX
     */
    void nack(long deliveryTag, boolean requeue);
}
