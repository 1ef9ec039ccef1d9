package com.openshaz.common.messaging;

/**
 * A message handed to a consumer by the broker, with the tag needed to ack or nack it.
 */
public record Delivery(
        long deliveryTag,
        String routingKey,
        QueueMessage message
) {
}
