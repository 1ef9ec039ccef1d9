package com.openshaz.common.messaging;

/**
 * Durable queue primitives the job protocol is built on.
 *
 * <p>All work queues are durable and every message published through this interface is
 * persistent. Consumers use manual acknowledgement; with {@code prefetchCount=1} a consumer
 * holds at most one unacknowledged message, which spreads work fairly across worker
 * replicas and serializes processing inside each one.
 */
public interface MessageBroker {

    /**
     * The nameless exchange: a message published to it is routed to the queue named by the routing key.
     */
    String DEFAULT_EXCHANGE = "";

    /**
     * Establishes the broker connection, retrying a bounded number of times.
     *
     * @throws com.openshaz.common.exception.BrokerUnavailableException when all attempts fail
     */
    void connect();

    /**
     * Idempotently declares a work queue.
     */
    void declareQueue(String name, boolean durable);

    /**
     * Declares a durable delay queue whose expired messages are routed back to {@code targetQueue}.
     */
    void declareDelayQueue(String name, String targetQueue);

    void publish(String exchange, String routingKey, QueueMessage message);

    BrokerSubscription consume(String queue, int prefetchCount, DeliveryHandler handler);

    BrokerSession openSession();
}
