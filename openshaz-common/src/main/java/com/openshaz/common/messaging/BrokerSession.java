package com.openshaz.common.messaging;

/**
 * A dedicated broker connection scoped to one caller, used by the RPC client.
 * Closing the session closes the connection, which also removes its exclusive reply queue.
 */
public interface BrokerSession extends BrokerChannel, AutoCloseable {

    /**
     * Declares a server-named, exclusive, auto-deleting queue private to this session.
     *
     * @return the generated queue name
     */
    String declareReplyQueue();

    /**
     * Starts a manual-ack consumer on {@code queue}; deliveries arrive on a broker thread.
     */
    void consume(String queue, DeliveryHandler handler);

    @Override
    void close();
}
