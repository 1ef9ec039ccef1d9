package com.openshaz.common.exception;

import java.time.Duration;

/**
 * An RPC call did not receive its correlated reply before the deadline.
 * The job may still be processed later; its reply is then left unconsumed.
 */
public class RpcTimeoutException extends RuntimeException {

    private final String queueName;
    private final Duration timeout;

    public RpcTimeoutException(String queueName, Duration timeout) {
        super("Timeout waiting for response on queue " + queueName + " after " + timeout.toMillis() + " ms");
        this.queueName = queueName;
        this.timeout = timeout;
    }

    public String getQueueName() {
        return queueName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
