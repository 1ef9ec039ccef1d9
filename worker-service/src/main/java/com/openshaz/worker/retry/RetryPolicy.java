package com.openshaz.worker.retry;

/**
 * How long a failed job waits before it is delivered again.
 */
public interface RetryPolicy {

    /**
     * Republish straight onto the work queue.
     */
    RetryPolicy IMMEDIATE = retryCount -> 0L;

    /**
     * @param retryCount the retry about to be scheduled (1-based)
     * @return delay in milliseconds, 0 for an immediate republish
     */
    long computeDelayMs(int retryCount);
}
