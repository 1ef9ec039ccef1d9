package com.openshaz.worker.retry;

/**
 * Where a delivery ends up after one pass through the dispatcher.
 */
public enum JobState {
    COMPLETED, // handled, reply sent if requested, acked
    RETRY_SCHEDULED, // republished with a higher retry count, original acked
    DISCARDED // nacked without requeue, dead-lettered
}
