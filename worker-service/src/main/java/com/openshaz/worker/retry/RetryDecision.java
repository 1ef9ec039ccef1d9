package com.openshaz.worker.retry;

/**
 * What the {@link RetryGovernor} did with a failed delivery.
 *
 * @param retryCount count carried by the republished copy, or the final count when discarded
 * @param delayMs    delay-queue TTL used, 0 for an immediate republish or a discard
 * @param reason     why the job was discarded, null when it was requeued
 */
public record RetryDecision(
        Outcome outcome,
        int retryCount,
        long delayMs,
        String reason
) {

    public enum Outcome {
        REQUEUED,
        DISCARDED
    }

    public static RetryDecision requeued(int retryCount, long delayMs) {
        return new RetryDecision(Outcome.REQUEUED, retryCount, delayMs, null);
    }

    public static RetryDecision discarded(int retryCount, String reason) {
        return new RetryDecision(Outcome.DISCARDED, retryCount, 0L, reason);
    }

    public JobState nextState() {
        return outcome == Outcome.REQUEUED ? JobState.RETRY_SCHEDULED : JobState.DISCARDED;
    }
}
