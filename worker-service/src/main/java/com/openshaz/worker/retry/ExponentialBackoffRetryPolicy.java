package com.openshaz.worker.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter: {@code baseDelay * 2^(retry-1)}, capped at {@code maxDelay},
 * scaled by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay) {
        this(baseDelay.toMillis(), maxDelay.toMillis());
    }

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public long computeDelayMs(int retryCount) {
        if (retryCount <= 0) {
            return 0L;
        }
        long expDelay;
        if (retryCount >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (retryCount - 1);
            // cap before multiplying so the product cannot overflow
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        long withJitter = (long) (capped * jitter);
        // never 0, which would mean "no delay queue"
        return Math.min(maxDelayMs, Math.max(1L, withJitter));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
