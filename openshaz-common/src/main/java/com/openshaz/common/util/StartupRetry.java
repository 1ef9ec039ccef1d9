package com.openshaz.common.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Fixed-count, fixed-backoff retry for connecting to infrastructure at startup
 * (broker, object storage). The last failure is rethrown so the process supervisor sees it.
 */
@Slf4j
public final class StartupRetry {

    /**
     * Sleeps between attempts; replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration backoff;
    private final Sleeper sleeper;

    public StartupRetry(int maxAttempts, Duration backoff) {
        this(maxAttempts, backoff, duration -> Thread.sleep(duration.toMillis()));
    }

    public StartupRetry(int maxAttempts, Duration backoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Runs {@code action} until it succeeds or {@code maxAttempts} are used up.
     *
     * @param resource name used in log lines, e.g. "RabbitMQ"
     * @return the action's result
     * @throws Exception the failure of the final attempt
     */
    public <T> T call(String resource, Callable<T> action) throws Exception {
        for (int attempt = 1; ; attempt++) {
            try {
                T result = action.call();
                log.info("Successfully connected to {}", resource);
                return result;
            } catch (Exception e) {
                log.warn("{} connection attempt {}/{} failed: {}", resource, attempt, maxAttempts, e.getMessage());
                if (attempt >= maxAttempts) {
                    log.error("Failed to connect to {} after {} attempts. Cannot continue.", resource, maxAttempts);
                    throw e;
                }
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBackoff() {
        return backoff;
    }
}
