package com.openshaz.worker.retry;

import com.fasterxml.jackson.databind.JsonNode;
import com.openshaz.common.config.RabbitMQConfig;
import com.openshaz.common.exception.JobValidationException;
import com.openshaz.common.message.JobFailure;
import com.openshaz.common.message.JobMessageCodec;
import com.openshaz.common.messaging.BrokerChannel;
import com.openshaz.common.messaging.Delivery;
import com.openshaz.common.messaging.MessageBroker;
import com.openshaz.common.messaging.QueueMessage;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Decides what happens to a delivery whose handler threw.
 *
 * <p>Below the retry ceiling the job is republished with {@code x-retry-count + 1} (straight to
 * its work queue, or through the {@code <queue>.retry} delay queue when the policy asks for a
 * delay) and the original is acked. At the ceiling, or for a terminal failure, the delivery
 * is nacked without requeue so it dead-letters, and an RPC caller gets an error reply instead
 * of waiting out its timeout.
 */
@Slf4j
public class RetryGovernor {

    public static final int DEFAULT_MAX_RETRIES = 3;

    private static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    private final int maxRetries;
    private final RetryPolicy retryPolicy;
    private final boolean discardTerminalErrors;
    private final JobMessageCodec codec;

    public RetryGovernor(int maxRetries, RetryPolicy retryPolicy, boolean discardTerminalErrors,
            JobMessageCodec codec) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.retryPolicy = retryPolicy;
        this.discardTerminalErrors = discardTerminalErrors;
        this.codec = codec;
    }

    public RetryDecision onFailure(Delivery delivery, BrokerChannel channel, Throwable failure) {
        QueueMessage message = delivery.message();
        String queue = delivery.routingKey();
        int retryCount = message.retryCount();

        if (discardTerminalErrors && FailureClassifier.isTerminal(failure)) {
            return discard(delivery, channel, retryCount,
                    "Non-retryable error: " + failure.getMessage());
        }
        if (retryCount >= maxRetries) {
            return discard(delivery, channel, retryCount,
                    "Exceeded maximum retries (" + maxRetries + "): " + failure.getMessage());
        }

        int nextCount = retryCount + 1;
        long delayMs = retryPolicy.computeDelayMs(nextCount);
        QueueMessage retry = message.withRetryCount(nextCount);

        if (delayMs > 0) {
            channel.publish(MessageBroker.DEFAULT_EXCHANGE, RabbitMQConfig.retryQueueName(queue),
                    retry.withExpiration(delayMs));
        } else {
            channel.publish(MessageBroker.DEFAULT_EXCHANGE, queue, retry);
        }
        channel.ack(delivery.deliveryTag());

        log.warn("Requeuing job on {} (retry {}/{}, delay {} ms): {}",
                queue, nextCount, maxRetries, delayMs, failure.getMessage());
        return RetryDecision.requeued(nextCount, delayMs);
    }

    public boolean usesDelayQueue() {
        return retryPolicy != RetryPolicy.IMMEDIATE;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private RetryDecision discard(Delivery delivery, BrokerChannel channel, int retryCount, String reason) {
        QueueMessage message = delivery.message();
        log.error(CRITICAL, "Discarding job on {} after {} retries. {}", delivery.routingKey(), retryCount, reason);

        if (message.hasReplyTo()) {
            JobFailure failure = JobFailure.of(jobIdOf(message), reason, retryCount);
            channel.publish(MessageBroker.DEFAULT_EXCHANGE, message.replyTo(),
                    QueueMessage.reply(codec.write(failure), message.correlationId()));
        }
        channel.nack(delivery.deliveryTag(), false);
        return RetryDecision.discarded(retryCount, reason);
    }

    private String jobIdOf(QueueMessage message) {
        try {
            JsonNode jobId = codec.readTree(message.body()).get("job_id");
            return jobId == null || jobId.isNull() ? null : jobId.asText();
        } catch (JobValidationException e) {
            // body is not JSON; the reply still reaches the caller by correlation id
            return null;
        }
    }
}
