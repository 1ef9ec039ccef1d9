package com.openshaz.common.messaging;

import com.openshaz.common.exception.BrokerUnavailableException;
import com.openshaz.common.exception.RpcTimeoutException;
import com.openshaz.common.message.JobMessageCodec;
import com.openshaz.common.message.JobResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Request/response over the broker: publish a job with a private reply queue and a fresh
 * correlation id, then wait for the matching reply until a wall-clock deadline.
 *
 * <p>Each call runs in its own {@link BrokerSession}, closed on every exit path. Every message
 * consumed from the reply queue is acknowledged; only the one carrying this call's correlation
 * id completes the call. Once the deadline passes the call fails with
 * {@link RpcTimeoutException}; the job itself may still run and its reply is then dropped
 * together with the reply queue.
 */
@Slf4j
public class RpcClient {

    private final MessageBroker broker;
    private final JobMessageCodec codec;

    public RpcClient(MessageBroker broker, JobMessageCodec codec) {
        this.broker = broker;
        this.codec = codec;
    }

    public JobResult call(String queueName, Object payload, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        byte[] body = codec.write(payload);
        broker.declareQueue(queueName, true);

        String correlationId = UUID.randomUUID().toString();
        CompletableFuture<QueueMessage> reply = new CompletableFuture<>();

        try (BrokerSession session = broker.openSession()) {
            String replyQueue = session.declareReplyQueue();
            session.consume(replyQueue, (delivery, channel) -> {
                channel.ack(delivery.deliveryTag());
                QueueMessage message = delivery.message();
                if (correlationId.equals(message.correlationId())) {
                    reply.complete(message);
                } else {
                    log.warn("Discarding reply on {} with foreign correlation id {}",
                            replyQueue, message.correlationId());
                }
            });

            session.publish(MessageBroker.DEFAULT_EXCHANGE, queueName,
                    QueueMessage.request(body, correlationId, replyQueue));
            log.debug("RPC request {} published to {} (reply to {})", correlationId, queueName, replyQueue);

            long remaining = Math.max(0L, deadline - System.nanoTime());
            QueueMessage message = reply.get(remaining, TimeUnit.NANOSECONDS);
            return JobResult.fromReply(codec.readTree(message.body()));

        } catch (TimeoutException e) {
            log.warn("RPC {} on {} timed out after {} ms", correlationId, queueName, timeout.toMillis());
            throw new RpcTimeoutException(queueName, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerUnavailableException("Interrupted while waiting for reply on " + queueName, e);
        } catch (ExecutionException e) {
            // the reply future is only ever completed normally
            throw new IllegalStateException("Unexpected reply failure on " + queueName, e.getCause());
        }
    }
}
