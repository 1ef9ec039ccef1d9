package com.openshaz.worker.dispatch;

import com.openshaz.common.config.RabbitMQConfig;
import com.openshaz.common.message.JobMessageCodec;
import com.openshaz.common.messaging.BrokerChannel;
import com.openshaz.common.messaging.BrokerSubscription;
import com.openshaz.common.messaging.Delivery;
import com.openshaz.common.messaging.MessageBroker;
import com.openshaz.common.messaging.QueueMessage;
import com.openshaz.worker.retry.JobState;
import com.openshaz.worker.retry.RetryDecision;
import com.openshaz.worker.retry.RetryGovernor;
import com.openshaz.worker.similarity.FeatureCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Consumes every work queue with prefetch 1 and routes each delivery to its handler.
 *
 * <p>Start-up order: preflight checks, broker connection, queue declarations, consumers. A
 * failure in any step aborts application start. On stop the consumers are cancelled and the
 * job in flight on each queue runs to completion.
 */
@Slf4j
public class WorkerDispatcher implements SmartLifecycle {

    public static final int PREFETCH_COUNT = 1;

    private final MessageBroker broker;
    private final RetryGovernor retryGovernor;
    private final JobMessageCodec codec;
    private final List<TaskHandler> handlers;
    private final FeatureCache featureCache;
    private final Runnable preflight;

    private final List<BrokerSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean running;

    public WorkerDispatcher(MessageBroker broker, RetryGovernor retryGovernor, JobMessageCodec codec,
            List<TaskHandler> handlers, FeatureCache featureCache, Runnable preflight) {
        Set<String> queues = new HashSet<>();
        for (TaskHandler handler : handlers) {
            if (!queues.add(handler.queueName())) {
                throw new IllegalArgumentException("More than one handler for queue " + handler.queueName());
            }
        }
        this.broker = broker;
        this.retryGovernor = retryGovernor;
        this.codec = codec;
        this.handlers = List.copyOf(handlers);
        this.featureCache = featureCache;
        this.preflight = preflight;
    }

    @Override
    public void start() {
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("STARTING WORKER DISPATCHER");
        preflight.run();
        broker.connect();

        for (TaskHandler handler : handlers) {
            String queue = handler.queueName();
            broker.declareQueue(queue, true);
            if (retryGovernor.usesDelayQueue()) {
                broker.declareDelayQueue(RabbitMQConfig.retryQueueName(queue), queue);
            }
            subscriptions.add(broker.consume(queue, PREFETCH_COUNT,
                    (delivery, channel) -> dispatch(handler, delivery, channel)));
            log.info("   Waiting for tasks on {}", queue);
        }
        running = true;
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
    }

    @Override
    public void stop() {
        log.info("Stopping worker dispatcher, letting in-flight jobs finish");
        running = false;
        for (BrokerSubscription subscription : subscriptions) {
            subscription.stop();
        }
        subscriptions.clear();
        log.info("Worker dispatcher stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Handle one delivery: reply and ack on success, hand the failure to the retry governor
     * otherwise.
     */
    JobState dispatch(TaskHandler handler, Delivery delivery, BrokerChannel channel) {
        QueueMessage message = delivery.message();
        HandlerContext context = new HandlerContext(featureCache, message.retryCount());
        try {
            Object result = handler.handle(message, context);
            if (message.hasReplyTo()) {
                channel.publish(MessageBroker.DEFAULT_EXCHANGE, message.replyTo(),
                        QueueMessage.reply(codec.write(result), message.correlationId()));
            }
            channel.ack(delivery.deliveryTag());
            return JobState.COMPLETED;
        } catch (Exception e) {
            log.error("Error processing task on {}: {}", handler.queueName(), e.getMessage(), e);
            RetryDecision decision = retryGovernor.onFailure(delivery, channel, e);
            return decision.nextState();
        }
    }

    public FeatureCache getFeatureCache() {
        return featureCache;
    }

    public List<String> getQueueNames() {
        return handlers.stream().map(TaskHandler::queueName).toList();
    }
}
