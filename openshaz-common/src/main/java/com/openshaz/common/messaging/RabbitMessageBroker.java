package com.openshaz.common.messaging;

import com.openshaz.common.exception.BrokerUnavailableException;
import com.openshaz.common.util.StartupRetry;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.FanoutExchange;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link MessageBroker} on RabbitMQ through Spring AMQP.
 *
 * <p>Work queues are durable and dead-letter into {@link #DEAD_LETTER_EXCHANGE}. Consumers run
 * in a {@link SimpleMessageListenerContainer} with one consumer and manual acknowledgement.
 * RPC sessions open their own AMQP connection so that closing the session tears down the
 * exclusive reply queue with it.
 */
@Slf4j
public class RabbitMessageBroker implements MessageBroker {

    public static final String DEAD_LETTER_EXCHANGE = "openshaz.dlx";
    public static final String DEAD_LETTER_QUEUE = "audio_tasks.dead";

    private static final int PERSISTENT_DELIVERY_MODE = 2;

    private final CachingConnectionFactory connectionFactory;
    private final AmqpAdmin amqpAdmin;
    private final RabbitTemplate rabbitTemplate;
    private final StartupRetry startupRetry;
    private final Duration shutdownTimeout;
    private final AtomicBoolean deadLetterDeclared = new AtomicBoolean(false);

    public RabbitMessageBroker(CachingConnectionFactory connectionFactory, AmqpAdmin amqpAdmin,
            RabbitTemplate rabbitTemplate, StartupRetry startupRetry, Duration shutdownTimeout) {
        this.connectionFactory = connectionFactory;
        this.amqpAdmin = amqpAdmin;
        this.rabbitTemplate = rabbitTemplate;
        this.startupRetry = startupRetry;
        this.shutdownTimeout = shutdownTimeout;
    }

    @Override
    public void connect() {
        try {
            startupRetry.call("RabbitMQ", () -> {
                connectionFactory.createConnection().close();
                return Boolean.TRUE;
            });
        } catch (Exception e) {
            throw new BrokerUnavailableException("Failed to connect to RabbitMQ after "
                    + startupRetry.getMaxAttempts() + " attempts", e);
        }
    }

    @Override
    public void declareQueue(String name, boolean durable) {
        declareDeadLetterTopology();
        Queue queue = (durable ? QueueBuilder.durable(name) : QueueBuilder.nonDurable(name))
                .deadLetterExchange(DEAD_LETTER_EXCHANGE)
                .build();
        try {
            amqpAdmin.declareQueue(queue);
        } catch (AmqpException e) {
            throw new BrokerUnavailableException("Failed to declare queue " + name, e);
        }
    }

    @Override
    public void declareDelayQueue(String name, String targetQueue) {
        Queue queue = QueueBuilder.durable(name)
                .deadLetterExchange(DEFAULT_EXCHANGE)
                .deadLetterRoutingKey(targetQueue)
                .build();
        try {
            amqpAdmin.declareQueue(queue);
            log.info("Declared delay queue {} → {}", name, targetQueue);
        } catch (AmqpException e) {
            throw new BrokerUnavailableException("Failed to declare delay queue " + name, e);
        }
    }

    @Override
    public void publish(String exchange, String routingKey, QueueMessage message) {
        try {
            rabbitTemplate.send(exchange, routingKey, toAmqpMessage(message));
        } catch (AmqpException e) {
            throw new BrokerUnavailableException("Failed to publish to " + routingKey, e);
        }
    }

    @Override
    public BrokerSubscription consume(String queue, int prefetchCount, DeliveryHandler handler) {
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);
        container.setQueueNames(queue);
        container.setPrefetchCount(prefetchCount);
        container.setConcurrentConsumers(1);
        container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        container.setShutdownTimeout(shutdownTimeout.toMillis());
        container.setMessageListener((ChannelAwareMessageListener) (message, channel) ->
                handler.handle(toDelivery(message), new RabbitBrokerChannel(channel)));
        container.afterPropertiesSet();
        try {
            container.start();
        } catch (AmqpException e) {
            throw new BrokerUnavailableException("Failed to start consumer on " + queue, e);
        }
        log.info("Consuming {} with prefetch={}", queue, prefetchCount);
        return new ContainerSubscription(queue, container);
    }

    @Override
    public BrokerSession openSession() {
        try {
            Connection connection = connectionFactory.getRabbitConnectionFactory().newConnection("openshaz-rpc");
            return new RabbitBrokerSession(connection, connection.createChannel());
        } catch (IOException | TimeoutException e) {
            throw new BrokerUnavailableException("Failed to open RPC connection", e);
        }
    }

    private void declareDeadLetterTopology() {
        if (deadLetterDeclared.get()) {
            return;
        }
        try {
            FanoutExchange exchange = new FanoutExchange(DEAD_LETTER_EXCHANGE, true, false);
            Queue deadLetters = QueueBuilder.durable(DEAD_LETTER_QUEUE).build();
            Binding binding = BindingBuilder.bind(deadLetters).to(exchange);
            amqpAdmin.declareExchange(exchange);
            amqpAdmin.declareQueue(deadLetters);
            amqpAdmin.declareBinding(binding);
            deadLetterDeclared.set(true);
        } catch (AmqpException e) {
            throw new BrokerUnavailableException("Failed to declare dead-letter exchange " + DEAD_LETTER_EXCHANGE, e);
        }
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Conversions
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    static Message toAmqpMessage(QueueMessage message) {
        MessageProperties properties = new MessageProperties();
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        properties.setDeliveryMode(message.persistent()
                ? MessageDeliveryMode.PERSISTENT
                : MessageDeliveryMode.NON_PERSISTENT);
        if (message.correlationId() != null) {
            properties.setCorrelationId(message.correlationId());
        }
        if (message.replyTo() != null) {
            properties.setReplyTo(message.replyTo());
        }
        if (message.expirationMs() != null) {
            properties.setExpiration(String.valueOf(message.expirationMs()));
        }
        message.headers().forEach(properties::setHeader);
        return new Message(message.body(), properties);
    }

    static Delivery toDelivery(Message message) {
        MessageProperties properties = message.getMessageProperties();
        QueueMessage queueMessage = new QueueMessage(
                message.getBody(),
                properties.getCorrelationId(),
                properties.getReplyTo(),
                properties.getHeaders(),
                properties.getReceivedDeliveryMode() == MessageDeliveryMode.PERSISTENT,
                null);
        return new Delivery(properties.getDeliveryTag(), properties.getReceivedRoutingKey(), queueMessage);
    }

    static AMQP.BasicProperties toBasicProperties(QueueMessage message) {
        return new AMQP.BasicProperties.Builder()
                .contentType(MessageProperties.CONTENT_TYPE_JSON)
                .deliveryMode(message.persistent() ? PERSISTENT_DELIVERY_MODE : 1)
                .correlationId(message.correlationId())
                .replyTo(message.replyTo())
                .headers(message.headers().isEmpty() ? null : new HashMap<>(message.headers()))
                .expiration(message.expirationMs() == null ? null : String.valueOf(message.expirationMs()))
                .build();
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Channel, session and subscription adapters
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    static class RabbitBrokerChannel implements BrokerChannel {

        private final Channel channel;

        RabbitBrokerChannel(Channel channel) {
            this.channel = channel;
        }

        @Override
        public void publish(String exchange, String routingKey, QueueMessage message) {
            try {
                channel.basicPublish(exchange, routingKey, toBasicProperties(message), message.body());
            } catch (IOException e) {
                throw new BrokerUnavailableException("Failed to publish to " + routingKey, e);
            }
        }

        @Override
        public void ack(long deliveryTag) {
            try {
                channel.basicAck(deliveryTag, false);
            } catch (IOException e) {
                throw new BrokerUnavailableException("Failed to ack delivery " + deliveryTag, e);
            }
        }

        @Override
        public void nack(long deliveryTag, boolean requeue) {
            try {
                channel.basicNack(deliveryTag, false, requeue);
            } catch (IOException e) {
                throw new BrokerUnavailableException("Failed to nack delivery " + deliveryTag, e);
            }
        }
    }

    static class RabbitBrokerSession extends RabbitBrokerChannel implements BrokerSession {

        private final Connection connection;
        private final Channel channel;

        RabbitBrokerSession(Connection connection, Channel channel) {
            super(channel);
            this.connection = connection;
            this.channel = channel;
        }

        @Override
        public String declareReplyQueue() {
            try {
                return channel.queueDeclare("", false, true, true, null).getQueue();
            } catch (IOException e) {
                throw new BrokerUnavailableException("Failed to declare reply queue", e);
            }
        }

        @Override
        public void consume(String queue, DeliveryHandler handler) {
            BrokerChannel self = this;
            try {
                channel.basicConsume(queue, false, new DefaultConsumer(channel) {
                    @Override
                    public void handleDelivery(String consumerTag, Envelope envelope,
                            AMQP.BasicProperties properties, byte[] body) {
                        QueueMessage message = new QueueMessage(
                                body,
                                properties.getCorrelationId(),
                                properties.getReplyTo(),
                                properties.getHeaders(),
                                Integer.valueOf(PERSISTENT_DELIVERY_MODE).equals(properties.getDeliveryMode()),
                                null);
                        handler.handle(new Delivery(envelope.getDeliveryTag(), envelope.getRoutingKey(), message), self);
                    }
                });
            } catch (IOException e) {
                throw new BrokerUnavailableException("Failed to consume " + queue, e);
            }
        }

        @Override
        public void close() {
            if (!connection.isOpen()) {
                return;
            }
            try {
                connection.close();
            } catch (IOException e) {
                log.warn("Clean close of RPC connection failed, aborting it: {}", e.getMessage());
                connection.abort();
            }
        }
    }

    static class ContainerSubscription implements BrokerSubscription {

        private final String queueName;
        private final SimpleMessageListenerContainer container;

        ContainerSubscription(String queueName, SimpleMessageListenerContainer container) {
            this.queueName = queueName;
            this.container = container;
        }

        @Override
        public String queueName() {
            return queueName;
        }

        @Override
        public boolean isActive() {
            return container.isRunning();
        }

        @Override
        public void stop() {
            container.stop();
            container.destroy();
            log.info("Stopped consumer on {}", queueName);
        }
    }
}
