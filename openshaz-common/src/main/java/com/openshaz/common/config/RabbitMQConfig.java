package com.openshaz.common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openshaz.common.message.JobMessageCodec;
import com.openshaz.common.messaging.FireAndForgetSubmitter;
import com.openshaz.common.messaging.MessageBroker;
import com.openshaz.common.messaging.RabbitMessageBroker;
import com.openshaz.common.messaging.RpcClient;
import com.openshaz.common.util.StartupRetry;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RabbitMQConfig {

    // Queue names
    public static final String AUDIO_EXTRACTION_QUEUE = "audio_extraction_tasks";
    public static final String AUDIO_SIMILARITY_QUEUE = "audio_similarity_tasks";

    // Suffix of the per-queue delay stage used for delayed retries
    public static final String RETRY_QUEUE_SUFFIX = ".retry";

    @Value("${openshaz.broker.connect-attempts:3}")
    private int connectAttempts;

    @Value("${openshaz.broker.connect-backoff:5s}")
    private Duration connectBackoff;

    @Value("${openshaz.broker.shutdown-timeout:30s}")
    private Duration shutdownTimeout;

    public static String retryQueueName(String workQueue) {
        return workQueue + RETRY_QUEUE_SUFFIX;
    }

    /**
     * JSON codec for job bodies and replies
     */
    @Bean
    public JobMessageCodec jobMessageCodec(ObjectMapper objectMapper) {
        return new JobMessageCodec(objectMapper);
    }

    /**
     * Broker abstraction over the Spring AMQP connection factory
     */
    @Bean
    public MessageBroker messageBroker(CachingConnectionFactory connectionFactory, AmqpAdmin amqpAdmin,
            RabbitTemplate rabbitTemplate) {
        return new RabbitMessageBroker(connectionFactory, amqpAdmin, rabbitTemplate,
                new StartupRetry(connectAttempts, connectBackoff), shutdownTimeout);
    }

    @Bean
    public RpcClient rpcClient(MessageBroker messageBroker, JobMessageCodec jobMessageCodec) {
        return new RpcClient(messageBroker, jobMessageCodec);
    }

    @Bean
    public FireAndForgetSubmitter fireAndForgetSubmitter(MessageBroker messageBroker, JobMessageCodec jobMessageCodec) {
        return new FireAndForgetSubmitter(messageBroker, jobMessageCodec);
    }
}
