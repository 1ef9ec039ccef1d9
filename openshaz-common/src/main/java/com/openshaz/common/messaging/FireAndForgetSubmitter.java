package com.openshaz.common.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.openshaz.common.message.JobMessageCodec;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes a job without a reply channel and returns at once. Completion is not reported
 * back through the broker.
 */
@Slf4j
public class FireAndForgetSubmitter {

    private final MessageBroker broker;
    private final JobMessageCodec codec;

    public FireAndForgetSubmitter(MessageBroker broker, JobMessageCodec codec) {
        this.broker = broker;
        this.codec = codec;
    }

    /**
     * @param payload job body; must carry a {@code job_id}
     * @return the job id of the queued job
     */
    public String submitAsync(String queueName, Object payload) {
        JsonNode tree = codec.toTree(payload);
        JsonNode jobId = tree.get("job_id");
        if (jobId == null || jobId.isNull() || jobId.asText().isBlank()) {
            throw new IllegalArgumentException("Job payload for " + queueName + " has no job_id");
        }

        broker.declareQueue(queueName, true);
        broker.publish(MessageBroker.DEFAULT_EXCHANGE, queueName, QueueMessage.of(codec.write(tree)));

        log.info("Queued job {} on {}", jobId.asText(), queueName);
        return jobId.asText();
    }
}
