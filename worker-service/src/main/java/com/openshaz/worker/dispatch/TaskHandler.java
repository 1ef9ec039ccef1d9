package com.openshaz.worker.dispatch;

import com.openshaz.common.exception.JobValidationException;
import com.openshaz.common.messaging.QueueMessage;

/**
 * Processes the jobs of one work queue. Whatever {@link #handle} returns is serialized as the
 * reply when the job carries a reply queue; anything thrown goes to the retry governor.
 */
public interface TaskHandler {

    String queueName();

    Object handle(QueueMessage message, HandlerContext context);

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new JobValidationException("Missing required field: " + field);
        }
        return value;
    }
}
