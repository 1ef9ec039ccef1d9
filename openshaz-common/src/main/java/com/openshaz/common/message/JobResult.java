package com.openshaz.common.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.openshaz.common.exception.JobValidationException;

/**
 * Reply to an RPC job as seen by the caller. {@code payload} is the full reply document,
 * whose shape depends on the job type.
 */
public record JobResult(
        String jobId,
        JobStatus status,
        JsonNode payload
) {
    public static JobResult fromReply(JsonNode reply) {
        String jobId = reply.hasNonNull("job_id") ? reply.get("job_id").asText() : null;
        try {
            JobStatus status = JobStatus.fromWire(reply.path("status").asText(""));
            return new JobResult(jobId, status, reply);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("Reply for job " + jobId + " has no valid status", e);
        }
    }

    public boolean isError() {
        return status == JobStatus.ERROR;
    }

    public String errorMessage() {
        return payload.path("error").asText("Job failed");
    }
}
