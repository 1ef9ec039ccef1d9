package com.openshaz.common.message;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Reply sent to an RPC caller when the worker discards its job.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobFailure(
        String jobId,
        JobStatus status,
        String error,
        int retryCount
) {
    public static JobFailure of(String jobId, String error, int retryCount) {
        return new JobFailure(jobId, JobStatus.ERROR, error, retryCount);
    }
}
