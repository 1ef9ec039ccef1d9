package com.openshaz.common.exception;

/**
 * The worker gave up on a job and answered the RPC caller with an error reply.
 */
public class JobFailedException extends RuntimeException {

    private final String jobId;

    public JobFailedException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
