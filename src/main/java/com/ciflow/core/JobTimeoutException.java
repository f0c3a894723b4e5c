package com.ciflow.core;

import java.time.Duration;

/**
 * Raised when a job exceeds its maximum duration.
 *
 * <p>A timed-out job is FAILED, not CANCELLED: it did not complete its declared work.</p>
 */
public class JobTimeoutException extends PipelineException {

    private final String jobId;
    private final Duration timeout;

    public JobTimeoutException(String jobId, Duration timeout) {
        super("Job " + jobId + " exceeded its timeout of " + timeout.toMillis() + "ms");
        this.jobId = jobId;
        this.timeout = timeout;
    }

    public String getJobId() {
        return jobId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
