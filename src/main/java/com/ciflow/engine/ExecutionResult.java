package com.ciflow.engine;

import com.ciflow.core.JobStatus;

/**
 * Outcome an executor reports for a job: SUCCEEDED or FAILED, with an optional message.
 */
public final class ExecutionResult {
    private static final ExecutionResult SUCCESS = new ExecutionResult(JobStatus.SUCCEEDED, null);

    private final JobStatus status;
    private final String message;

    private ExecutionResult(JobStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public static ExecutionResult success() {
        return SUCCESS;
    }

    public static ExecutionResult success(String message) {
        return new ExecutionResult(JobStatus.SUCCEEDED, message);
    }

    public static ExecutionResult failure(String message) {
        return new ExecutionResult(JobStatus.FAILED, message);
    }

    public JobStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == JobStatus.SUCCEEDED;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return message == null ? status.getDisplayName() : status.getDisplayName() + ": " + message;
    }
}
