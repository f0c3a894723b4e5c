package com.ciflow.aggregate;

/**
 * Aggregate outcome of a pipeline run.
 */
public enum PipelineStatus {
    /** Every required check passed. */
    SUCCESS,
    /** At least one required check did not pass. */
    FAILURE,
    /** The run was cancelled explicitly or preempted by a newer run of its concurrency group. */
    CANCELLED,
    /** The run never started: the definition could not be loaded or validated. */
    ERROR;

    public String getResultName() {
        return name().toLowerCase();
    }
}
