package com.ciflow.core;

import java.util.Collection;

/**
 * Enum representing the states a job instance moves through during a pipeline run.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>PENDING → RUNNING: Job dispatched to a worker slot</li>
 *   <li>PENDING → SKIPPED: Condition false or a dependency did not succeed</li>
 *   <li>PENDING → CANCELLED: Run cancelled or preempted before the job started</li>
 *   <li>RUNNING → SUCCEEDED: Executor reported success</li>
 *   <li>RUNNING → FAILED: Executor reported failure, threw, or the job timed out</li>
 *   <li>RUNNING → CANCELLED: Run cancelled, preempted, or fail-fast sibling failure</li>
 * </ul>
 *
 * <p>Thread Safety: This enum is immutable and thread-safe.</p>
 *
 * @see #canTransitionTo(JobStatus)
 */
public enum JobStatus {
    PENDING("Pending", "pending"),
    RUNNING("Running", "running"),
    SUCCEEDED("Succeeded", "success"),
    FAILED("Failed", "failure"),
    SKIPPED("Skipped", "skipped"),
    CANCELLED("Cancelled", "cancelled");

    private final String displayName;
    private final String resultName;

    JobStatus(String displayName, String resultName) {
        this.displayName = displayName;
        this.resultName = resultName;
    }

    /**
     * Get the human-readable display name for this status.
     *
     * @return the display name (e.g., "Succeeded", "Failed")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Get the name condition expressions compare against, as in
     * {@code needs.build.result == 'success'}.
     *
     * @return the lower-case result name
     */
    public String getResultName() {
        return resultName;
    }

    /**
     * Check if this status represents a terminal state.
     * Terminal states are final - jobs cannot transition out of them.
     *
     * @return true for SUCCEEDED, FAILED, SKIPPED and CANCELLED
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }

    /**
     * Validate if a transition to a new status is legal.
     *
     * <p><b>Key Invariant:</b> Once a job reaches a terminal state it cannot transition to any
     * other state. A success reported by a worker after the scheduler cancelled the job is
     * therefore rejected here and the job stays CANCELLED.</p>
     *
     * @param newStatus the target status to transition to
     * @return true if the transition is allowed, false if it violates state machine rules
     */
    public boolean canTransitionTo(JobStatus newStatus) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case PENDING -> newStatus == RUNNING || newStatus == SKIPPED || newStatus == CANCELLED;
            case RUNNING -> newStatus == SUCCEEDED || newStatus == FAILED || newStatus == CANCELLED;
            default -> false;
        };
    }

    /**
     * Combine the statuses of the instances of one matrix expansion into the single result a
     * dependent or a required check sees.
     *
     * <p>Any FAILED instance wins, then any CANCELLED one. A still-running or pending instance
     * makes the whole expansion non-terminal. All SKIPPED gives SKIPPED; otherwise
     * SUCCEEDED.</p>
     *
     * @param statuses statuses of every instance, not empty
     * @return the combined status
     */
    public static JobStatus combine(Collection<JobStatus> statuses) {
        if (statuses.contains(FAILED)) {
            return FAILED;
        }
        if (statuses.contains(CANCELLED)) {
            return CANCELLED;
        }
        if (statuses.contains(RUNNING)) {
            return RUNNING;
        }
        if (statuses.isEmpty() || statuses.contains(PENDING)) {
            return PENDING;
        }
        if (statuses.stream().allMatch(status -> status == SKIPPED)) {
            return SKIPPED;
        }
        return SUCCEEDED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
