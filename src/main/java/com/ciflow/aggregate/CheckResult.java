package com.ciflow.aggregate;

import com.ciflow.core.JobStatus;

/**
 * Evaluation of one required check against the final status of its job.
 */
public final class CheckResult {
    private final String name;
    private final JobStatus status;
    private final CheckConclusion conclusion;
    private final String reason;

    public CheckResult(String name, JobStatus status, CheckConclusion conclusion, String reason) {
        this.name = name;
        this.status = status;
        this.conclusion = conclusion;
        this.reason = reason;
    }

    /**
     * @return the job id the check is named after
     */
    public String getName() {
        return name;
    }

    /**
     * @return the job's status, combined over its matrix instances
     */
    public JobStatus getStatus() {
        return status;
    }

    public CheckConclusion getConclusion() {
        return conclusion;
    }

    public boolean isPassed() {
        return conclusion == CheckConclusion.PASS;
    }

    /**
     * @return why the check failed, or null when it passed
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return name + ": " + conclusion + (reason == null ? "" : " (" + reason + ")");
    }
}
