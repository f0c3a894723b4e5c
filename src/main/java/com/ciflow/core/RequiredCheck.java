package com.ciflow.core;

import java.util.Objects;

/**
 * A job whose outcome gates the pipeline result, e.g. the "Integration Test" job that funnels
 * every integration suite into one named check.
 */
public final class RequiredCheck {
    private final String jobId;
    private final boolean allowSkipped;

    /**
     * @param jobId        the template id of the gating job
     * @param allowSkipped whether a skipped outcome counts as passing
     */
    public RequiredCheck(String jobId, boolean allowSkipped) {
        this.jobId = jobId;
        this.allowSkipped = allowSkipped;
    }

    public static RequiredCheck of(String jobId) {
        return new RequiredCheck(jobId, false);
    }

    public String getJobId() {
        return jobId;
    }

    public boolean isAllowSkipped() {
        return allowSkipped;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RequiredCheck)) {
            return false;
        }
        RequiredCheck that = (RequiredCheck) o;
        return allowSkipped == that.allowSkipped && jobId.equals(that.jobId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, allowSkipped);
    }

    @Override
    public String toString() {
        return allowSkipped ? jobId + " (skip allowed)" : jobId;
    }
}
