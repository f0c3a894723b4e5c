package com.ciflow.graph;

import com.ciflow.core.JobInstance;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of one {@link JobGraph#ready} evaluation: pending jobs whose dependencies are all
 * terminal, split into those to dispatch and those to skip.
 */
public final class Readiness {
    private final List<JobInstance> runnable;
    private final Map<JobInstance, SkipCause> skipped;

    Readiness(List<JobInstance> runnable, Map<JobInstance, SkipCause> skipped) {
        this.runnable = Collections.unmodifiableList(runnable);
        this.skipped = Collections.unmodifiableMap(skipped);
    }

    /**
     * @return jobs whose condition holds, in definition order
     */
    public List<JobInstance> getRunnable() {
        return runnable;
    }

    /**
     * @return jobs that must transition directly to SKIPPED, with the cause
     */
    public Map<JobInstance, SkipCause> getSkipped() {
        return skipped;
    }

    public boolean isEmpty() {
        return runnable.isEmpty() && skipped.isEmpty();
    }
}
