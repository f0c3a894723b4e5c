package com.ciflow.expr;

import com.ciflow.core.JobStatus;
import com.ciflow.core.RunContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a condition expression may look at: the run's event metadata, the matrix
 * combination of the job being evaluated, pipeline environment variables, and the results of
 * the job's direct dependencies.
 *
 * <p>Instances are immutable and built per evaluation.</p>
 */
public final class EvaluationContext {
    private final RunContext run;
    private final Map<String, String> matrix;
    private final Map<String, String> env;
    private final Map<String, JobStatus> needs;
    private final boolean upstreamFailed;
    private final boolean upstreamCancelled;
    private final boolean allowSkippedNeeds;

    private EvaluationContext(Builder builder) {
        this.run = builder.run;
        this.matrix = Collections.unmodifiableMap(new LinkedHashMap<>(builder.matrix));
        this.env = Collections.unmodifiableMap(new LinkedHashMap<>(builder.env));
        this.needs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.needs));
        this.upstreamFailed = builder.upstreamFailed;
        this.upstreamCancelled = builder.upstreamCancelled;
        this.allowSkippedNeeds = builder.allowSkippedNeeds;
    }

    /**
     * Context with run metadata only, used for concurrency keys.
     */
    public static EvaluationContext of(RunContext run) {
        return builder(run).build();
    }

    public static Builder builder(RunContext run) {
        return new Builder(run);
    }

    /**
     * Resolve a dotted path.
     *
     * @param path e.g. {@code matrix.backend}, {@code needs.build.result}, {@code branch}
     * @return the value, or null when unknown
     */
    public Object lookup(String path) {
        if (path.startsWith("matrix.")) {
            return matrix.get(path.substring("matrix.".length()));
        }
        if (path.startsWith("env.")) {
            return env.get(path.substring("env.".length()));
        }
        if (path.startsWith("needs.") && path.endsWith(".result")) {
            String jobId = path.substring("needs.".length(), path.length() - ".result".length());
            JobStatus status = needs.get(jobId);
            return status == null ? null : status.getResultName();
        }
        return run.lookup(path);
    }

    /**
     * {@code success()}: no dependency failed or was cancelled, and no dependency was skipped
     * unless the job allows skipped dependencies.
     */
    public boolean success() {
        if (upstreamFailed || upstreamCancelled) {
            return false;
        }
        if (allowSkippedNeeds) {
            return true;
        }
        return needs.values().stream().noneMatch(status -> status == JobStatus.SKIPPED);
    }

    /**
     * {@code failure()}: some dependency failed, directly or through a skipped ancestor.
     */
    public boolean failure() {
        return upstreamFailed;
    }

    /**
     * {@code cancelled()}: some dependency was cancelled.
     */
    public boolean cancelled() {
        return upstreamCancelled;
    }

    public RunContext getRun() {
        return run;
    }

    public Map<String, String> getMatrix() {
        return matrix;
    }

    public Map<String, JobStatus> getNeeds() {
        return needs;
    }

    public static final class Builder {
        private final RunContext run;
        private Map<String, String> matrix = Map.of();
        private Map<String, String> env = Map.of();
        private final Map<String, JobStatus> needs = new LinkedHashMap<>();
        private boolean upstreamFailed;
        private boolean upstreamCancelled;
        private boolean allowSkippedNeeds;

        private Builder(RunContext run) {
            this.run = run;
        }

        public Builder matrix(Map<String, String> matrix) {
            this.matrix = matrix;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder need(String jobId, JobStatus status) {
            this.needs.put(jobId, status);
            return this;
        }

        public Builder upstreamFailed(boolean upstreamFailed) {
            this.upstreamFailed = upstreamFailed;
            return this;
        }

        public Builder upstreamCancelled(boolean upstreamCancelled) {
            this.upstreamCancelled = upstreamCancelled;
            return this;
        }

        public Builder allowSkippedNeeds(boolean allowSkippedNeeds) {
            this.allowSkippedNeeds = allowSkippedNeeds;
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(this);
        }
    }
}
