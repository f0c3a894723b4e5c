package com.ciflow.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Event metadata of one triggered run.
 *
 * <p>A RunContext is an immutable value created per trigger and passed explicitly into every
 * evaluation (conditions, concurrency keys, display names). There is no process-wide
 * "current run".</p>
 *
 * <p><b>Expression paths:</b></p>
 * <ul>
 *   <li>{@code run_id}, {@code pipeline}, {@code trigger}, {@code ref}, {@code branch},
 *       {@code head_ref}, {@code actor}</li>
 *   <li>{@code vars.<name>}: free-form variables supplied by the triggering actor</li>
 * </ul>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * RunContext ctx = RunContext.builder()
 *         .trigger("pull_request")
 *         .branch("feature/x")
 *         .headRef("feature/x")
 *         .changedPaths(List.of("crates/l2/prover/src/lib.rs"))
 *         .build();
 * }</pre>
 */
public final class RunContext {
    private final String runId;
    private final String pipeline;
    private final String trigger;
    private final String ref;
    private final String branch;
    private final String headRef;
    private final String actor;
    private final List<String> changedPaths;
    private final Map<String, String> vars;

    private RunContext(Builder builder) {
        this.runId = builder.runId != null ? builder.runId : UUID.randomUUID().toString();
        this.pipeline = builder.pipeline;
        this.trigger = builder.trigger;
        this.ref = builder.ref != null ? builder.ref
                : (builder.branch != null ? "refs/heads/" + builder.branch : null);
        this.branch = builder.branch;
        this.headRef = builder.headRef;
        this.actor = builder.actor;
        this.changedPaths = Collections.unmodifiableList(new ArrayList<>(builder.changedPaths));
        this.vars = Collections.unmodifiableMap(new LinkedHashMap<>(builder.vars));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy this context with a different pipeline name. Used by the scheduler so that
     * expressions referencing {@code pipeline} see the definition actually being run.
     *
     * @param pipelineName the pipeline name
     * @return a new context, or this one if the name is unchanged
     */
    public RunContext withPipeline(String pipelineName) {
        if (pipelineName == null || pipelineName.equals(pipeline)) {
            return this;
        }
        return toBuilder().pipeline(pipelineName).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .runId(runId)
                .pipeline(pipeline)
                .trigger(trigger)
                .ref(ref)
                .branch(branch)
                .headRef(headRef)
                .actor(actor)
                .changedPaths(changedPaths);
        vars.forEach(builder::var);
        return builder;
    }

    /**
     * Resolve a dotted path against this context.
     *
     * @param path e.g. {@code trigger} or {@code vars.release}
     * @return the value, or null when the path is unknown or unset
     */
    public String lookup(String path) {
        if (path.startsWith("vars.")) {
            return vars.get(path.substring("vars.".length()));
        }
        return switch (path) {
            case "run_id" -> runId;
            case "pipeline" -> pipeline;
            case "trigger" -> trigger;
            case "ref" -> ref;
            case "branch" -> branch;
            case "head_ref" -> headRef;
            case "actor" -> actor;
            default -> null;
        };
    }

    public String getRunId() {
        return runId;
    }

    public String getPipeline() {
        return pipeline;
    }

    public String getTrigger() {
        return trigger;
    }

    public String getRef() {
        return ref;
    }

    public String getBranch() {
        return branch;
    }

    public String getHeadRef() {
        return headRef;
    }

    public String getActor() {
        return actor;
    }

    public List<String> getChangedPaths() {
        return changedPaths;
    }

    public Map<String, String> getVars() {
        return vars;
    }

    @Override
    public String toString() {
        return "RunContext{" +
                "runId='" + runId + '\'' +
                ", trigger='" + trigger + '\'' +
                ", branch='" + branch + '\'' +
                '}';
    }

    public static final class Builder {
        private String runId;
        private String pipeline;
        private String trigger;
        private String ref;
        private String branch;
        private String headRef;
        private String actor;
        private final List<String> changedPaths = new ArrayList<>();
        private final Map<String, String> vars = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder pipeline(String pipeline) {
            this.pipeline = pipeline;
            return this;
        }

        public Builder trigger(String trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder ref(String ref) {
            this.ref = ref;
            return this;
        }

        public Builder branch(String branch) {
            this.branch = branch;
            return this;
        }

        public Builder headRef(String headRef) {
            this.headRef = headRef;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder changedPaths(List<String> paths) {
            this.changedPaths.clear();
            this.changedPaths.addAll(paths);
            return this;
        }

        public Builder var(String name, String value) {
            this.vars.put(name, value);
            return this;
        }

        public RunContext build() {
            return new RunContext(this);
        }
    }
}
