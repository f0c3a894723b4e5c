package com.ciflow.core;

import com.ciflow.expr.Expression;
import com.ciflow.expr.Template;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A job as declared in a pipeline definition, before matrix expansion.
 *
 * <p>A template is immutable and shared by every run of its pipeline. Each run turns it into
 * one or more {@link JobInstance}s.</p>
 *
 * <p><b>Fields:</b></p>
 * <ul>
 *   <li>{@code needs}: ids of the templates that must be terminal before this job is evaluated</li>
 *   <li>{@code condition}: predicate over the run context and dependency results; null means
 *       "all dependencies succeeded"</li>
 *   <li>{@code outputs}/{@code inputs}: artifact names produced and consumed</li>
 *   <li>{@code allowSkippedNeeds}: run even if a dependency was skipped by its own condition</li>
 *   <li>{@code timeout}: maximum duration up to {@link #MAX_TIMEOUT}, null meaning the engine default</li>
 * </ul>
 */
public final class JobTemplate {
    public static final Duration MAX_TIMEOUT = Duration.ofDays(30);

    private final String id;
    private final Template name;
    private final List<String> needs;
    private final Expression condition;
    private final List<Step> steps;
    private final Set<String> outputs;
    private final Set<String> inputs;
    private final Matrix matrix;
    private final boolean allowSkippedNeeds;
    private final Duration timeout;

    private JobTemplate(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.needs = List.copyOf(builder.needs);
        this.condition = builder.condition;
        this.steps = List.copyOf(builder.steps);
        this.outputs = Collections.unmodifiableSet(new LinkedHashSet<>(builder.outputs));
        this.inputs = Collections.unmodifiableSet(new LinkedHashSet<>(builder.inputs));
        this.matrix = builder.matrix;
        this.allowSkippedNeeds = builder.allowSkippedNeeds;
        this.timeout = builder.timeout;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    /**
     * @return the display-name template, or null when the job has none
     */
    public Template getName() {
        return name;
    }

    public List<String> getNeeds() {
        return needs;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public Set<String> getOutputs() {
        return outputs;
    }

    public Set<String> getInputs() {
        return inputs;
    }

    public Matrix getMatrix() {
        return matrix;
    }

    public boolean hasMatrix() {
        return matrix != null;
    }

    public boolean isAllowSkippedNeeds() {
        return allowSkippedNeeds;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "JobTemplate{" + id + ", needs=" + needs + '}';
    }

    public static final class Builder {
        private final String id;
        private Template name;
        private final List<String> needs = new ArrayList<>();
        private Expression condition;
        private final List<Step> steps = new ArrayList<>();
        private final Set<String> outputs = new LinkedHashSet<>();
        private final Set<String> inputs = new LinkedHashSet<>();
        private Matrix matrix;
        private boolean allowSkippedNeeds;
        private Duration timeout;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(Template name) {
            this.name = name;
            return this;
        }

        public Builder needs(String... ids) {
            Collections.addAll(needs, ids);
            return this;
        }

        public Builder needs(List<String> ids) {
            needs.addAll(ids);
            return this;
        }

        public Builder condition(Expression condition) {
            this.condition = condition;
            return this;
        }

        public Builder step(Step step) {
            steps.add(step);
            return this;
        }

        public Builder output(String artifactName) {
            outputs.add(artifactName);
            return this;
        }

        public Builder input(String artifactName) {
            inputs.add(artifactName);
            return this;
        }

        public Builder matrix(Matrix matrix) {
            this.matrix = matrix;
            return this;
        }

        public Builder allowSkippedNeeds(boolean allowSkippedNeeds) {
            this.allowSkippedNeeds = allowSkippedNeeds;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && timeout.compareTo(MAX_TIMEOUT) > 0) {
                throw new DefinitionException("Timeout " + timeout + " of job '" + id + "' exceeds the limit of "
                        + MAX_TIMEOUT);
            }
            this.timeout = timeout;
            return this;
        }

        public JobTemplate build() {
            return new JobTemplate(this);
        }
    }
}
