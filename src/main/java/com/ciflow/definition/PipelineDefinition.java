package com.ciflow.definition;

import com.ciflow.core.ConcurrencyGroup;
import com.ciflow.core.DefinitionException;
import com.ciflow.core.JobTemplate;
import com.ciflow.core.RequiredCheck;
import com.ciflow.core.RunContext;
import com.ciflow.graph.JobGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A validated pipeline: triggers, job templates, concurrency group and required checks.
 *
 * <p>Definitions are loaded once (see {@link PipelineLoader}) and are immutable thereafter;
 * every run of the pipeline shares the same definition. Construction validates the
 * {@code needs} graph, so an instance always describes a DAG.</p>
 */
public final class PipelineDefinition {
    private final String name;
    private final List<Trigger> triggers;
    private final Map<String, String> env;
    private final ConcurrencyGroup concurrency;
    private final Map<String, JobTemplate> jobs;
    private final List<RequiredCheck> required;
    private final List<String> topologicalOrder;

    private PipelineDefinition(Builder builder) {
        this.name = builder.name;
        this.triggers = List.copyOf(builder.triggers);
        this.env = Collections.unmodifiableMap(new LinkedHashMap<>(builder.env));
        this.concurrency = builder.concurrency;
        this.jobs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.jobs));
        this.required = List.copyOf(builder.required);
        this.topologicalOrder = List.copyOf(JobGraph.validate(this.jobs));
        validateRequired();
        validateInputs();
    }

    private void validateRequired() {
        for (RequiredCheck check : required) {
            if (!jobs.containsKey(check.getJobId())) {
                throw new DefinitionException("Required check '" + check.getJobId() + "' is not a job of pipeline " + name);
            }
        }
    }

    /**
     * Every consumed artifact must be declared as an output of a job the consumer needs,
     * directly or transitively, so it can only be read after its producer succeeded.
     */
    private void validateInputs() {
        for (JobTemplate job : jobs.values()) {
            if (job.getInputs().isEmpty()) {
                continue;
            }
            Set<String> upstreamOutputs = new HashSet<>();
            Deque<String> queue = new ArrayDeque<>(job.getNeeds());
            Set<String> visited = new HashSet<>();
            while (!queue.isEmpty()) {
                String id = queue.poll();
                if (visited.add(id)) {
                    JobTemplate upstream = jobs.get(id);
                    upstreamOutputs.addAll(upstream.getOutputs());
                    queue.addAll(upstream.getNeeds());
                }
            }
            for (String input : job.getInputs()) {
                if (!upstreamOutputs.contains(input)) {
                    throw new DefinitionException("Job '" + job.getId() + "' consumes artifact '" + input
                            + "' but no job it needs produces it");
                }
            }
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * @return true when any trigger matches, or when the pipeline declares none
     */
    public boolean isTriggeredBy(RunContext context) {
        return triggers.isEmpty() || triggers.stream().anyMatch(trigger -> trigger.matches(context));
    }

    public String getName() {
        return name;
    }

    public List<Trigger> getTriggers() {
        return triggers;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    /**
     * @return the concurrency group, or null when runs never preempt each other
     */
    public ConcurrencyGroup getConcurrency() {
        return concurrency;
    }

    public Map<String, JobTemplate> getJobs() {
        return jobs;
    }

    public JobTemplate getJob(String id) {
        return jobs.get(id);
    }

    public List<RequiredCheck> getRequired() {
        return required;
    }

    /**
     * @return template ids with every dependency before its dependents
     */
    public List<String> getTopologicalOrder() {
        return topologicalOrder;
    }

    @Override
    public String toString() {
        return "PipelineDefinition{" + name + ", jobs=" + jobs.keySet() + '}';
    }

    public static final class Builder {
        private final String name;
        private final List<Trigger> triggers = new ArrayList<>();
        private final Map<String, String> env = new LinkedHashMap<>();
        private ConcurrencyGroup concurrency;
        private final Map<String, JobTemplate> jobs = new LinkedHashMap<>();
        private final List<RequiredCheck> required = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder trigger(Trigger trigger) {
            triggers.add(trigger);
            return this;
        }

        public Builder env(String key, String value) {
            if (key == null || value == null) {
                throw new DefinitionException("Environment variable '" + key + "' of " + name + " has no value");
            }
            env.put(key, value);
            return this;
        }

        public Builder concurrency(ConcurrencyGroup concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder job(JobTemplate job) {
            jobs.put(job.getId(), job);
            return this;
        }

        public Builder required(RequiredCheck check) {
            required.add(check);
            return this;
        }

        public Builder required(String... jobIds) {
            for (String jobId : jobIds) {
                required.add(RequiredCheck.of(jobId));
            }
            return this;
        }

        /**
         * @throws DefinitionException on a dangling need, unknown required job or unproduced input
         * @throws com.ciflow.core.CycleException when the needs graph has a cycle
         */
        public PipelineDefinition build() {
            return new PipelineDefinition(this);
        }
    }
}
