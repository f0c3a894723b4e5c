package com.ciflow.graph;

import com.ciflow.core.CycleException;
import com.ciflow.core.DefinitionException;
import com.ciflow.core.JobInstance;
import com.ciflow.core.JobStatus;
import com.ciflow.core.JobTemplate;
import com.ciflow.core.RunContext;
import com.ciflow.expr.EvaluationContext;
import com.ciflow.expr.Expression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The {@code needs} graph of one run's job instances.
 *
 * <p>Dependencies are declared between templates; an instance depends on every instance of
 * every template its own template needs. The graph is immutable after construction.</p>
 *
 * <p><b>Readiness rules</b> ({@link #ready}):</p>
 * <ul>
 *   <li>A pending job is evaluated only when all of its dependency instances are terminal.</li>
 *   <li>If its condition calls a status function ({@code always()}, {@code failure()}, ...), the
 *       condition alone decides between run and skip.</li>
 *   <li>Otherwise a failed or cancelled dependency, or a dependency skipped because of one,
 *       skips the job ({@link SkipCause#DEPENDENCY_FAILED}); a dependency skipped by its own
 *       condition skips the job ({@link SkipCause#DEPENDENCY_SKIPPED}) unless the job allows
 *       skipped needs; then the condition, if any, is evaluated.</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Immutable; {@code ready} is a pure function of its arguments.</p>
 */
public class JobGraph {
    private final Map<String, JobInstance> instances;
    private final Map<String, List<JobInstance>> byTemplate;
    private final Map<String, String> env;

    /**
     * @param instances every instance of the run, in definition order
     * @param env       pipeline environment visible as {@code env.*}
     */
    public JobGraph(List<JobInstance> instances, Map<String, String> env) {
        this.instances = new LinkedHashMap<>();
        this.byTemplate = new LinkedHashMap<>();
        for (JobInstance instance : instances) {
            this.instances.put(instance.getId(), instance);
            this.byTemplate.computeIfAbsent(instance.getTemplateId(), k -> new ArrayList<>()).add(instance);
        }
        this.env = Map.copyOf(env);
    }

    /**
     * Validate that every {@code needs} reference exists and that the relation is acyclic.
     *
     * @param templates templates keyed by id
     * @return template ids in a topological order (dependencies first)
     * @throws DefinitionException on a dangling reference
     * @throws CycleException      naming the cycle when the graph is not a DAG
     */
    public static List<String> validate(Map<String, JobTemplate> templates) {
        for (JobTemplate template : templates.values()) {
            for (String need : template.getNeeds()) {
                if (!templates.containsKey(need)) {
                    throw new DefinitionException("Job '" + template.getId()
                            + "' needs unknown job '" + need + "'");
                }
            }
        }

        // DFS with three colours; a grey node reached again closes a cycle
        Map<String, Integer> colour = new HashMap<>();
        List<String> order = new ArrayList<>();
        Deque<String> path = new ArrayDeque<>();
        for (String id : templates.keySet()) {
            visit(id, templates, colour, path, order);
        }
        return order;
    }

    private static void visit(String id, Map<String, JobTemplate> templates, Map<String, Integer> colour,
                              Deque<String> path, List<String> order) {
        int state = colour.getOrDefault(id, 0);
        if (state == 2) {
            return;
        }
        if (state == 1) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String step : (Iterable<String>) path::descendingIterator) {
                if (step.equals(id)) {
                    inCycle = true;
                }
                if (inCycle) {
                    cycle.add(step);
                }
            }
            cycle.add(id);
            throw new CycleException(cycle);
        }

        colour.put(id, 1);
        path.push(id);
        for (String need : templates.get(id).getNeeds()) {
            visit(need, templates, colour, path, order);
        }
        path.pop();
        colour.put(id, 2);
        order.add(id);
    }

    /**
     * Evaluate which pending jobs can leave PENDING.
     *
     * @param results status of every job that has left PENDING; absent ids are pending
     * @param run     the run context conditions are evaluated against
     * @return jobs to dispatch and jobs to skip
     */
    public Readiness ready(Map<String, JobStatus> results, RunContext run) {
        List<JobInstance> runnable = new ArrayList<>();
        Map<JobInstance, SkipCause> skipped = new LinkedHashMap<>();

        for (JobInstance instance : instances.values()) {
            JobStatus own = results.getOrDefault(instance.getId(), JobStatus.PENDING);
            if (own != JobStatus.PENDING || !dependenciesComplete(instance, results)) {
                continue;
            }
            SkipCause cause = decide(instance, results, run);
            if (cause == null) {
                runnable.add(instance);
            } else {
                skipped.put(instance, cause);
            }
        }
        return new Readiness(runnable, skipped);
    }

    private boolean dependenciesComplete(JobInstance instance, Map<String, JobStatus> results) {
        for (JobInstance dependency : dependenciesOf(instance)) {
            JobStatus status = results.get(dependency.getId());
            if (status == null || !status.isTerminal()) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return null to run the job, otherwise the reason to skip it
     */
    private SkipCause decide(JobInstance instance, Map<String, JobStatus> results, RunContext run) {
        JobTemplate template = instance.getTemplate();
        boolean upstreamFailed = hasUpstream(instance, results, JobStatus.FAILED);
        boolean upstreamCancelled = hasUpstream(instance, results, JobStatus.CANCELLED);

        EvaluationContext.Builder context = EvaluationContext.builder(run)
                .matrix(instance.getMatrixValues())
                .env(env)
                .upstreamFailed(upstreamFailed)
                .upstreamCancelled(upstreamCancelled)
                .allowSkippedNeeds(template.isAllowSkippedNeeds());
        boolean anySkipped = false;
        for (String need : template.getNeeds()) {
            JobStatus combined = statusOfTemplate(need, results);
            context.need(need, combined);
            anySkipped |= combined == JobStatus.SKIPPED;
        }
        EvaluationContext evaluation = context.build();

        Expression condition = template.getCondition();
        if (condition != null && condition.usesStatusFunction()) {
            if (condition.test(evaluation)) {
                return null;
            }
            return upstreamFailed || upstreamCancelled ? SkipCause.DEPENDENCY_FAILED : SkipCause.CONDITION;
        }

        if (upstreamFailed || upstreamCancelled) {
            return SkipCause.DEPENDENCY_FAILED;
        }
        if (anySkipped && !template.isAllowSkippedNeeds()) {
            return SkipCause.DEPENDENCY_SKIPPED;
        }
        if (condition != null && !condition.test(evaluation)) {
            return SkipCause.CONDITION;
        }
        return null;
    }

    /**
     * Whether a dependency has the given status, or was skipped because one of its own
     * dependencies had it. Propagation stops at jobs that actually ran.
     */
    private boolean hasUpstream(JobInstance instance, Map<String, JobStatus> results, JobStatus target) {
        for (JobInstance dependency : dependenciesOf(instance)) {
            JobStatus status = results.get(dependency.getId());
            if (status == target) {
                return true;
            }
            if (status == JobStatus.SKIPPED && hasUpstream(dependency, results, target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Combined status of every instance of a template.
     *
     * @see JobStatus#combine
     */
    public JobStatus statusOfTemplate(String templateId, Map<String, JobStatus> results) {
        List<JobStatus> statuses = new ArrayList<>();
        for (JobInstance instance : instancesOf(templateId)) {
            statuses.add(results.getOrDefault(instance.getId(), JobStatus.PENDING));
        }
        return JobStatus.combine(statuses);
    }

    public List<JobInstance> dependenciesOf(JobInstance instance) {
        List<JobInstance> dependencies = new ArrayList<>();
        for (String need : instance.getTemplate().getNeeds()) {
            dependencies.addAll(instancesOf(need));
        }
        return dependencies;
    }

    /**
     * Every instance that depends on the given one, directly or transitively.
     */
    public Set<JobInstance> dependentsOf(JobInstance instance) {
        Set<JobInstance> dependents = new LinkedHashSet<>();
        Deque<JobInstance> queue = new ArrayDeque<>();
        queue.add(instance);
        while (!queue.isEmpty()) {
            JobInstance current = queue.poll();
            for (JobInstance candidate : instances.values()) {
                if (candidate.getTemplate().getNeeds().contains(current.getTemplateId()) && dependents.add(candidate)) {
                    queue.add(candidate);
                }
            }
        }
        return dependents;
    }

    public List<JobInstance> instancesOf(String templateId) {
        return byTemplate.getOrDefault(templateId, Collections.emptyList());
    }

    public JobInstance get(String instanceId) {
        return instances.get(instanceId);
    }

    public List<JobInstance> getInstances() {
        return new ArrayList<>(instances.values());
    }

    public Set<String> getTemplateIds() {
        return Collections.unmodifiableSet(byTemplate.keySet());
    }

    public int size() {
        return instances.size();
    }
}
