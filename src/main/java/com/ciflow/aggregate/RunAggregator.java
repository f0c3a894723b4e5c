package com.ciflow.aggregate;

import com.ciflow.core.JobInstance;
import com.ciflow.core.JobStatus;
import com.ciflow.core.RequiredCheck;
import com.ciflow.engine.PipelineRun;
import com.ciflow.graph.JobGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Collapses the final status table of a run into one pipeline status.
 *
 * <p><b>Rules:</b></p>
 * <ul>
 *   <li>With a {@code required} list, each named job must have SUCCEEDED, or SKIPPED when the
 *       check allows it. A matrix template is judged on the combination of its instances.</li>
 *   <li>Without one, every job must have SUCCEEDED or been SKIPPED.</li>
 *   <li>A cancelled run is CANCELLED whatever its checks say.</li>
 * </ul>
 */
public class RunAggregator {
    private static final Logger logger = Logger.getLogger(RunAggregator.class.getName());

    /**
     * @param run a run whose jobs are all terminal
     * @return the aggregated result
     */
    public PipelineResult aggregate(PipelineRun run) {
        Map<String, JobStatus> statuses = run.getStatuses();
        Map<String, String> messages = new LinkedHashMap<>();
        for (String id : statuses.keySet()) {
            String message = run.getMessage(id);
            if (message != null) {
                messages.put(id, message);
            }
        }

        List<CheckResult> checks = evaluateChecks(run, statuses);
        List<CheckResult> failing = checks.stream().filter(check -> !check.isPassed()).collect(Collectors.toList());

        PipelineStatus status;
        String summary;
        if (run.isCancelled()) {
            status = PipelineStatus.CANCELLED;
            summary = run.getCancelReason();
        } else if (!failing.isEmpty()) {
            status = PipelineStatus.FAILURE;
            summary = failing.stream().map(CheckResult::toString).collect(Collectors.joining("; "));
        } else {
            status = PipelineStatus.SUCCESS;
            summary = null;
        }

        logger.info("Run " + run.getRunId() + " of " + run.getDefinition().getName() + " finished: " + status
                + (summary == null ? "" : " (" + summary + ")"));
        return new PipelineResult(run.getRunId(), run.getDefinition().getName(), status, statuses, messages,
                checks, summary);
    }

    /**
     * Single pass/fail signal for one required check.
     *
     * @throws IllegalArgumentException if the job is not part of the run
     */
    public CheckConclusion statusOf(PipelineRun run, String requiredJobId) {
        JobGraph graph = run.getGraph();
        if (graph == null || graph.instancesOf(requiredJobId).isEmpty()) {
            throw new IllegalArgumentException("Run " + run.getRunId() + " has no job '" + requiredJobId + "'");
        }
        boolean allowSkipped = run.getDefinition().getRequired().stream()
                .anyMatch(check -> check.getJobId().equals(requiredJobId) && check.isAllowSkipped());
        return evaluate(run, run.getStatuses(), requiredJobId, allowSkipped).getConclusion();
    }

    private List<CheckResult> evaluateChecks(PipelineRun run, Map<String, JobStatus> statuses) {
        List<CheckResult> checks = new ArrayList<>();
        List<RequiredCheck> required = run.getDefinition().getRequired();
        if (!required.isEmpty()) {
            for (RequiredCheck check : required) {
                checks.add(evaluate(run, statuses, check.getJobId(), check.isAllowSkipped()));
            }
        } else if (run.getGraph() != null) {
            for (String templateId : run.getGraph().getTemplateIds()) {
                checks.add(evaluate(run, statuses, templateId, true));
            }
        }
        return checks;
    }

    private CheckResult evaluate(PipelineRun run, Map<String, JobStatus> statuses, String jobId, boolean allowSkipped) {
        JobGraph graph = run.getGraph();
        JobStatus status = graph == null ? JobStatus.PENDING : graph.statusOfTemplate(jobId, statuses);

        if (status == JobStatus.SUCCEEDED || (status == JobStatus.SKIPPED && allowSkipped)) {
            return new CheckResult(jobId, status, CheckConclusion.PASS, null);
        }
        return new CheckResult(jobId, status, CheckConclusion.FAIL, reason(run, statuses, jobId, status));
    }

    /**
     * Explain a failing check with the message of the first instance carrying the failing status.
     */
    private String reason(PipelineRun run, Map<String, JobStatus> statuses, String jobId, JobStatus status) {
        String reason = status.getResultName();
        JobGraph graph = run.getGraph();
        if (graph == null) {
            return reason;
        }
        for (JobInstance instance : graph.instancesOf(jobId)) {
            if (statuses.get(instance.getId()) == status) {
                String message = run.getMessage(instance.getId());
                if (message != null) {
                    String prefix = instance.isMatrixInstance() && !instance.getId().equals(jobId)
                            ? instance.getId() + ": " : "";
                    return reason + " - " + prefix + message;
                }
            }
        }
        return reason;
    }
}
