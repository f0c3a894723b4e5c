package com.ciflow.aggregate;

import com.ciflow.core.JobStatus;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final outcome of a pipeline run: the aggregate status, every job's status and the verdict of
 * each required check.
 *
 * <p>Immutable. Rendered as JSON with {@link #toJson()} for the status server and the logs.</p>
 */
public final class PipelineResult {
    private final String runId;
    private final String pipeline;
    private final PipelineStatus status;
    private final Map<String, JobStatus> jobs;
    private final Map<String, String> jobMessages;
    private final List<CheckResult> checks;
    private final String summary;
    private final Instant finishedAt;

    public PipelineResult(String runId, String pipeline, PipelineStatus status, Map<String, JobStatus> jobs,
                          Map<String, String> jobMessages, List<CheckResult> checks, String summary) {
        this.runId = runId;
        this.pipeline = pipeline;
        this.status = status;
        this.jobs = Collections.unmodifiableMap(new LinkedHashMap<>(jobs));
        this.jobMessages = Collections.unmodifiableMap(new LinkedHashMap<>(jobMessages));
        this.checks = List.copyOf(checks);
        this.summary = summary;
        this.finishedAt = Instant.now();
    }

    /**
     * Result of a run that could not start. The summary is the exception message, unchanged.
     */
    public static PipelineResult error(String runId, String pipeline, Exception cause) {
        String summary = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new PipelineResult(runId, pipeline, PipelineStatus.ERROR, Map.of(), Map.of(), List.of(), summary);
    }

    public String getRunId() {
        return runId;
    }

    public String getPipeline() {
        return pipeline;
    }

    public PipelineStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == PipelineStatus.SUCCESS;
    }

    /**
     * @return status of every job instance, in definition order
     */
    public Map<String, JobStatus> getJobs() {
        return jobs;
    }

    /**
     * @return status of one job instance, or null when the run has no such instance
     */
    public JobStatus statusOf(String instanceId) {
        return jobs.get(instanceId);
    }

    public String getMessage(String instanceId) {
        return jobMessages.get(instanceId);
    }

    public List<CheckResult> getChecks() {
        return checks;
    }

    /**
     * @return the named check, or null when it is not part of the result
     */
    public CheckResult getCheck(String name) {
        for (CheckResult check : checks) {
            if (check.getName().equals(name)) {
                return check;
            }
        }
        return null;
    }

    /**
     * @return for ERROR the load error verbatim, otherwise which checks failed and why (null on SUCCESS)
     */
    public String getSummary() {
        return summary;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("runId", runId);
        json.put("pipeline", pipeline == null ? JSONObject.NULL : pipeline);
        json.put("status", status.getResultName());
        json.put("summary", summary == null ? JSONObject.NULL : summary);
        json.put("finishedAt", finishedAt.toString());

        JSONObject jobsJson = new JSONObject();
        for (Map.Entry<String, JobStatus> entry : jobs.entrySet()) {
            JSONObject job = new JSONObject();
            job.put("result", entry.getValue().getResultName());
            String message = jobMessages.get(entry.getKey());
            if (message != null) {
                job.put("message", message);
            }
            jobsJson.put(entry.getKey(), job);
        }
        json.put("jobs", jobsJson);

        JSONArray checksJson = new JSONArray();
        for (CheckResult check : checks) {
            checksJson.put(checkJson(check));
        }
        json.put("checks", checksJson);
        return json;
    }

    static JSONObject checkJson(CheckResult check) {
        JSONObject json = new JSONObject();
        json.put("name", check.getName());
        json.put("result", check.getStatus().getResultName());
        json.put("conclusion", check.getConclusion().name().toLowerCase());
        if (check.getReason() != null) {
            json.put("reason", check.getReason());
        }
        return json;
    }

    @Override
    public String toString() {
        return "PipelineResult{" + runId + ", " + status + (summary == null ? "" : ", " + summary) + '}';
    }
}
