package com.ciflow.engine;

import com.ciflow.aggregate.PipelineResult;
import com.ciflow.artifact.ArtifactStore;
import com.ciflow.core.JobInstance;
import com.ciflow.core.JobStatus;
import com.ciflow.core.RunContext;
import com.ciflow.definition.PipelineDefinition;
import com.ciflow.graph.JobGraph;
import com.ciflow.graph.SkipCause;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * One execution of a pipeline: its job instances and the status table they move through.
 *
 * <p><b>Thread Safety:</b></p>
 * <ul>
 *   <li>Only the scheduler's coordinator thread mutates a run ({@link #transition} and the
 *       {@link JobRecord} fields).</li>
 *   <li>The status table is a ConcurrentHashMap so worker threads (artifact lookups) and the
 *       status server may read it at any time.</li>
 *   <li>The final result is published through {@link #getCompletion()}.</li>
 * </ul>
 */
public class PipelineRun {
    private final PipelineDefinition definition;
    private final RunContext context;
    private final CompletableFuture<PipelineResult> completion = new CompletableFuture<>();
    private final Map<String, JobStatus> statuses = new ConcurrentHashMap<>();
    private final Map<String, JobRecord> records = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Instant submittedAt = Instant.now();

    private volatile JobGraph graph;
    private volatile ArtifactStore artifacts;
    private volatile String groupKey;
    private volatile boolean admitted;
    private volatile boolean cancelled;
    private volatile String cancelReason;
    private volatile Instant finishedAt;

    PipelineRun(PipelineDefinition definition, RunContext context) {
        this.definition = definition;
        this.context = context;
    }

    void prepare(JobGraph graph, ArtifactStore artifacts) {
        this.graph = graph;
        this.artifacts = artifacts;
        for (JobInstance instance : graph.getInstances()) {
            records.put(instance.getId(), new JobRecord(instance));
            statuses.put(instance.getId(), JobStatus.PENDING);
        }
    }

    /**
     * Move a job to a new status if the state machine allows it.
     *
     * @return false when the job is already terminal or the move is illegal
     */
    boolean transition(JobRecord record, JobStatus status, String message) {
        if (!record.status.canTransitionTo(status)) {
            return false;
        }
        force(record, status, message);
        return true;
    }

    /**
     * Set a status without the state machine check. Used for jobs that fail before they can be
     * dispatched, such as a matrix that cannot be expanded.
     */
    void force(JobRecord record, JobStatus status, String message) {
        record.status = status;
        record.message = message;
        Instant now = Instant.now();
        if (status == JobStatus.RUNNING) {
            record.startedAt = now;
        } else if (status.isTerminal()) {
            record.finishedAt = now;
        }
        statuses.put(record.instance.getId(), status);
    }

    boolean isComplete() {
        for (JobRecord record : records.values()) {
            if (!record.status.isTerminal()) {
                return false;
            }
        }
        return true;
    }

    void markCancelled(String reason) {
        this.cancelled = true;
        this.cancelReason = reason;
    }

    void markAdmitted() {
        this.admitted = true;
    }

    void setGroupKey(String groupKey) {
        this.groupKey = groupKey;
    }

    void finish(PipelineResult result) {
        this.finishedAt = Instant.now();
        completion.complete(result);
    }

    JobRecord record(String instanceId) {
        return records.get(instanceId);
    }

    // coordinator thread only
    Iterable<JobRecord> records() {
        return records.values();
    }

    public String getRunId() {
        return context.getRunId();
    }

    public PipelineDefinition getDefinition() {
        return definition;
    }

    public RunContext getContext() {
        return context;
    }

    /**
     * @return the instance graph, or null before the run has been prepared
     */
    public JobGraph getGraph() {
        return graph;
    }

    public ArtifactStore getArtifacts() {
        return artifacts;
    }

    public JobStatus getStatus(String instanceId) {
        return statuses.get(instanceId);
    }

    /**
     * @return a snapshot of every instance's status, in definition order
     */
    public Map<String, JobStatus> getStatuses() {
        Map<String, JobStatus> snapshot = new LinkedHashMap<>();
        JobGraph current = graph;
        if (current != null) {
            for (JobInstance instance : current.getInstances()) {
                snapshot.put(instance.getId(), statuses.get(instance.getId()));
            }
        }
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * @return why the job ended the way it did (failure message, skip cause, cancel reason), or null
     */
    public String getMessage(String instanceId) {
        JobRecord record = records.get(instanceId);
        return record == null ? null : record.message;
    }

    public SkipCause getSkipCause(String instanceId) {
        JobRecord record = records.get(instanceId);
        return record == null ? null : record.skipCause;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public boolean isAdmitted() {
        return admitted;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String getCancelReason() {
        return cancelReason;
    }

    public boolean isFinished() {
        return completion.isDone();
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    /**
     * @return completes with the aggregated result once every job is terminal
     */
    public CompletableFuture<PipelineResult> getCompletion() {
        return completion;
    }

    @Override
    public String toString() {
        return "PipelineRun{" + getRunId() + ", pipeline=" + definition.getName() + '}';
    }

    /**
     * Scheduler-side state of one job instance.
     */
    static final class JobRecord {
        final JobInstance instance;
        volatile JobStatus status = JobStatus.PENDING;
        volatile String message;
        volatile SkipCause skipCause;
        boolean queued;
        Instant startedAt;
        Instant finishedAt;
        JobContext context;
        Future<?> execution;
        ScheduledFuture<?> timeout;

        JobRecord(JobInstance instance) {
            this.instance = instance;
        }

        String id() {
            return instance.getId();
        }
    }
}
