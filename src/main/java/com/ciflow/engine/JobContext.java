package com.ciflow.engine;

import com.ciflow.artifact.ArtifactStore;
import com.ciflow.core.JobInstance;
import com.ciflow.core.JobStatus;
import com.ciflow.core.RunContext;
import com.ciflow.expr.EvaluationContext;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Execution environment handed to a {@link JobExecutor} for one job instance.
 *
 * <p>This class is the bridge between an executor and the scheduler. It provides:</p>
 * <ul>
 *   <li>The job instance, its matrix values and the run context</li>
 *   <li>Artifact upload and download through the run's {@link ArtifactStore}</li>
 *   <li>Cancellation checking via an atomic flag</li>
 *   <li>Job-scoped logging</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> The cancellation flag is an AtomicBoolean written by the scheduler's
 * coordinator thread and read by the worker thread.</p>
 *
 * <p><b>Usage Pattern:</b></p>
 * <pre>{@code
 * public ExecutionResult execute(JobContext context) throws Exception {
 *     context.log("INFO", "Building for " + context.getMatrixValues());
 *     for (String module : modules) {
 *         context.throwIfCancelled();
 *         compile(module);
 *     }
 *     context.putArtifact("dist", packageBytes());
 *     return ExecutionResult.success();
 * }
 * }</pre>
 */
public class JobContext {
    private static final Logger logger = Logger.getLogger(JobContext.class.getName());

    private final JobInstance instance;
    private final RunContext run;
    private final Map<String, String> env;
    private final Map<String, JobStatus> needs;
    private final ArtifactStore artifacts;
    private final AtomicBoolean cancelled;

    /**
     * @param instance  the job instance being executed
     * @param run       the run it belongs to
     * @param env       pipeline environment
     * @param needs     combined status of each needed template
     * @param artifacts the run's artifact store
     */
    public JobContext(JobInstance instance, RunContext run, Map<String, String> env,
                      Map<String, JobStatus> needs, ArtifactStore artifacts) {
        this.instance = instance;
        this.run = run;
        this.env = Map.copyOf(env);
        this.needs = Collections.unmodifiableMap(new LinkedHashMap<>(needs));
        this.artifacts = artifacts;
        this.cancelled = new AtomicBoolean(false);
    }

    /**
     * @return the instance id, e.g. {@code test[os=linux]}
     */
    public String getJobId() {
        return instance.getId();
    }

    public JobInstance getInstance() {
        return instance;
    }

    public RunContext getRun() {
        return run;
    }

    public Map<String, String> getMatrixValues() {
        return instance.getMatrixValues();
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public Map<String, JobStatus> getNeeds() {
        return needs;
    }

    /**
     * Build the context step conditions and command templates are evaluated against.
     *
     * @param stepFailed whether an earlier step of this job failed
     */
    public EvaluationContext evaluationContext(boolean stepFailed) {
        EvaluationContext.Builder builder = EvaluationContext.builder(run)
                .matrix(instance.getMatrixValues())
                .env(env)
                .upstreamFailed(stepFailed)
                .upstreamCancelled(cancelled.get())
                .allowSkippedNeeds(true);
        needs.forEach(builder::need);
        return builder.build();
    }

    // ==================== ARTIFACTS ====================

    /**
     * Upload an artifact. It becomes visible to other jobs once this job succeeds.
     *
     * @throws com.ciflow.core.DuplicateArtifactException if this job already uploaded the name
     */
    public void putArtifact(String name, byte[] payload) {
        artifacts.put(getJobId(), name, payload);
        log("INFO", "Uploaded artifact '" + name + "' (" + payload.length + " bytes)");
    }

    public void putArtifact(String name, String text) {
        putArtifact(name, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Download an artifact by name.
     *
     * @throws com.ciflow.core.ArtifactNotReadyException if its producer has not succeeded
     * @throws com.ciflow.core.ArtifactNotFoundException if no job produced it
     */
    public byte[] getArtifact(String name) {
        return artifacts.get(name);
    }

    public byte[] getArtifact(String producerJobId, String name) {
        return artifacts.get(producerJobId, name);
    }

    // ==================== LOGGING ====================

    /**
     * Forward a line of job output to the engine log, tagged with the run and job ids.
     *
     * @param level   INFO, WARN, ERROR or DEBUG
     * @param message the line
     */
    public void log(String level, String message) {
        Level julLevel = switch (level) {
            case "ERROR" -> Level.SEVERE;
            case "WARN" -> Level.WARNING;
            case "DEBUG" -> Level.FINE;
            default -> Level.INFO;
        };
        logger.log(julLevel, "[" + run.getRunId() + "/" + getJobId() + "] " + message);
    }

    // ==================== CANCELLATION ====================

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Mark this job as cancelled. The executor stops at its next
     * {@link #throwIfCancelled()} checkpoint or when its thread is interrupted.
     */
    public void cancel() {
        cancelled.set(true);
    }

    /**
     * @throws InterruptedException if the job has been cancelled
     */
    public void throwIfCancelled() throws InterruptedException {
        if (cancelled.get()) {
            throw new InterruptedException("Job " + getJobId() + " was cancelled");
        }
    }

    @Override
    public String toString() {
        return "JobContext{jobId='" + getJobId() + "', run=" + run.getRunId() + ", cancelled=" + cancelled.get() + '}';
    }
}
