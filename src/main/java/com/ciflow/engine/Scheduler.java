package com.ciflow.engine;

import com.ciflow.aggregate.PipelineResult;
import com.ciflow.aggregate.RunAggregator;
import com.ciflow.artifact.ArtifactStore;
import com.ciflow.artifact.ArtifactTransport;
import com.ciflow.artifact.InMemoryArtifactTransport;
import com.ciflow.core.ConcurrencyGroup;
import com.ciflow.core.ExpansionException;
import com.ciflow.core.JobInstance;
import com.ciflow.core.JobStatus;
import com.ciflow.core.JobTemplate;
import com.ciflow.core.JobTimeoutException;
import com.ciflow.core.PipelineException;
import com.ciflow.core.RunContext;
import com.ciflow.definition.PipelineDefinition;
import com.ciflow.definition.PipelineLoader;
import com.ciflow.expr.EvaluationContext;
import com.ciflow.graph.JobGraph;
import com.ciflow.graph.Readiness;
import com.ciflow.graph.SkipCause;
import com.ciflow.matrix.MatrixExpander;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives pipeline runs: admits them, dispatches ready jobs to a fixed worker pool, applies
 * every status transition and hands finished runs to the aggregator.
 *
 * <p><b>Key Responsibilities:</b></p>
 * <ul>
 *   <li>Expand matrices and build each run's job graph</li>
 *   <li>Skip jobs whose conditions or dependencies rule them out</li>
 *   <li>Dispatch ready jobs while a worker slot is free</li>
 *   <li>Enforce per-job timeouts, matrix fail-fast and run cancellation</li>
 *   <li>Serialize runs of one concurrency group, cancelling or queueing the older run</li>
 *   <li>Aggregate, discard artifacts and notify when a run's jobs are all terminal</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b></p>
 * <ul>
 *   <li>A single coordinator thread (the one calling {@link #start()}) owns all run state and
 *       performs every transition, in the order events arrive on its queue.</li>
 *   <li>Workers, timers and API callers only post events.</li>
 *   <li>Status tables and results are published through concurrent maps for readers.</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Scheduler scheduler = new Scheduler(4, new ScriptedExecutor());
 * scheduler.startInBackground();
 *
 * PipelineRun run = scheduler.submit(definition, RunContext.builder().trigger("push").branch("main").build());
 * PipelineResult result = run.getCompletion().get();
 *
 * scheduler.shutdown();
 * }</pre>
 *
 * @see Worker
 * @see JobGraph#ready
 */
public class Scheduler {
    private static final Logger logger = Logger.getLogger(Scheduler.class.getName());

    public static final Duration DEFAULT_JOB_TIMEOUT = Duration.ofMinutes(360);
    private static final long POLL_INTERVAL_MS = 500;

    private final ExecutorService executorService;
    private final ScheduledExecutorService timer;
    private final BlockingQueue<SchedulerEvent> events = new LinkedBlockingQueue<>();
    private final JobExecutor executor;
    private final ArtifactTransport transport;
    private final RunNotifier notifier;
    private final RunAggregator aggregator = new RunAggregator();
    private final MatrixExpander expander = new MatrixExpander();
    private final PipelineLoader loader = new PipelineLoader();
    private final int workerCount;
    private final Duration defaultTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicInteger busyWorkers = new AtomicInteger();
    private final CountDownLatch stopped = new CountDownLatch(1);

    // Readable from any thread
    private final Map<String, PipelineRun> runs = new ConcurrentHashMap<>();
    private final Map<String, PipelineResult> results = new ConcurrentHashMap<>();

    // Coordinator thread only
    private final List<PipelineRun> activeRuns = new ArrayList<>();
    private final Map<String, PipelineRun> activeByGroup = new HashMap<>();
    private final Map<String, PipelineRun> waitingByGroup = new HashMap<>();
    private final Deque<ReadyJob> readyQueue = new ArrayDeque<>();

    /**
     * Create a scheduler with in-memory artifacts, the default job timeout and no notifier.
     *
     * @param workerCount number of jobs that may run at once
     * @param executor    runs each job
     */
    public Scheduler(int workerCount, JobExecutor executor) {
        this(workerCount, DEFAULT_JOB_TIMEOUT, executor, new InMemoryArtifactTransport(), result -> { });
    }

    /**
     * @param workerCount    number of jobs that may run at once
     * @param defaultTimeout limit for jobs that declare none; null or zero for no limit
     * @param executor       runs each job
     * @param transport      where artifact payloads are kept
     * @param notifier       told about every finished run
     * @throws IllegalArgumentException if workerCount < 1
     */
    public Scheduler(int workerCount, Duration defaultTimeout, JobExecutor executor, ArtifactTransport transport,
                     RunNotifier notifier) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, got " + workerCount);
        }
        this.workerCount = workerCount;
        this.defaultTimeout = defaultTimeout;
        this.executor = executor;
        this.transport = transport;
        this.notifier = notifier;
        this.executorService = Executors.newFixedThreadPool(workerCount);
        this.timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ciflow-timeouts");
            thread.setDaemon(true);
            return thread;
        });

        logger.info("Scheduler initialized with " + workerCount + " workers");
    }

    // ==================== LIFECYCLE ====================

    /**
     * Run the coordinator loop on the calling thread until {@link #shutdown()}.
     *
     * <p><b>BLOCKING METHOD:</b> call it from a dedicated thread, or use
     * {@link #startInBackground()}.</p>
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("Scheduler is already running");
            return;
        }
        logger.info("Scheduler started with " + workerCount + " workers");

        try {
            while (running.get()) {
                try {
                    SchedulerEvent event = events.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                    if (event != null) {
                        handle(event);
                    }
                } catch (InterruptedException e) {
                    logger.info("Scheduler interrupted, shutting down");
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    // UNEXPECTED ERROR: log and keep coordinating the other runs
                    logger.log(Level.SEVERE, "Unexpected error in scheduling loop", e);
                }
            }
        } finally {
            running.set(false);
            stopped.countDown();
            logger.info("Scheduler loop exited");
        }
    }

    /**
     * Start the coordinator loop on a new non-daemon thread.
     *
     * @return the coordinator thread
     */
    public Thread startInBackground() {
        Thread thread = new Thread(this::start, "ciflow-scheduler");
        thread.setDaemon(false);
        thread.start();
        return thread;
    }

    /**
     * Cancel every unfinished run, stop the coordinator and the worker pool.
     */
    public void shutdown() {
        if (!accepting.getAndSet(false)) {
            return;
        }
        logger.info("Initiating shutdown...");

        events.add(SchedulerEvent.shutdown());
        if (running.get()) {
            try {
                if (!stopped.await(10, TimeUnit.SECONDS)) {
                    logger.warning("Coordinator did not stop within 10 seconds");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warning("Forcing shutdown of remaining jobs");
                executorService.shutdownNow();
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.severe("Worker pool did not terminate after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        timer.shutdownNow();

        logger.info("Scheduler shutdown complete");
    }

    // ==================== API ====================

    /**
     * Submit a run without checking triggers.
     *
     * @param definition a validated pipeline
     * @param context    run metadata; its run id must be unique
     * @return the run handle; {@link PipelineRun#getCompletion()} completes with the result
     * @throws IllegalStateException    after shutdown
     * @throws IllegalArgumentException if the run id was already used
     */
    public PipelineRun submit(PipelineDefinition definition, RunContext context) {
        if (!accepting.get()) {
            throw new IllegalStateException("Scheduler is shut down");
        }
        PipelineRun run = new PipelineRun(definition, context.withPipeline(definition.getName()));
        if (runs.putIfAbsent(run.getRunId(), run) != null) {
            throw new IllegalArgumentException("Run id already used: " + run.getRunId());
        }
        events.add(SchedulerEvent.runSubmitted(run));
        logger.info("Run " + run.getRunId() + " of " + definition.getName() + " submitted (trigger: "
                + context.getTrigger() + ")");
        return run;
    }

    /**
     * Submit a run only when one of the pipeline's triggers matches the context.
     *
     * @return the run, or empty when no trigger matched
     */
    public Optional<PipelineRun> trigger(PipelineDefinition definition, RunContext context) {
        if (!definition.isTriggeredBy(context)) {
            logger.info("Pipeline " + definition.getName() + " not triggered by " + context.getTrigger()
                    + " on " + context.getBranch());
            return Optional.empty();
        }
        return Optional.of(submit(definition, context));
    }

    /**
     * Load a JSON pipeline document and submit it. A document that fails to load or validate
     * yields an ERROR result carrying the error message instead of an exception.
     *
     * @return completes with the run's result
     */
    public CompletableFuture<PipelineResult> submitDocument(String json, RunContext context) {
        PipelineDefinition definition;
        try {
            definition = loader.load(json);
        } catch (PipelineException e) {
            logger.warning("Run " + context.getRunId() + " rejected: " + e.getMessage());
            PipelineResult result = PipelineResult.error(context.getRunId(), context.getPipeline(), e);
            results.put(result.getRunId(), result);
            notifySafely(result);
            return CompletableFuture.completedFuture(result);
        }
        return submit(definition, context).getCompletion();
    }

    /**
     * Request cancellation of a run. Every non-terminal job becomes CANCELLED, including jobs
     * whose condition is {@code always()}.
     *
     * @return true if the run is known and not finished yet
     */
    public boolean cancelRun(String runId) {
        return cancelRun(runId, "Cancelled on request");
    }

    public boolean cancelRun(String runId, String reason) {
        PipelineRun run = runs.get(runId);
        if (run == null || run.isFinished()) {
            logger.warning("Could not cancel run " + runId + " (unknown or finished)");
            return false;
        }
        events.add(SchedulerEvent.cancelRun(runId, reason));
        return true;
    }

    public PipelineRun getRun(String runId) {
        return runs.get(runId);
    }

    /**
     * @return the result of a finished (or rejected) run, or null
     */
    public PipelineResult getResult(String runId) {
        return results.get(runId);
    }

    void post(SchedulerEvent event) {
        events.add(event);
    }

    // ==================== EVENT HANDLING ====================

    private void handle(SchedulerEvent event) {
        logger.finest("Handling " + event);
        switch (event.type) {
            case RUN_SUBMITTED -> onRunSubmitted(event.run);
            case JOB_FINISHED -> onJobFinished(event);
            case JOB_TIMED_OUT -> onJobTimedOut(event.run, event.record);
            case CANCEL_RUN -> onCancelRun(event.runId, event.message);
            case SHUTDOWN -> onShutdown();
            default -> throw new IllegalStateException("Unknown event " + event.type);
        }
    }

    private void onRunSubmitted(PipelineRun run) {
        try {
            prepare(run);
            ConcurrencyGroup group = run.getDefinition().getConcurrency();
            if (group != null) {
                run.setGroupKey(group.resolveKey(run.getContext()));
            }
        } catch (PipelineException e) {
            logger.warning("Run " + run.getRunId() + " could not start: " + e.getMessage());
            complete(run, PipelineResult.error(run.getRunId(), run.getDefinition().getName(), e));
            return;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Run " + run.getRunId() + " failed while preparing", e);
            complete(run, PipelineResult.error(run.getRunId(), run.getDefinition().getName(), e));
            return;
        }

        String key = run.getGroupKey();
        if (key == null) {
            admit(run);
            return;
        }

        PipelineRun active = activeByGroup.get(key);
        if (active != null && run.getDefinition().getConcurrency().isCancelInProgress()) {
            // PREEMPTION: the older run is finished before the newer one is admitted
            logger.info("Run " + run.getRunId() + " preempts run " + active.getRunId() + " in group " + key);
            cancel(active, "Superseded by run " + run.getRunId());
            active = activeByGroup.get(key);
        }

        if (active == null) {
            activeByGroup.put(key, run);
            admit(run);
        } else {
            PipelineRun previous = waitingByGroup.put(key, run);
            logger.info("Run " + run.getRunId() + " waits for run " + active.getRunId() + " in group " + key);
            if (previous != null) {
                cancel(previous, "Superseded by waiting run " + run.getRunId());
            }
        }
    }

    private void onJobFinished(SchedulerEvent event) {
        busyWorkers.decrementAndGet();
        PipelineRun run = event.run;
        PipelineRun.JobRecord record = event.record;
        if (record.timeout != null) {
            record.timeout.cancel(false);
        }

        if (run.transition(record, event.status, event.message)) {
            logger.info("Job " + record.id() + " of run " + run.getRunId() + " " + event.status);
            if (event.status == JobStatus.FAILED) {
                failFast(run, record);
            }
        } else {
            // CANCELLATION WINS: a late report for a job already terminal is dropped
            logger.fine("Ignoring " + event.status + " report for " + record.id() + ", already " + record.status);
        }
        pump();
    }

    private void onJobTimedOut(PipelineRun run, PipelineRun.JobRecord record) {
        if (record.status != JobStatus.RUNNING) {
            return;
        }
        JobTimeoutException timeout = new JobTimeoutException(record.id(), timeoutFor(record.instance.getTemplate()));
        run.transition(record, JobStatus.FAILED, timeout.getMessage());
        logger.warning(timeout.getMessage() + " (run " + run.getRunId() + ")");
        stop(record);
        failFast(run, record);
        pump();
    }

    private void onCancelRun(String runId, String reason) {
        PipelineRun run = runs.get(runId);
        if (run == null || run.isFinished() || run.getGraph() == null) {
            return;
        }
        cancel(run, reason);
        pump();
    }

    private void onShutdown() {
        // runs submitted but not yet picked up are prepared so they can be cancelled like the rest
        List<SchedulerEvent> pending = new ArrayList<>();
        events.drainTo(pending);
        for (SchedulerEvent event : pending) {
            if (event.type == SchedulerEvent.Type.RUN_SUBMITTED) {
                try {
                    prepare(event.run);
                } catch (RuntimeException e) {
                    complete(event.run, PipelineResult.error(event.run.getRunId(),
                            event.run.getDefinition().getName(), e));
                }
            }
        }
        for (PipelineRun run : new ArrayList<>(runs.values())) {
            if (!run.isFinished() && run.getGraph() != null) {
                cancel(run, "Scheduler shutting down");
            }
        }
        running.set(false);
    }

    // ==================== RUN LIFECYCLE ====================

    /**
     * Expand matrices, build the instance graph and the artifact store. A matrix that cannot be
     * expanded becomes one FAILED instance named after its template.
     */
    private void prepare(PipelineRun run) {
        PipelineDefinition definition = run.getDefinition();
        RunContext context = run.getContext();
        EvaluationContext naming = EvaluationContext.builder(context).env(definition.getEnv()).build();

        List<JobInstance> instances = new ArrayList<>();
        Map<String, String> expansionErrors = new LinkedHashMap<>();
        for (JobTemplate template : definition.getJobs().values()) {
            if (template.hasMatrix()) {
                try {
                    instances.addAll(expander.expand(template, template.getMatrix(), context));
                } catch (ExpansionException e) {
                    logger.warning("Run " + run.getRunId() + ": " + e.getMessage());
                    instances.add(JobInstance.single(template, template.getId()));
                    expansionErrors.put(template.getId(), e.getMessage());
                }
            } else {
                instances.add(JobInstance.single(template, displayName(template, naming)));
            }
        }

        Map<String, Set<String>> producers = new HashMap<>();
        for (JobInstance instance : instances) {
            for (String output : instance.getTemplate().getOutputs()) {
                producers.computeIfAbsent(output, k -> new LinkedHashSet<>()).add(instance.getId());
            }
        }

        JobGraph graph = new JobGraph(instances, definition.getEnv());
        ArtifactStore artifacts = new ArtifactStore(run.getRunId(), transport, run::getStatus, producers);
        run.prepare(graph, artifacts);
        expansionErrors.forEach((id, message) -> run.force(run.record(id), JobStatus.FAILED, message));
        logger.fine("Run " + run.getRunId() + " prepared with " + graph.size() + " jobs");
    }

    private static String displayName(JobTemplate template, EvaluationContext naming) {
        if (template.getName() == null) {
            return template.getId();
        }
        try {
            return template.getName().render(naming);
        } catch (PipelineException e) {
            return template.getId();
        }
    }

    private void admit(PipelineRun run) {
        run.markAdmitted();
        activeRuns.add(run);
        logger.info("Run " + run.getRunId() + " admitted with " + run.getGraph().size() + " jobs");
        pump();
    }

    /**
     * Apply skips until none are left, queue every runnable job, dispatch while slots are free
     * and finish runs whose jobs are all terminal.
     */
    private void pump() {
        for (PipelineRun run : new ArrayList<>(activeRuns)) {
            if (run.isFinished()) {
                continue;
            }
            boolean skippedAny = true;
            while (skippedAny) {
                skippedAny = false;
                Readiness readiness = run.getGraph().ready(run.getStatuses(), run.getContext());
                for (Map.Entry<JobInstance, SkipCause> entry : readiness.getSkipped().entrySet()) {
                    PipelineRun.JobRecord record = run.record(entry.getKey().getId());
                    SkipCause cause = entry.getValue();
                    if (run.transition(record, JobStatus.SKIPPED, cause.getDescription())) {
                        record.skipCause = cause;
                        skippedAny = true;
                        logger.info("Job " + record.id() + " of run " + run.getRunId() + " skipped: "
                                + cause.getDescription());
                    }
                }
                for (JobInstance instance : readiness.getRunnable()) {
                    PipelineRun.JobRecord record = run.record(instance.getId());
                    if (!record.queued) {
                        record.queued = true;
                        readyQueue.add(new ReadyJob(run, record));
                    }
                }
            }
        }

        dispatchReady();

        for (PipelineRun run : new ArrayList<>(activeRuns)) {
            checkCompletion(run);
        }
    }

    private void dispatchReady() {
        while (busyWorkers.get() < workerCount && !readyQueue.isEmpty()) {
            ReadyJob next = readyQueue.poll();
            if (next.record.status == JobStatus.PENDING && !next.run.isFinished()) {
                dispatch(next.run, next.record);
            }
        }
    }

    private void dispatch(PipelineRun run, PipelineRun.JobRecord record) {
        JobInstance instance = record.instance;
        Map<String, JobStatus> statuses = run.getStatuses();
        Map<String, JobStatus> needs = new LinkedHashMap<>();
        for (String need : instance.getTemplate().getNeeds()) {
            needs.put(need, run.getGraph().statusOfTemplate(need, statuses));
        }
        JobContext context = new JobContext(instance, run.getContext(), run.getDefinition().getEnv(), needs,
                run.getArtifacts());

        run.transition(record, JobStatus.RUNNING, null);
        record.context = context;
        busyWorkers.incrementAndGet();
        try {
            record.execution = executorService.submit(new Worker(run, record, context, executor, this));
        } catch (RejectedExecutionException e) {
            busyWorkers.decrementAndGet();
            run.transition(record, JobStatus.FAILED, "Worker pool rejected the job");
            logger.log(Level.SEVERE, "Worker pool rejected " + record.id(), e);
            return;
        }

        Duration timeout = timeoutFor(instance.getTemplate());
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            record.timeout = timer.schedule(() -> post(SchedulerEvent.jobTimedOut(run, record)),
                    timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        logger.info("Job " + record.id() + " of run " + run.getRunId() + " dispatched");
    }

    private Duration timeoutFor(JobTemplate template) {
        return template.getTimeout() != null ? template.getTimeout() : defaultTimeout;
    }

    /**
     * Cancel the not-yet-terminal siblings of a failed matrix instance when its matrix is fail-fast.
     */
    private void failFast(PipelineRun run, PipelineRun.JobRecord failed) {
        JobTemplate template = failed.instance.getTemplate();
        if (!template.hasMatrix() || !template.getMatrix().isFailFast()) {
            return;
        }
        for (JobInstance sibling : run.getGraph().instancesOf(template.getId())) {
            PipelineRun.JobRecord record = run.record(sibling.getId());
            if (record != failed && !record.status.isTerminal()) {
                cancelJob(run, record, "Cancelled by fail-fast after " + failed.id() + " failed");
            }
        }
    }

    private void cancel(PipelineRun run, String reason) {
        run.markCancelled(reason);
        for (PipelineRun.JobRecord record : run.records()) {
            cancelJob(run, record, reason);
        }
        logger.info("Run " + run.getRunId() + " cancelled: " + reason);
        checkCompletion(run);
    }

    private void cancelJob(PipelineRun run, PipelineRun.JobRecord record, String reason) {
        boolean wasRunning = record.status == JobStatus.RUNNING;
        if (run.transition(record, JobStatus.CANCELLED, reason) && wasRunning) {
            stop(record);
        }
    }

    /**
     * Signal a running job's worker to stop. Its slot frees once the worker reports back.
     */
    private static void stop(PipelineRun.JobRecord record) {
        if (record.context != null) {
            record.context.cancel();
        }
        if (record.execution != null) {
            record.execution.cancel(true);
        }
        if (record.timeout != null) {
            record.timeout.cancel(false);
        }
    }

    private void checkCompletion(PipelineRun run) {
        if (run.isFinished() || !(run.isAdmitted() || run.isCancelled()) || !run.isComplete()) {
            return;
        }
        activeRuns.remove(run);

        PipelineResult result;
        try {
            result = aggregator.aggregate(run);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to aggregate run " + run.getRunId(), e);
            result = PipelineResult.error(run.getRunId(), run.getDefinition().getName(), e);
        }

        try {
            run.getArtifacts().discard();
        } catch (Exception e) {
            logger.log(Level.WARNING, "Failed to discard artifacts of run " + run.getRunId(), e);
        }

        complete(run, result);
        releaseGroup(run);
    }

    private void complete(PipelineRun run, PipelineResult result) {
        results.put(run.getRunId(), result);
        notifySafely(result);
        run.finish(result);
    }

    private void notifySafely(PipelineResult result) {
        try {
            notifier.notify(result);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Notifier failed for run " + result.getRunId(), e);
        }
    }

    /**
     * Free the run's concurrency group and admit the run waiting on it, if any.
     */
    private void releaseGroup(PipelineRun run) {
        String key = run.getGroupKey();
        if (key == null) {
            return;
        }
        if (waitingByGroup.get(key) == run) {
            waitingByGroup.remove(key);
            return;
        }
        if (activeByGroup.get(key) == run) {
            activeByGroup.remove(key);
            PipelineRun next = waitingByGroup.remove(key);
            if (next != null && accepting.get()) {
                activeByGroup.put(key, next);
                admit(next);
            }
        }
    }

    // ==================== STATUS ====================

    /**
     * @return a snapshot of scheduler counters
     */
    public Map<String, Object> getStatus() {
        int active = 0;
        int waiting = 0;
        for (PipelineRun run : runs.values()) {
            if (!run.isFinished()) {
                if (run.isAdmitted()) {
                    active++;
                } else {
                    waiting++;
                }
            }
        }

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", running.get());
        status.put("workerCount", workerCount);
        status.put("busyWorkers", busyWorkers.get());
        status.put("activeRuns", active);
        status.put("waitingRuns", waiting);
        status.put("finishedRuns", results.size());
        status.put("executorShutdown", executorService.isShutdown());
        return status;
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public int getBusyWorkers() {
        return busyWorkers.get();
    }

    private static final class ReadyJob {
        final PipelineRun run;
        final PipelineRun.JobRecord record;

        ReadyJob(PipelineRun run, PipelineRun.JobRecord record) {
            this.run = run;
            this.record = record;
        }
    }
}
