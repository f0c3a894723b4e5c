package com.ciflow.engine;

import com.ciflow.core.JobStatus;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runnable executing a single job instance on the worker pool.
 *
 * <p>The worker never touches the status table. It reports exactly one outcome to the
 * scheduler, which decides whether the report still applies:</p>
 * <ul>
 *   <li>Executor returns a result → its status (SUCCEEDED or FAILED)</li>
 *   <li>InterruptedException → CANCELLED</li>
 *   <li>Any other Exception → FAILED with the exception as message</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Each Worker runs in its own pool thread with its own JobContext.</p>
 *
 * @see Scheduler
 */
class Worker implements Runnable {
    private static final Logger logger = Logger.getLogger(Worker.class.getName());

    private final PipelineRun run;
    private final PipelineRun.JobRecord record;
    private final JobContext context;
    private final JobExecutor executor;
    private final Scheduler scheduler;

    Worker(PipelineRun run, PipelineRun.JobRecord record, JobContext context, JobExecutor executor,
           Scheduler scheduler) {
        this.run = run;
        this.record = record;
        this.context = context;
        this.executor = executor;
        this.scheduler = scheduler;
    }

    @Override
    public void run() {
        String jobId = context.getJobId();
        logger.fine("Worker starting " + jobId + " of run " + run.getRunId());
        long startTime = System.currentTimeMillis();

        JobStatus status;
        String message;
        try {
            context.throwIfCancelled();
            ExecutionResult result = executor.execute(context);
            if (result == null) {
                status = JobStatus.FAILED;
                message = "Executor returned no result";
            } else {
                status = result.getStatus();
                message = result.getMessage();
            }
        } catch (InterruptedException e) {
            // === CANCELLATION PATH ===
            status = JobStatus.CANCELLED;
            message = e.getMessage();
            logger.fine("Job " + jobId + " stopped after cancellation");
        } catch (Exception e) {
            // === FAILURE PATH ===
            status = JobStatus.FAILED;
            message = e.getClass().getSimpleName() + ": " + e.getMessage();
            logger.log(Level.WARNING, "Job " + jobId + " failed", e);
        }

        long duration = System.currentTimeMillis() - startTime;
        logger.info("Job " + jobId + " reported " + status + " after " + duration + "ms");
        scheduler.post(SchedulerEvent.jobFinished(run, record, status, message));
    }
}
