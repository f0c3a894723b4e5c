package com.ciflow.engine;

/**
 * Runs the steps of one job instance.
 *
 * <p>Executors are invoked on worker threads, possibly for several jobs at once. Throwing any
 * exception fails the job; throwing {@link InterruptedException} after the job's context was
 * cancelled marks it cancelled. Long-running executors should call
 * {@link JobContext#throwIfCancelled()} between units of work.</p>
 *
 * @see StepwiseExecutor
 */
@FunctionalInterface
public interface JobExecutor {

    /**
     * Execute a job.
     *
     * @param context the job's execution context
     * @return the outcome, never null
     * @throws Exception if the job fails
     */
    ExecutionResult execute(JobContext context) throws Exception;
}
