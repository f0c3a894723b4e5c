package com.ciflow.engine;

import com.ciflow.core.Step;
import com.ciflow.expr.EvaluationContext;
import com.ciflow.expr.Expression;

import java.util.logging.Logger;

/**
 * Executor that runs a job's steps in order and leaves each command to a subclass.
 *
 * <p>Once a step fails, later steps only run when their condition calls a status function
 * such as {@code always()} or {@code failure()}; this is how cleanup steps are expressed. A
 * condition without a status function is combined with an implicit {@code success()}. The job
 * fails with the message of its first failed step.</p>
 */
public abstract class StepwiseExecutor implements JobExecutor {
    private static final Logger logger = Logger.getLogger(StepwiseExecutor.class.getName());

    @Override
    public ExecutionResult execute(JobContext context) throws Exception {
        String firstFailure = null;
        int ran = 0;

        for (Step step : context.getInstance().getTemplate().getSteps()) {
            context.throwIfCancelled();
            boolean failed = firstFailure != null;
            if (!shouldRun(step, context.evaluationContext(failed), failed)) {
                context.log("DEBUG", "Skipping step '" + step.getName() + "'");
                continue;
            }

            ran++;
            try {
                runStep(context, step);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                String message = "Step '" + step.getName() + "' failed: " + e.getMessage();
                context.log("ERROR", message);
                if (firstFailure == null) {
                    firstFailure = message;
                }
            }
        }

        logger.fine("Job " + context.getJobId() + " ran " + ran + " steps");
        return firstFailure == null ? ExecutionResult.success() : ExecutionResult.failure(firstFailure);
    }

    private static boolean shouldRun(Step step, EvaluationContext evaluation, boolean failed) {
        Expression condition = step.getCondition();
        if (condition == null) {
            return !failed;
        }
        if (condition.usesStatusFunction()) {
            return condition.test(evaluation);
        }
        return !failed && condition.test(evaluation);
    }

    /**
     * Run one step.
     *
     * @throws InterruptedException when the job is cancelled mid-step
     * @throws Exception            to fail the step
     */
    protected abstract void runStep(JobContext context, Step step) throws Exception;
}
