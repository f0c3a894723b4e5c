package com.ciflow.engine;

import com.ciflow.core.JobStatus;

/**
 * Message on the scheduler's event queue. Every status transition is caused by exactly one
 * event, processed in arrival order on the coordinator thread.
 */
final class SchedulerEvent {

    enum Type {
        RUN_SUBMITTED,
        JOB_FINISHED,
        JOB_TIMED_OUT,
        CANCEL_RUN,
        SHUTDOWN
    }

    final Type type;
    final PipelineRun run;
    final PipelineRun.JobRecord record;
    final JobStatus status;
    final String runId;
    final String message;

    private SchedulerEvent(Type type, PipelineRun run, PipelineRun.JobRecord record, JobStatus status,
                           String runId, String message) {
        this.type = type;
        this.run = run;
        this.record = record;
        this.status = status;
        this.runId = runId;
        this.message = message;
    }

    static SchedulerEvent runSubmitted(PipelineRun run) {
        return new SchedulerEvent(Type.RUN_SUBMITTED, run, null, null, run.getRunId(), null);
    }

    static SchedulerEvent jobFinished(PipelineRun run, PipelineRun.JobRecord record, JobStatus status, String message) {
        return new SchedulerEvent(Type.JOB_FINISHED, run, record, status, run.getRunId(), message);
    }

    static SchedulerEvent jobTimedOut(PipelineRun run, PipelineRun.JobRecord record) {
        return new SchedulerEvent(Type.JOB_TIMED_OUT, run, record, null, run.getRunId(), null);
    }

    static SchedulerEvent cancelRun(String runId, String reason) {
        return new SchedulerEvent(Type.CANCEL_RUN, null, null, null, runId, reason);
    }

    static SchedulerEvent shutdown() {
        return new SchedulerEvent(Type.SHUTDOWN, null, null, null, null, null);
    }

    @Override
    public String toString() {
        return type + (runId == null ? "" : "(" + runId + (record == null ? "" : "/" + record.id()) + ")");
    }
}
