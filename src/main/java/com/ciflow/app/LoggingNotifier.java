package com.ciflow.app;

import com.ciflow.aggregate.PipelineResult;
import com.ciflow.aggregate.PipelineStatus;
import com.ciflow.engine.RunNotifier;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes finished runs to the log as JSON.
 */
public class LoggingNotifier implements RunNotifier {
    private static final Logger logger = Logger.getLogger(LoggingNotifier.class.getName());

    public enum Mode {
        /** Log every run. */
        ALWAYS,
        /** Log only runs that did not succeed. */
        FAILURE
    }

    private final Mode mode;

    public LoggingNotifier(Mode mode) {
        this.mode = mode;
    }

    @Override
    public void notify(PipelineResult result) {
        boolean success = result.getStatus() == PipelineStatus.SUCCESS;
        if (mode == Mode.FAILURE && success) {
            return;
        }
        logger.log(success ? Level.INFO : Level.WARNING, "Pipeline " + result.getPipeline() + " run "
                + result.getRunId() + ": " + result.toJson().toString(2));
    }

    public Mode getMode() {
        return mode;
    }
}
