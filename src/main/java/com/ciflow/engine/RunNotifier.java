package com.ciflow.engine;

import com.ciflow.aggregate.PipelineResult;

/**
 * Receives the result of every finished run, once per run.
 *
 * <p>Called on the scheduler's coordinator thread. An exception thrown here is logged and
 * never changes the result.</p>
 */
@FunctionalInterface
public interface RunNotifier {

    void notify(PipelineResult result) throws Exception;
}
