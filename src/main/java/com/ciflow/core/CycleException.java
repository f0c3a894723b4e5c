package com.ciflow.core;

import java.util.List;

/**
 * Thrown when the {@code needs} relation of a pipeline is not acyclic.
 *
 * <p>The exception carries the offending cycle as an ordered list of job ids where the first
 * and last entries are the same job, e.g. {@code [build, test, build]}.</p>
 */
public class CycleException extends PipelineException {

    private final List<String> cycle;

    /**
     * Create a new CycleException.
     *
     * @param cycle the job ids forming the cycle, first id repeated at the end
     */
    public CycleException(List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Get the job ids forming the cycle.
     *
     * @return immutable list, first id repeated at the end
     */
    public List<String> getCycle() {
        return cycle;
    }
}
