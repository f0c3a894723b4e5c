package com.ciflow.artifact;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default transport keeping payloads on the heap, keyed by {@code runId/jobId/name}.
 */
public class InMemoryArtifactTransport implements ArtifactTransport {
    private final Map<String, Map<String, byte[]>> runs = new ConcurrentHashMap<>();

    @Override
    public void write(String runId, String jobId, String name, byte[] payload) {
        runs.computeIfAbsent(runId, k -> new ConcurrentHashMap<>()).put(key(jobId, name), payload.clone());
    }

    @Override
    public byte[] read(String runId, String jobId, String name) {
        Map<String, byte[]> run = runs.get(runId);
        if (run == null) {
            return null;
        }
        byte[] payload = run.get(key(jobId, name));
        return payload == null ? null : payload.clone();
    }

    @Override
    public int deleteRun(String runId) {
        Map<String, byte[]> removed = runs.remove(runId);
        return removed == null ? 0 : removed.size();
    }

    /**
     * @return number of runs that still hold payloads
     */
    public int activeRuns() {
        return runs.size();
    }

    private static String key(String jobId, String name) {
        return jobId + '/' + name;
    }
}
