package com.ciflow.artifact;

/**
 * Physical storage of artifact payloads.
 *
 * <p>Implementations must be thread-safe: jobs of one run upload and download concurrently.
 * Storage failures are reported as {@link com.ciflow.core.PipelineException}s and fail the
 * job that triggered them.</p>
 */
public interface ArtifactTransport {

    void write(String runId, String jobId, String name, byte[] payload);

    /**
     * @return the payload, or null if nothing is stored under the key
     */
    byte[] read(String runId, String jobId, String name);

    /**
     * Drop every payload of a run.
     *
     * @return number of payloads removed
     */
    int deleteRun(String runId);
}
