package com.ciflow.core;

/**
 * Thrown when a job stores the same artifact name twice within one run.
 */
public class DuplicateArtifactException extends PipelineException {

    public DuplicateArtifactException(String jobId, String name) {
        super("Artifact '" + name + "' was already uploaded by job " + jobId);
    }
}
