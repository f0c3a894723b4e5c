package com.ciflow.core;

/**
 * Thrown when an artifact is requested before the job producing it has succeeded.
 */
public class ArtifactNotReadyException extends PipelineException {

    private final String name;

    public ArtifactNotReadyException(String name, String producerId) {
        super("Artifact '" + name + "' is not ready: producer " + producerId + " has not succeeded");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
