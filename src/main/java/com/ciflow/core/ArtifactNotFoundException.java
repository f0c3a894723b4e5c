package com.ciflow.core;

/**
 * Thrown when no job in the run produced the requested artifact.
 */
public class ArtifactNotFoundException extends PipelineException {

    private final String name;

    public ArtifactNotFoundException(String name) {
        super("Artifact '" + name + "' was not produced by any job in this run");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
