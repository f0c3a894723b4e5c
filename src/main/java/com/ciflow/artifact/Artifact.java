package com.ciflow.artifact;

import java.time.Instant;

/**
 * Metadata of a stored artifact. The payload itself lives in the {@link ArtifactTransport}.
 */
public final class Artifact {
    private final String name;
    private final String jobId;
    private final long size;
    private final String digest;
    private final Instant createdAt;

    public Artifact(String name, String jobId, long size, String digest, Instant createdAt) {
        this.name = name;
        this.jobId = jobId;
        this.size = size;
        this.digest = digest;
        this.createdAt = createdAt;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the id of the job instance that uploaded the artifact
     */
    public String getJobId() {
        return jobId;
    }

    public long getSize() {
        return size;
    }

    /**
     * @return hex SHA-256 of the payload
     */
    public String getDigest() {
        return digest;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "Artifact{" + name + " from " + jobId + ", " + size + " bytes}";
    }
}
