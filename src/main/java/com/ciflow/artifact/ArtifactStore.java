package com.ciflow.artifact;

import com.ciflow.core.ArtifactNotFoundException;
import com.ciflow.core.ArtifactNotReadyException;
import com.ciflow.core.DuplicateArtifactException;
import com.ciflow.core.JobStatus;
import com.ciflow.core.PipelineException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Run-scoped handoff of named artifacts between jobs.
 *
 * <p><b>Discipline:</b></p>
 * <ul>
 *   <li>Append-only: a job stores each name at most once; nothing is overwritten.</li>
 *   <li>Read-after-producer-success: an artifact is visible only once the job that stored it
 *       has SUCCEEDED.</li>
 *   <li>Read-only borrow: payloads are copied on the way in and on the way out.</li>
 *   <li>Run-scoped: {@link #discard()} drops every payload when the run reaches its aggregate
 *       state.</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> The index is guarded by this object's monitor. Producer statuses are
 * read through the supplied lookup, which must be safe to call from worker threads.</p>
 */
public class ArtifactStore {
    private static final Logger logger = Logger.getLogger(ArtifactStore.class.getName());

    private final String runId;
    private final ArtifactTransport transport;
    private final Function<String, JobStatus> statusLookup;
    private final Map<String, Set<String>> declaredProducers;
    // name -> artifacts in upload order
    private final Map<String, List<Artifact>> index = new LinkedHashMap<>();
    private boolean discarded;

    /**
     * @param runId             the run this store belongs to
     * @param transport         where payloads are kept
     * @param statusLookup      current status of a job instance by id
     * @param declaredProducers artifact name → ids of the job instances declaring it as output
     */
    public ArtifactStore(String runId, ArtifactTransport transport, Function<String, JobStatus> statusLookup,
                         Map<String, Set<String>> declaredProducers) {
        this.runId = runId;
        this.transport = transport;
        this.statusLookup = statusLookup;
        this.declaredProducers = Map.copyOf(declaredProducers);
    }

    /**
     * Store an artifact produced by a job.
     *
     * @param jobId   producing job instance
     * @param name    artifact name
     * @param payload artifact bytes, copied
     * @throws DuplicateArtifactException if the job already stored this name
     * @throws IllegalStateException      if the run's artifacts were already discarded
     */
    public synchronized Artifact put(String jobId, String name, byte[] payload) {
        if (discarded) {
            throw new IllegalStateException("Artifacts of run " + runId + " were discarded");
        }
        List<Artifact> entries = index.computeIfAbsent(name, k -> new ArrayList<>());
        for (Artifact existing : entries) {
            if (existing.getJobId().equals(jobId)) {
                throw new DuplicateArtifactException(jobId, name);
            }
        }

        byte[] copy = payload.clone();
        transport.write(runId, jobId, name, copy);
        Artifact artifact = new Artifact(name, jobId, copy.length, sha256(copy), Instant.now());
        entries.add(artifact);
        logger.fine("Stored " + artifact + " for run " + runId);
        return artifact;
    }

    /**
     * Fetch an artifact by name. When several jobs produced the name, the earliest upload from
     * a succeeded job wins.
     *
     * @param name artifact name
     * @return a copy of the payload
     * @throws ArtifactNotReadyException if the producer has not succeeded yet
     * @throws ArtifactNotFoundException if no job in the run produced the name
     */
    public byte[] get(String name) {
        List<Artifact> candidates;
        synchronized (this) {
            candidates = new ArrayList<>(index.getOrDefault(name, List.of()));
        }

        String pendingProducer = null;
        for (Artifact candidate : candidates) {
            JobStatus status = statusLookup.apply(candidate.getJobId());
            if (status == JobStatus.SUCCEEDED) {
                return load(candidate);
            }
            if (pendingProducer == null && status != null && !status.isTerminal()) {
                pendingProducer = candidate.getJobId();
            }
        }
        if (pendingProducer == null) {
            for (String producer : declaredProducers.getOrDefault(name, Set.of())) {
                JobStatus status = statusLookup.apply(producer);
                if (status != null && !status.isTerminal()) {
                    pendingProducer = producer;
                    break;
                }
            }
        }
        if (pendingProducer != null) {
            throw new ArtifactNotReadyException(name, pendingProducer);
        }
        throw new ArtifactNotFoundException(name);
    }

    /**
     * Fetch the artifact a specific job produced.
     *
     * @throws ArtifactNotReadyException if that job has not succeeded yet
     * @throws ArtifactNotFoundException if that job never stored the name
     */
    public byte[] get(String jobId, String name) {
        Artifact match = null;
        synchronized (this) {
            for (Artifact candidate : index.getOrDefault(name, List.of())) {
                if (candidate.getJobId().equals(jobId)) {
                    match = candidate;
                }
            }
        }
        JobStatus status = statusLookup.apply(jobId);
        if (match == null) {
            if (status != null && !status.isTerminal()
                    && declaredProducers.getOrDefault(name, Set.of()).contains(jobId)) {
                throw new ArtifactNotReadyException(name, jobId);
            }
            throw new ArtifactNotFoundException(name);
        }
        if (status != JobStatus.SUCCEEDED) {
            throw new ArtifactNotReadyException(name, jobId);
        }
        return load(match);
    }

    /**
     * @return metadata of every stored artifact, in upload order per name
     */
    public synchronized List<Artifact> list() {
        List<Artifact> all = new ArrayList<>();
        index.values().forEach(all::addAll);
        return all;
    }

    /**
     * Drop every payload of the run. Further uploads are rejected and lookups report
     * not-found.
     *
     * @return number of payloads dropped
     */
    public synchronized int discard() {
        if (discarded) {
            return 0;
        }
        discarded = true;
        index.clear();
        int removed = transport.deleteRun(runId);
        logger.fine("Discarded " + removed + " artifacts of run " + runId);
        return removed;
    }

    public synchronized boolean isDiscarded() {
        return discarded;
    }

    public String getRunId() {
        return runId;
    }

    private byte[] load(Artifact artifact) {
        byte[] payload = transport.read(runId, artifact.getJobId(), artifact.getName());
        if (payload == null) {
            throw new ArtifactNotFoundException(artifact.getName());
        }
        if (!sha256(payload).equals(artifact.getDigest())) {
            throw new PipelineException("Artifact '" + artifact.getName() + "' from " + artifact.getJobId()
                    + " failed its integrity check");
        }
        return payload;
    }

    static String sha256(byte[] payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Convenience for text artifacts.
     */
    public static String asText(byte[] payload) {
        return new String(payload, StandardCharsets.UTF_8);
    }
}
