package com.ciflow.test;

import com.ciflow.artifact.Artifact;
import com.ciflow.artifact.ArtifactStore;
import com.ciflow.artifact.InMemoryArtifactTransport;
import com.ciflow.core.ArtifactNotFoundException;
import com.ciflow.core.ArtifactNotReadyException;
import com.ciflow.core.DuplicateArtifactException;
import com.ciflow.core.JobStatus;
import com.ciflow.core.PipelineException;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the per-run artifact store.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class ArtifactStoreTest {

    private final Map<String, JobStatus> statuses = new ConcurrentHashMap<>();
    private InMemoryArtifactTransport transport;
    private ArtifactStore store;

    @BeforeEach
    public void setUp() {
        statuses.clear();
        transport = new InMemoryArtifactTransport();
        Map<String, Set<String>> producers = new HashMap<>();
        producers.put("ethrex_image", Set.of("docker_build"));
        producers.put("hive", Set.of("setup_hive"));
        store = new ArtifactStore("run-1", transport, statuses::get, producers);
    }

    /**
     * Test 1: An artifact is readable once its producer succeeded, as a copy.
     */
    @Test
    @Order(1)
    public void testPutAndGet() {
        statuses.put("docker_build", JobStatus.RUNNING);
        byte[] payload = bytes("ethrex:latest");
        Artifact artifact = store.put("docker_build", "ethrex_image", payload);
        payload[0] = 'X';

        assertEquals(13, artifact.getSize());
        assertEquals(64, artifact.getDigest().length());

        statuses.put("docker_build", JobStatus.SUCCEEDED);
        byte[] read = store.get("ethrex_image");
        assertEquals("ethrex:latest", ArtifactStore.asText(read));
        read[0] = 'Y';
        assertEquals("ethrex:latest", ArtifactStore.asText(store.get("docker_build", "ethrex_image")));
    }

    /**
     * Test 2: Reading before the producer succeeded is not-ready, not not-found.
     */
    @Test
    @Order(2)
    public void testNotReady() {
        statuses.put("docker_build", JobStatus.PENDING);
        assertThrows(ArtifactNotReadyException.class, () -> store.get("ethrex_image"));

        statuses.put("docker_build", JobStatus.RUNNING);
        store.put("docker_build", "ethrex_image", bytes("image"));
        ArtifactNotReadyException e = assertThrows(ArtifactNotReadyException.class, () -> store.get("ethrex_image"));
        assertEquals("ethrex_image", e.getName());
        assertThrows(ArtifactNotReadyException.class, () -> store.get("docker_build", "ethrex_image"));
    }

    /**
     * Test 3: Unknown names and names from failed producers are not found.
     */
    @Test
    @Order(3)
    public void testNotFound() {
        assertThrows(ArtifactNotFoundException.class, () -> store.get("unknown"));

        statuses.put("setup_hive", JobStatus.RUNNING);
        store.put("setup_hive", "hive", bytes("hive-binary"));
        statuses.put("setup_hive", JobStatus.FAILED);
        assertThrows(ArtifactNotFoundException.class, () -> store.get("hive"));

        statuses.put("docker_build", JobStatus.SKIPPED);
        assertThrows(ArtifactNotFoundException.class, () -> store.get("ethrex_image"));
    }

    /**
     * Test 4: A job cannot upload the same name twice.
     */
    @Test
    @Order(4)
    public void testDuplicateRejected() {
        statuses.put("docker_build", JobStatus.RUNNING);
        store.put("docker_build", "ethrex_image", bytes("first"));

        assertThrows(DuplicateArtifactException.class,
                () -> store.put("docker_build", "ethrex_image", bytes("second")));
        statuses.put("docker_build", JobStatus.SUCCEEDED);
        assertEquals("first", ArtifactStore.asText(store.get("ethrex_image")));
    }

    /**
     * Test 5: With several producers of one name the earliest succeeded upload wins.
     */
    @Test
    @Order(5)
    public void testSeveralProducers() {
        statuses.put("build[os=linux]", JobStatus.RUNNING);
        statuses.put("build[os=macos]", JobStatus.RUNNING);
        store.put("build[os=linux]", "report", bytes("linux"));
        store.put("build[os=macos]", "report", bytes("macos"));

        statuses.put("build[os=linux]", JobStatus.FAILED);
        statuses.put("build[os=macos]", JobStatus.SUCCEEDED);
        assertEquals("macos", ArtifactStore.asText(store.get("report")));

        statuses.put("build[os=linux]", JobStatus.SUCCEEDED);
        assertEquals("linux", ArtifactStore.asText(store.get("report")));
        assertEquals(2, store.list().size());
    }

    /**
     * Test 6: Discarding drops every payload and rejects later uploads.
     */
    @Test
    @Order(6)
    public void testDiscard() {
        statuses.put("docker_build", JobStatus.SUCCEEDED);
        store.put("docker_build", "ethrex_image", bytes("image"));
        store.put("docker_build", "logs", bytes("log"));

        assertEquals(2, store.discard());
        assertTrue(store.isDiscarded());
        assertEquals(0, store.discard(), "Discarding twice is harmless");
        assertEquals(0, transport.activeRuns());
        assertTrue(store.list().isEmpty());
        assertThrows(ArtifactNotFoundException.class, () -> store.get("logs"));
        assertThrows(IllegalStateException.class, () -> store.put("docker_build", "late", bytes("x")));
    }

    /**
     * Test 7: A payload altered in the transport fails its integrity check.
     */
    @Test
    @Order(7)
    public void testIntegrityCheck() {
        InMemoryArtifactTransport tampering = new InMemoryArtifactTransport() {
            @Override
            public byte[] read(String runId, String jobId, String name) {
                byte[] payload = super.read(runId, jobId, name);
                payload[0] ^= 0x01;
                return payload;
            }
        };
        ArtifactStore tampered = new ArtifactStore("run-2", tampering, statuses::get, Map.of());
        statuses.put("docker_build", JobStatus.SUCCEEDED);
        tampered.put("docker_build", "ethrex_image", bytes("image"));

        PipelineException e = assertThrows(PipelineException.class, () -> tampered.get("ethrex_image"));
        assertTrue(e.getMessage().contains("integrity"));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
