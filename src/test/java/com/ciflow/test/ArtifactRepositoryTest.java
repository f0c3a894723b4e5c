package com.ciflow.test;

import com.ciflow.artifact.ArtifactStore;
import com.ciflow.core.JobStatus;
import com.ciflow.core.PipelineException;
import com.ciflow.db.ArtifactRepository;
import com.ciflow.db.Database;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the H2-backed artifact transport.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class ArtifactRepositoryTest {

    private static int counter;

    private Database database;
    private ArtifactRepository repository;

    @BeforeEach
    public void setUp() throws SQLException {
        database = new Database("jdbc:h2:mem:artifacts_test_" + (++counter) + ";DB_CLOSE_DELAY=-1");
        database.initialize();
        repository = new ArtifactRepository(database);
    }

    @AfterEach
    public void tearDown() {
        if (database != null) {
            database.close();
        }
    }

    /**
     * Test 1: Payloads are stored and read back by run, job and name.
     */
    @Test
    @Order(1)
    public void testInsertAndFind() throws SQLException {
        repository.insert("run-1", "docker_build", "ethrex_image", bytes("ethrex:1"));
        repository.insert("run-1", "setup_hive", "hive", bytes("hive-binary"));
        repository.insert("run-2", "docker_build", "ethrex_image", bytes("ethrex:2"));

        assertEquals("ethrex:1", text(repository.find("run-1", "docker_build", "ethrex_image")));
        assertEquals("ethrex:2", text(repository.find("run-2", "docker_build", "ethrex_image")));
        assertNull(repository.find("run-1", "docker_build", "missing"));
        assertEquals(2, repository.findNames("run-1").size());
        assertTrue(repository.findNames("run-1").containsAll(List.of("ethrex_image", "hive")));
    }

    /**
     * Test 2: The primary key rejects a second write of the same artifact.
     */
    @Test
    @Order(2)
    public void testDuplicateKey() throws SQLException {
        repository.insert("run-1", "docker_build", "ethrex_image", bytes("first"));

        assertThrows(SQLException.class,
                () -> repository.insert("run-1", "docker_build", "ethrex_image", bytes("second")));
        PipelineException e = assertThrows(PipelineException.class,
                () -> repository.write("run-1", "docker_build", "ethrex_image", bytes("second")));
        assertInstanceOf(SQLException.class, e.getCause());
    }

    /**
     * Test 3: Deleting a run only removes that run's payloads.
     */
    @Test
    @Order(3)
    public void testDeleteRun() throws SQLException {
        repository.insert("run-1", "docker_build", "ethrex_image", bytes("a"));
        repository.insert("run-1", "setup_hive", "hive", bytes("b"));
        repository.insert("run-2", "docker_build", "ethrex_image", bytes("c"));

        assertEquals(2, repository.deleteRun("run-1"));
        assertEquals(0, repository.deleteRun("run-1"));
        assertTrue(repository.findNames("run-1").isEmpty());
        assertEquals(List.of("ethrex_image"), repository.findNames("run-2"));
    }

    /**
     * Test 4: The artifact store works unchanged on top of the database.
     */
    @Test
    @Order(4)
    public void testStoreOverDatabase() {
        Map<String, JobStatus> statuses = Map.of("docker_build", JobStatus.SUCCEEDED);
        ArtifactStore store = new ArtifactStore("run-3", repository, statuses::get,
                Map.of("ethrex_image", Set.of("docker_build")));

        store.put("docker_build", "ethrex_image", bytes("ethrex:3"));
        assertEquals("ethrex:3", ArtifactStore.asText(store.get("ethrex_image")));
        assertEquals(1, store.discard());
        assertNull(repository.read("run-3", "docker_build", "ethrex_image"));
    }

    /**
     * Test 5: A closed database refuses connections.
     */
    @Test
    @Order(5)
    public void testClosedDatabase() {
        database.close();
        assertTrue(database.isClosed());
        assertThrows(SQLException.class, () -> database.getConnection());
        assertThrows(PipelineException.class, () -> repository.read("run-1", "docker_build", "ethrex_image"));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] payload) {
        return new String(payload, StandardCharsets.UTF_8);
    }
}
