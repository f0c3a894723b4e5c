package com.ciflow.test;

import com.ciflow.core.ExpansionException;
import com.ciflow.core.JobInstance;
import com.ciflow.core.JobTemplate;
import com.ciflow.core.Matrix;
import com.ciflow.expr.Template;
import com.ciflow.matrix.MatrixExpander;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for matrix expansion.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class MatrixExpanderTest {

    private MatrixExpander expander;
    private JobTemplate template;

    @BeforeEach
    public void setUp() {
        expander = new MatrixExpander();
        template = JobTemplate.builder("lint").build();
    }

    /**
     * Test 1: The cartesian product is produced in axis declaration order.
     */
    @Test
    @Order(1)
    public void testCartesianProduct() {
        Matrix matrix = Matrix.builder()
                .axis("backend", List.of("exec", "sp1"))
                .axis("os", List.of("linux", "macos"))
                .build();

        List<JobInstance> instances = expander.expand(template, matrix);

        assertEquals(List.of(
                "lint[backend=exec,os=linux]",
                "lint[backend=exec,os=macos]",
                "lint[backend=sp1,os=linux]",
                "lint[backend=sp1,os=macos]"), ids(instances));
        assertEquals(Map.of("backend", "sp1", "os", "macos"), instances.get(3).getMatrixValues());
        assertTrue(instances.get(0).isMatrixInstance());
    }

    /**
     * Test 2: Excludes remove every combination they match.
     */
    @Test
    @Order(2)
    public void testExclude() {
        Matrix matrix = Matrix.builder()
                .axis("backend", List.of("exec", "sp1", "risc0"))
                .axis("os", List.of("linux", "macos"))
                .exclude(Map.of("os", "macos"))
                .exclude(Map.of("backend", "risc0", "os", "linux"))
                .build();

        assertEquals(List.of("lint[backend=exec,os=linux]", "lint[backend=sp1,os=linux]"),
                ids(expander.expand(template, matrix)));
    }

    /**
     * Test 3: Includes extend matching combinations or append new ones.
     */
    @Test
    @Order(3)
    public void testInclude() {
        Matrix matrix = Matrix.builder()
                .axis("backend", List.of("exec", "sp1"))
                .include(Map.of("backend", "sp1", "gpu", "true"))
                .include(Map.of("backend", "risc0"))
                .build();

        List<JobInstance> instances = expander.expand(template, matrix);

        assertEquals(List.of("lint[backend=exec]", "lint[backend=sp1,gpu=true]", "lint[backend=risc0]"),
                ids(instances));
        assertNull(instances.get(0).getMatrixValues().get("gpu"));
    }

    /**
     * Test 4: An include-only matrix yields one instance per entry, named from the template.
     */
    @Test
    @Order(4)
    public void testIncludeOnlyWithDisplayNames() {
        JobTemplate hive = JobTemplate.builder("run_hive").name(Template.parse("Hive - ${{ matrix.name }}")).build();
        Matrix matrix = Matrix.builder()
                .include(Map.of("name", "Rpc Compat tests", "simulation", "ethereum/rpc-compat"))
                .include(Map.of("name", "Sync full", "simulation", "ethereum/sync"))
                .build();

        List<JobInstance> instances = expander.expand(hive, matrix);

        assertEquals(2, instances.size());
        assertEquals("Hive - Rpc Compat tests", instances.get(0).getDisplayName());
        assertEquals("Hive - Sync full", instances.get(1).getDisplayName());
        assertEquals("ethereum/sync", instances.get(1).getMatrixValues().get("simulation"));
    }

    /**
     * Test 5: Expansion is deterministic.
     */
    @Test
    @Order(5)
    public void testDeterministic() {
        Matrix matrix = Matrix.builder()
                .axis("a", List.of("1", "2", "3"))
                .axis("b", List.of("x", "y"))
                .exclude(Map.of("a", "2"))
                .build();

        assertEquals(ids(expander.expand(template, matrix)), ids(expander.expand(template, matrix)));
    }

    /**
     * Test 6: Invalid matrices are rejected.
     */
    @Test
    @Order(6)
    public void testExpansionErrors() {
        Matrix emptyAxis = Matrix.builder().axis("backend", List.of()).build();
        ExpansionException e = assertThrows(ExpansionException.class, () -> expander.expand(template, emptyAxis));
        assertEquals("lint", e.getTemplateId());

        Matrix allExcluded = Matrix.builder()
                .axis("backend", List.of("exec"))
                .exclude(Map.of("backend", "exec"))
                .build();
        assertThrows(ExpansionException.class, () -> expander.expand(template, allExcluded));

        Matrix nothing = Matrix.builder().build();
        assertThrows(ExpansionException.class, () -> expander.expand(template, nothing));

        List<String> values = new ArrayList<>();
        for (int i = 0; i < 17; i++) {
            values.add(String.valueOf(i));
        }
        Matrix tooLarge = Matrix.builder().axis("a", values).axis("b", values).build();
        assertThrows(ExpansionException.class, () -> expander.expand(template, tooLarge));
    }

    /**
     * Test 7: Two identical include entries collide.
     */
    @Test
    @Order(7)
    public void testDuplicateCombination() {
        Matrix duplicated = Matrix.builder()
                .include(Map.of("name", "Sync full"))
                .include(Map.of("name", "Sync full"))
                .build();

        assertThrows(ExpansionException.class, () -> expander.expand(template, duplicated));
    }

    /**
     * Test 8: Huge axes are rejected before the product is built; excludes may trim a large product.
     */
    @Test
    @Order(8)
    public void testProductLimit() {
        List<String> ten = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            ten.add(String.valueOf(i));
        }
        Matrix.Builder wide = Matrix.builder();
        for (int axis = 0; axis < 12; axis++) {
            wide.axis("axis" + axis, ten);
        }
        Matrix trillion = wide.build();
        ExpansionException e = assertThrows(ExpansionException.class, () -> expander.expand(template, trillion));
        assertTrue(e.getMessage().contains("1000000000000"), e.getMessage());

        Matrix.Builder wider = Matrix.builder();
        for (int axis = 0; axis < 20; axis++) {
            wider.axis("axis" + axis, ten);
        }
        Matrix overflowing = wider.build();
        e = assertThrows(ExpansionException.class, () -> expander.expand(template, overflowing));
        assertTrue(e.getMessage().contains("too many"), e.getMessage());

        List<String> seventeen = new ArrayList<>();
        for (int i = 0; i < 17; i++) {
            seventeen.add(String.valueOf(i));
        }
        Matrix trimmed = Matrix.builder()
                .axis("a", seventeen)
                .axis("b", seventeen)
                .exclude(Map.of("a", "0"))
                .exclude(Map.of("a", "1"))
                .build();
        assertEquals(255, expander.expand(template, trimmed).size());
    }

    private static List<String> ids(List<JobInstance> instances) {
        List<String> ids = new ArrayList<>();
        for (JobInstance instance : instances) {
            ids.add(instance.getId());
        }
        return ids;
    }
}
