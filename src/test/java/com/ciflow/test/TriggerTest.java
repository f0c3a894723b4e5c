package com.ciflow.test;

import com.ciflow.core.RunContext;
import com.ciflow.definition.PipelineDefinition;
import com.ciflow.definition.PipelineLoader;
import com.ciflow.definition.Trigger;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for trigger matching on event, branch and changed paths.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class TriggerTest {

    /**
     * Test 1: Event and branch filters.
     */
    @Test
    @Order(1)
    public void testEventAndBranch() {
        Trigger pushToMain = new Trigger("push", List.of("main", "release/*"), List.of(), List.of());

        assertTrue(pushToMain.matches(context("push", "main")));
        assertTrue(pushToMain.matches(context("push", "release/v1")));
        assertFalse(pushToMain.matches(context("push", "feature/x")));
        assertFalse(pushToMain.matches(context("pull_request", "main")));
        assertTrue(Trigger.on("merge_group").matches(context("merge_group", "gh-readonly-queue/main")));
    }

    /**
     * Test 2: Path filters need at least one interesting change.
     */
    @Test
    @Order(2)
    public void testPathFilters() {
        Trigger l2Only = new Trigger("pull_request", List.of(), List.of("crates/l2/**"), List.of());
        assertTrue(l2Only.matches(context("pull_request", "pr", "crates/l2/prover/src/lib.rs", "README.md")));
        assertFalse(l2Only.matches(context("pull_request", "pr", "crates/vm/src/lib.rs")));

        Trigger ignoreDocs = new Trigger("pull_request", List.of(), List.of(), List.of("docs/**", "**.md"));
        assertFalse(ignoreDocs.matches(context("pull_request", "pr", "docs/guide/intro.md", "README.md")));
        assertTrue(ignoreDocs.matches(context("pull_request", "pr", "docs/intro.md", "crates/common/src/lib.rs")));

        assertTrue(l2Only.matches(context("pull_request", "pr")), "Path filters are ignored without changed paths");
    }

    /**
     * Test 3: The L1 pipeline skips pull requests that only touch L2 or LEVM code.
     */
    @Test
    @Order(3)
    public void testL1Triggers() {
        PipelineDefinition l1 = new PipelineLoader().loadResource("pipelines/l1.json");

        assertTrue(l1.isTriggeredBy(context("push", "main")));
        assertFalse(l1.isTriggeredBy(context("push", "feature/x")));
        assertTrue(l1.isTriggeredBy(context("merge_group", "gh-readonly-queue/main")));
        assertTrue(l1.isTriggeredBy(context("pull_request", "feature/x", "crates/networking/p2p/src/lib.rs")));
        assertFalse(l1.isTriggeredBy(context("pull_request", "feature/x",
                "crates/l2/sequencer/src/main.rs", "crates/vm/levm/src/vm.rs")));
    }

    private static RunContext context(String event, String branch, String... changed) {
        return RunContext.builder()
                .trigger(event)
                .branch(branch)
                .changedPaths(List.of(changed))
                .build();
    }
}
