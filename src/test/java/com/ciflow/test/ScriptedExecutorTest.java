package com.ciflow.test;

import com.ciflow.aggregate.PipelineResult;
import com.ciflow.aggregate.PipelineStatus;
import com.ciflow.artifact.InMemoryArtifactTransport;
import com.ciflow.core.JobInstance;
import com.ciflow.core.JobStatus;
import com.ciflow.core.JobTemplate;
import com.ciflow.core.RunContext;
import com.ciflow.core.Step;
import com.ciflow.definition.PipelineDefinition;
import com.ciflow.definition.PipelineLoader;
import com.ciflow.engine.PipelineRun;
import com.ciflow.engine.Scheduler;
import com.ciflow.executors.ScriptedExecutor;
import com.ciflow.expr.ExpressionParser;
import com.ciflow.graph.SkipCause;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests running scripted steps, including the bundled L1 pipeline.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class ScriptedExecutorTest {

    private ScriptedExecutor executor;
    private Scheduler scheduler;
    private Thread schedulerThread;

    @BeforeEach
    public void setUp() {
        executor = new ScriptedExecutor();
        scheduler = new Scheduler(4, Duration.ofMinutes(1), executor, new InMemoryArtifactTransport(), result -> { });
        schedulerThread = scheduler.startInBackground();
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        scheduler.shutdown();
        schedulerThread.join(5000);
    }

    /**
     * Test 1: A push to main runs the whole L1 pipeline, handing the image to every test job.
     */
    @Test
    @Order(1)
    public void testL1OnPush() throws Exception {
        PipelineDefinition l1 = new PipelineLoader().loadResource("pipelines/l1.json");
        RunContext push = RunContext.builder().runId("l1-push").trigger("push").branch("main").build();

        PipelineRun run = scheduler.trigger(l1, push).orElseThrow();
        PipelineResult result = run.getCompletion().get(20, TimeUnit.SECONDS);

        assertEquals(PipelineStatus.SUCCESS, result.getStatus(), result.getSummary());
        assertEquals(2, run.getGraph().instancesOf("run_assertoor").size());
        assertEquals(4, run.getGraph().instancesOf("run_hive").size());
        assertEquals(JobStatus.SUCCEEDED, result.statusOf("all_tests"));

        JobInstance hive = run.getGraph().instancesOf("run_hive").get(0);
        assertEquals("Hive - Rpc Compat tests", hive.getDisplayName());
        List<String> transcript = executor.getTranscript("l1-push", hive.getId());
        assertTrue(transcript.contains("ethrex:l1-push"), transcript.toString());
        assertTrue(transcript.contains("hive-binary"), transcript.toString());
        assertTrue(transcript.contains("hive --client ethrex --sim ethereum/rpc-compat"), transcript.toString());

        List<String> report = executor.getTranscript("l1-push", "all_tests");
        assertEquals(List.of("all integration jobs passed"), report);
    }

    /**
     * Test 2: In the merge queue the integration jobs are skipped and the run still passes.
     */
    @Test
    @Order(2)
    public void testL1InMergeQueue() throws Exception {
        PipelineDefinition l1 = new PipelineLoader().loadResource("pipelines/l1.json");
        RunContext mergeGroup = RunContext.builder().runId("l1-merge").trigger("merge_group")
                .branch("gh-readonly-queue/main").build();

        PipelineRun run = scheduler.submit(l1, mergeGroup);
        PipelineResult result = run.getCompletion().get(20, TimeUnit.SECONDS);

        assertEquals(PipelineStatus.SUCCESS, result.getStatus(), result.getSummary());
        for (JobInstance instance : run.getGraph().instancesOf("run_hive")) {
            assertEquals(JobStatus.SKIPPED, result.statusOf(instance.getId()));
        }
        assertEquals(JobStatus.SKIPPED, result.statusOf("all_tests"));
        assertEquals(SkipCause.CONDITION, run.getSkipCause("all_tests"));
        assertTrue(result.getCheck("all_tests").isPassed());
    }

    /**
     * Test 3: A failing step stops later steps except those asking for always().
     */
    @Test
    @Order(3)
    public void testFailingStepAndCleanup() throws Exception {
        PipelineDefinition definition = PipelineDefinition.builder("steps")
                .job(JobTemplate.builder("test")
                        .step(new Step("Prepare", "echo preparing", null))
                        .step(new Step("Run", "fail 3 tests failed", null))
                        .step(new Step("Publish", "echo publishing", null))
                        .step(new Step("Report", "echo failure reported", ExpressionParser.parse("failure()")))
                        .step(new Step("Cleanup", "echo cleanup", ExpressionParser.parse("always()")))
                        .build())
                .build();

        PipelineResult result = scheduler.submit(definition, RunContext.builder().runId("steps").build())
                .getCompletion().get(10, TimeUnit.SECONDS);

        assertEquals(JobStatus.FAILED, result.statusOf("test"));
        assertEquals("Step 'Run' failed: 3 tests failed", result.getMessage("test"));
        assertEquals(List.of("preparing", "failure reported", "cleanup"), executor.getTranscript("steps", "test"));
    }

    /**
     * Test 4: Unknown commands and downloads of missing artifacts fail the step.
     */
    @Test
    @Order(4)
    public void testCommandErrors() throws Exception {
        PipelineDefinition definition = PipelineDefinition.builder("errors")
                .job(JobTemplate.builder("unknown").step(Step.of("make test")).build())
                .job(JobTemplate.builder("missing").step(Step.of("download nothing")).build())
                .job(JobTemplate.builder("sleepy").step(Step.of("sleep soon")).build())
                .build();

        PipelineResult result = scheduler.submit(definition, RunContext.builder().runId("errors").build())
                .getCompletion().get(10, TimeUnit.SECONDS);

        assertEquals("Step 'make test' failed: Unknown command: make", result.getMessage("unknown"));
        assertTrue(result.getMessage("missing").contains("nothing"), result.getMessage("missing"));
        assertTrue(result.getMessage("sleepy").contains("milliseconds"), result.getMessage("sleepy"));

        executor.forget("errors");
        assertTrue(executor.getTranscript("errors", "unknown").isEmpty());
    }

    /**
     * Test 5: A sleeping step stops promptly when its run is cancelled.
     */
    @Test
    @Order(5)
    public void testSleepIsCancellable() throws Exception {
        PipelineDefinition definition = PipelineDefinition.builder("sleep")
                .job(JobTemplate.builder("wait").step(Step.of("echo start\nsleep 30000\necho never")).build())
                .build();

        PipelineRun run = scheduler.submit(definition, RunContext.builder().runId("sleep").build());
        for (int i = 0; i < 100 && executor.getTranscript("sleep", "wait").isEmpty(); i++) {
            Thread.sleep(50);
        }
        scheduler.cancelRun("sleep");

        PipelineResult result = run.getCompletion().get(10, TimeUnit.SECONDS);
        assertEquals(PipelineStatus.CANCELLED, result.getStatus());
        long deadline = System.currentTimeMillis() + 5000;
        while (scheduler.getBusyWorkers() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertEquals(0, scheduler.getBusyWorkers());
        assertEquals(List.of("start"), executor.getTranscript("sleep", "wait"));
    }
}
