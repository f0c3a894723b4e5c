package com.ciflow.test;

import com.ciflow.aggregate.CheckConclusion;
import com.ciflow.aggregate.CheckResult;
import com.ciflow.aggregate.PipelineResult;
import com.ciflow.aggregate.PipelineStatus;
import com.ciflow.aggregate.RunAggregator;
import com.ciflow.core.JobTemplate;
import com.ciflow.core.Matrix;
import com.ciflow.core.RequiredCheck;
import com.ciflow.core.RunContext;
import com.ciflow.definition.PipelineDefinition;
import com.ciflow.engine.ExecutionResult;
import com.ciflow.engine.PipelineRun;
import com.ciflow.engine.Scheduler;
import com.ciflow.expr.ExpressionParser;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for collapsing a finished run into a pipeline status and check signals.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class RunAggregatorTest {

    private final RunAggregator aggregator = new RunAggregator();
    private Scheduler scheduler;
    private Thread schedulerThread;

    @BeforeEach
    public void setUp() {
        scheduler = new Scheduler(4, context -> {
            if ("sync".equals(context.getMatrixValues().get("sim"))) {
                return ExecutionResult.failure("sync stalled");
            }
            return ExecutionResult.success();
        });
        schedulerThread = scheduler.startInBackground();
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        scheduler.shutdown();
        schedulerThread.join(5000);
    }

    /**
     * Test 1: Failing checks name the failed matrix instance and its message.
     */
    @Test
    @Order(1)
    public void testFailingCheckReason() throws Exception {
        PipelineRun run = runToCompletion(definition());
        PipelineResult result = run.getCompletion().get();

        assertEquals(PipelineStatus.FAILURE, result.getStatus());
        CheckResult hive = result.getCheck("run_hive");
        assertEquals(CheckConclusion.FAIL, hive.getConclusion());
        assertEquals("failure - run_hive[sim=sync]: sync stalled", hive.getReason());
        assertEquals("run_hive: FAIL (failure - run_hive[sim=sync]: sync stalled)", result.getSummary());
    }

    /**
     * Test 2: Single check signals for a finished run.
     */
    @Test
    @Order(2)
    public void testStatusOf() throws Exception {
        PipelineRun run = runToCompletion(definition());

        assertEquals(CheckConclusion.PASS, aggregator.statusOf(run, "lint"));
        assertEquals(CheckConclusion.FAIL, aggregator.statusOf(run, "run_hive"));
        assertEquals(CheckConclusion.PASS, aggregator.statusOf(run, "docs"), "docs may be skipped");
        assertThrows(IllegalArgumentException.class, () -> aggregator.statusOf(run, "deploy"));
    }

    /**
     * Test 3: Aggregating twice gives the same answer.
     */
    @Test
    @Order(3)
    public void testAggregationIsStable() throws Exception {
        PipelineRun run = runToCompletion(definition());

        PipelineResult first = aggregator.aggregate(run);
        PipelineResult second = aggregator.aggregate(run);
        assertEquals(first.getStatus(), second.getStatus());
        assertEquals(first.getSummary(), second.getSummary());
        assertEquals(first.getJobs(), second.getJobs());
    }

    /**
     * Test 4: The JSON rendering carries jobs and checks.
     */
    @Test
    @Order(4)
    public void testJson() throws Exception {
        PipelineResult result = runToCompletion(definition()).getCompletion().get();

        JSONObject json = result.toJson();
        assertEquals("failure", json.getString("status"));
        assertEquals("agg", json.getString("runId"));
        assertEquals("success", json.getJSONObject("jobs").getJSONObject("lint").getString("result"));
        assertEquals("sync stalled",
                json.getJSONObject("jobs").getJSONObject("run_hive[sim=sync]").getString("message"));

        JSONArray checks = json.getJSONArray("checks");
        assertEquals(3, checks.length());
        assertEquals("lint", checks.getJSONObject(0).getString("name"));
        assertEquals("pass", checks.getJSONObject(0).getString("conclusion"));
    }

    /**
     * Test 5: Errors before scheduling are reported as ERROR with the cause as summary.
     */
    @Test
    @Order(5)
    public void testErrorResult() {
        PipelineResult error = PipelineResult.error("r", "L1", new IllegalStateException("broken document"));

        assertEquals(PipelineStatus.ERROR, error.getStatus());
        assertEquals("broken document", error.getSummary());
        assertFalse(error.isSuccess());
        assertTrue(error.getJobs().isEmpty());
    }

    private PipelineRun runToCompletion(PipelineDefinition definition) throws Exception {
        PipelineRun run = scheduler.submit(definition, RunContext.builder().runId("agg").trigger("push").build());
        run.getCompletion().get(10, TimeUnit.SECONDS);
        return run;
    }

    private static PipelineDefinition definition() {
        return PipelineDefinition.builder("aggregation")
                .job(JobTemplate.builder("lint").build())
                .job(JobTemplate.builder("run_hive")
                        .matrix(Matrix.builder().axis("sim", List.of("rpc", "sync")).failFast(false).build())
                        .build())
                .job(JobTemplate.builder("docs")
                        .condition(ExpressionParser.parse("trigger == 'release'")).build())
                .required(RequiredCheck.of("lint"))
                .required(RequiredCheck.of("run_hive"))
                .required(new RequiredCheck("docs", true))
                .build();
    }
}
