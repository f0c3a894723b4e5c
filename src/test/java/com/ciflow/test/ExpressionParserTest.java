package com.ciflow.test;

import com.ciflow.core.DefinitionException;
import com.ciflow.core.JobStatus;
import com.ciflow.core.RunContext;
import com.ciflow.expr.EvaluationContext;
import com.ciflow.expr.Expression;
import com.ciflow.expr.ExpressionParser;
import com.ciflow.expr.Template;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for condition expressions and string templates.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class ExpressionParserTest {

    private RunContext pullRequest;

    @BeforeEach
    public void setUp() {
        pullRequest = RunContext.builder()
                .runId("42")
                .pipeline("L1")
                .trigger("pull_request")
                .branch("feature/hive")
                .headRef("feature/hive")
                .var("release", "false")
                .build();
    }

    /**
     * Test 1: Comparisons against run metadata.
     */
    @Test
    @Order(1)
    public void testComparisons() {
        EvaluationContext context = EvaluationContext.of(pullRequest);

        assertTrue(ExpressionParser.parse("trigger == 'pull_request'").test(context));
        assertTrue(ExpressionParser.parse("trigger != 'merge_group'").test(context));
        assertTrue(ExpressionParser.parse("TRIGGER_UNKNOWN == ''").test(context), "Unknown paths are null");
        assertTrue(ExpressionParser.parse("branch == 'FEATURE/HIVE'").test(context), "Equality ignores case");
        assertFalse(ExpressionParser.parse("vars.release == 'true'").test(context));
    }

    /**
     * Test 2: Logical operators short-circuit and yield operand values.
     */
    @Test
    @Order(2)
    public void testLogicalOperators() {
        EvaluationContext context = EvaluationContext.of(pullRequest);

        assertTrue(ExpressionParser.parse("trigger == 'push' || branch == 'feature/hive'").test(context));
        assertFalse(ExpressionParser.parse("trigger == 'push' && branch == 'feature/hive'").test(context));
        assertTrue(ExpressionParser.parse("!(trigger == 'push')").test(context));
        assertEquals("feature/hive", ExpressionParser.parse("head_ref || run_id").evaluate(context));

        RunContext push = RunContext.builder().runId("7").trigger("push").branch("main").build();
        assertEquals("7", ExpressionParser.parse("head_ref || run_id").evaluate(EvaluationContext.of(push)));
    }

    /**
     * Test 3: String functions.
     */
    @Test
    @Order(3)
    public void testFunctions() {
        EvaluationContext context = EvaluationContext.of(pullRequest);

        assertTrue(ExpressionParser.parse("startsWith(branch, 'feature/')").test(context));
        assertTrue(ExpressionParser.parse("contains(branch, 'HIVE')").test(context));
        assertFalse(ExpressionParser.parse("endsWith(branch, 'main')").test(context));
    }

    /**
     * Test 4: Status functions follow the dependency results.
     */
    @Test
    @Order(4)
    public void testStatusFunctions() {
        EvaluationContext clean = EvaluationContext.builder(pullRequest)
                .need("build", JobStatus.SUCCEEDED)
                .build();
        EvaluationContext failed = EvaluationContext.builder(pullRequest)
                .need("build", JobStatus.FAILED)
                .upstreamFailed(true)
                .build();
        EvaluationContext skipped = EvaluationContext.builder(pullRequest)
                .need("build", JobStatus.SKIPPED)
                .build();

        Expression success = ExpressionParser.parse("success()");
        Expression failure = ExpressionParser.parse("failure()");
        Expression always = ExpressionParser.parse("always()");

        assertTrue(success.test(clean));
        assertFalse(success.test(failed));
        assertFalse(success.test(skipped), "A skipped need is not a success");
        assertTrue(failure.test(failed));
        assertFalse(failure.test(clean));
        assertTrue(always.test(failed));

        assertTrue(success.usesStatusFunction());
        assertTrue(ExpressionParser.parse("always() && trigger == 'push'").usesStatusFunction());
        assertFalse(ExpressionParser.parse("trigger == 'push'").usesStatusFunction());
    }

    /**
     * Test 5: Dependency results and matrix values are addressable by path.
     */
    @Test
    @Order(5)
    public void testNeedsAndMatrixPaths() {
        EvaluationContext context = EvaluationContext.builder(pullRequest)
                .matrix(Map.of("backend", "sp1"))
                .env(Map.of("PROVER", "exec"))
                .need("run_hive", JobStatus.FAILED)
                .need("run_assertoor", JobStatus.SKIPPED)
                .build();

        assertTrue(ExpressionParser.parse("needs.run_hive.result == 'failure'").test(context));
        assertTrue(ExpressionParser.parse("needs.run_assertoor.result == 'skipped'").test(context));
        assertTrue(ExpressionParser.parse("matrix.backend == 'sp1' && env.PROVER == 'exec'").test(context));
        assertTrue(ExpressionParser.parse("${{ needs.run_hive.result != 'success' }}").test(context));
    }

    /**
     * Test 6: Malformed expressions are definition errors.
     */
    @Test
    @Order(6)
    public void testMalformedExpressions() {
        for (String source : List.of("", "trigger ==", "trigger = 'push'", "'unterminated", "unknown()",
                "contains(branch)", "(trigger == 'push'", "trigger == 'push' 'extra'")) {
            assertThrows(DefinitionException.class, () -> ExpressionParser.parse(source), source);
        }
    }

    /**
     * Test 7: Templates interpolate expressions into text.
     */
    @Test
    @Order(7)
    public void testTemplates() {
        Template key = Template.parse("${{ pipeline }}-${{ head_ref || run_id }}");
        assertTrue(key.isDynamic());
        assertEquals("L1-feature/hive", key.render(EvaluationContext.of(pullRequest)));

        Template name = Template.parse("Hive - ${{ matrix.name }}");
        EvaluationContext context = EvaluationContext.builder(pullRequest)
                .matrix(Map.of("name", "Sync full"))
                .build();
        assertEquals("Hive - Sync full", name.render(context));

        assertFalse(Template.parse("plain text").isDynamic());
        assertThrows(DefinitionException.class, () -> Template.parse("broken ${{ matrix.name"));
    }
}
