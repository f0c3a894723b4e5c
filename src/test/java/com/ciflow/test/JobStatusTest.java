package com.ciflow.test;

import com.ciflow.core.JobStatus;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the job state machine.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class JobStatusTest {

    /**
     * Test 1: Legal transitions out of PENDING and RUNNING.
     */
    @Test
    @Order(1)
    public void testLegalTransitions() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.SKIPPED));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.CANCELLED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.SUCCEEDED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.CANCELLED));

        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.SUCCEEDED));
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.SKIPPED));
    }

    /**
     * Test 2: Terminal states never change.
     */
    @Test
    @Order(2)
    public void testTerminalStatesAreFinal() {
        for (JobStatus terminal : List.of(JobStatus.SUCCEEDED, JobStatus.FAILED, JobStatus.SKIPPED,
                JobStatus.CANCELLED)) {
            assertTrue(terminal.isTerminal());
            for (JobStatus target : JobStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
        assertFalse(JobStatus.PENDING.isTerminal());
        assertFalse(JobStatus.RUNNING.isTerminal());
    }

    /**
     * Test 3: Matrix instance statuses combine into one template result.
     */
    @Test
    @Order(3)
    public void testCombine() {
        assertEquals(JobStatus.FAILED,
                JobStatus.combine(List.of(JobStatus.SUCCEEDED, JobStatus.FAILED, JobStatus.CANCELLED)));
        assertEquals(JobStatus.CANCELLED, JobStatus.combine(List.of(JobStatus.SUCCEEDED, JobStatus.CANCELLED)));
        assertEquals(JobStatus.RUNNING, JobStatus.combine(List.of(JobStatus.SUCCEEDED, JobStatus.RUNNING)));
        assertEquals(JobStatus.PENDING, JobStatus.combine(List.of(JobStatus.SUCCEEDED, JobStatus.PENDING)));
        assertEquals(JobStatus.SKIPPED, JobStatus.combine(List.of(JobStatus.SKIPPED, JobStatus.SKIPPED)));
        assertEquals(JobStatus.SUCCEEDED, JobStatus.combine(List.of(JobStatus.SUCCEEDED, JobStatus.SKIPPED)));
    }

    /**
     * Test 4: Result names used by conditions.
     */
    @Test
    @Order(4)
    public void testResultNames() {
        assertEquals("success", JobStatus.SUCCEEDED.getResultName());
        assertEquals("failure", JobStatus.FAILED.getResultName());
        assertEquals("skipped", JobStatus.SKIPPED.getResultName());
        assertEquals("cancelled", JobStatus.CANCELLED.getResultName());
        assertEquals("Succeeded", JobStatus.SUCCEEDED.toString());
    }
}
