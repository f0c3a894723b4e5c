package com.ciflow.executors;

import com.ciflow.artifact.ArtifactStore;
import com.ciflow.core.Step;
import com.ciflow.engine.JobContext;
import com.ciflow.engine.StepwiseExecutor;
import com.ciflow.expr.Template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Executor interpreting step commands as a small simulation script, for demos and tests.
 *
 * <p>Each non-blank line of a step's {@code run} is one command, after {@code ${{ }}}
 * interpolation against the job's matrix, env and run metadata:</p>
 * <ul>
 *   <li>{@code echo <text>}: write a line of output</li>
 *   <li>{@code sleep <ms>}: wait, responding to cancellation</li>
 *   <li>{@code fail <message>}: fail the step</li>
 *   <li>{@code upload <name> <text>}: store a text artifact</li>
 *   <li>{@code download <name>}: fetch an artifact and echo its content</li>
 * </ul>
 *
 * <p>Output is kept per run and job, see {@link #getTranscript(String, String)}.</p>
 */
public class ScriptedExecutor extends StepwiseExecutor {
    private static final Logger logger = Logger.getLogger(ScriptedExecutor.class.getName());
    private static final long SLEEP_SLICE_MS = 50;

    private final Map<String, List<String>> transcripts = new ConcurrentHashMap<>();

    @Override
    protected void runStep(JobContext context, Step step) throws Exception {
        String script = Template.parse(step.getRun()).render(context.evaluationContext(false));
        for (String rawLine : script.split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            context.throwIfCancelled();
            runCommand(context, line);
        }
    }

    private void runCommand(JobContext context, String line) throws Exception {
        String[] parts = line.split("\\s+", 2);
        String argument = parts.length > 1 ? parts[1] : "";

        switch (parts[0]) {
            case "echo" -> emit(context, argument);
            case "sleep" -> sleep(context, parseMillis(argument));
            case "fail" -> throw new StepFailedException(argument.isEmpty() ? "failed" : argument);
            case "upload" -> {
                String[] upload = argument.split("\\s+", 2);
                if (upload[0].isEmpty()) {
                    throw new StepFailedException("upload needs an artifact name");
                }
                context.putArtifact(upload[0], upload.length > 1 ? upload[1] : "");
            }
            case "download" -> {
                if (argument.isEmpty()) {
                    throw new StepFailedException("download needs an artifact name");
                }
                String content = ArtifactStore.asText(context.getArtifact(argument));
                emit(context, content);
            }
            default -> throw new StepFailedException("Unknown command: " + parts[0]);
        }
    }

    private static long parseMillis(String argument) throws StepFailedException {
        try {
            return Long.parseLong(argument.trim());
        } catch (NumberFormatException e) {
            throw new StepFailedException("sleep needs a duration in milliseconds, got '" + argument + "'");
        }
    }

    private static void sleep(JobContext context, long millis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + millis;
        long remaining = millis;
        while (remaining > 0) {
            context.throwIfCancelled();
            Thread.sleep(Math.min(remaining, SLEEP_SLICE_MS));
            remaining = deadline - System.currentTimeMillis();
        }
    }

    private void emit(JobContext context, String text) {
        transcripts.computeIfAbsent(key(context.getRun().getRunId(), context.getJobId()),
                k -> Collections.synchronizedList(new ArrayList<>())).add(text);
        context.log("INFO", text);
    }

    /**
     * @return lines echoed by a job of a run, empty if it echoed nothing
     */
    public List<String> getTranscript(String runId, String jobId) {
        List<String> lines = transcripts.get(key(runId, jobId));
        if (lines == null) {
            return List.of();
        }
        synchronized (lines) {
            return new ArrayList<>(lines);
        }
    }

    /**
     * Drop the transcripts of a finished run.
     */
    public void forget(String runId) {
        int before = transcripts.size();
        transcripts.keySet().removeIf(key -> key.startsWith(runId + '/'));
        logger.fine("Dropped " + (before - transcripts.size()) + " transcripts of run " + runId);
    }

    private static String key(String runId, String jobId) {
        return runId + '/' + jobId;
    }
}
