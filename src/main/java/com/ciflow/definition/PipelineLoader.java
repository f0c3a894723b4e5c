package com.ciflow.definition;

import com.ciflow.core.ConcurrencyGroup;
import com.ciflow.core.DefinitionException;
import com.ciflow.core.JobTemplate;
import com.ciflow.core.Matrix;
import com.ciflow.core.RequiredCheck;
import com.ciflow.core.Step;
import com.ciflow.expr.Expression;
import com.ciflow.expr.ExpressionParser;
import com.ciflow.expr.Template;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Reads pipeline definition documents (JSON) into validated {@link PipelineDefinition}s.
 *
 * <p>The document is bound with Gson onto the plain document classes below, then converted
 * into the immutable model. Every problem is reported as a {@link DefinitionException} before
 * anything is scheduled; a dependency cycle surfaces as a
 * {@link com.ciflow.core.CycleException}.</p>
 *
 * <p><b>Document shape:</b></p>
 * <pre>{@code
 * {
 *   "name": "L1",
 *   "on": [ {"event": "push", "branches": ["main"]},
 *           {"event": "pull_request", "pathsIgnore": ["crates/l2/**"]} ],
 *   "concurrency": {"group": "${{ pipeline }}-${{ head_ref || run_id }}", "cancelInProgress": true},
 *   "jobs": {
 *     "docker_build": {"name": "Build Docker", "steps": [{"run": "docker build"}], "outputs": ["image"]},
 *     "hive": {"needs": ["docker_build"], "inputs": ["image"],
 *              "if": "trigger != 'merge_group'",
 *              "strategy": {"failFast": false, "matrix": {"include": [{"name": "Sync full"}]}}}
 *   },
 *   "required": ["docker_build", {"job": "hive", "allowSkipped": true}]
 * }
 * }</pre>
 */
public class PipelineLoader {
    private static final Logger logger = Logger.getLogger(PipelineLoader.class.getName());

    private static final Pattern JOB_ID = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    private final Gson gson = new Gson();

    // ==================== DOCUMENT CLASSES ====================

    static class PipelineDocument {
        String name;
        JsonElement on;
        Map<String, String> env;
        ConcurrencyDocument concurrency;
        Map<String, JobDocument> jobs;
        List<JsonElement> required;
    }

    static class TriggerDocument {
        String event;
        List<String> branches;
        List<String> paths;
        List<String> pathsIgnore;
    }

    static class ConcurrencyDocument {
        String group;
        boolean cancelInProgress;
    }

    static class JobDocument {
        String name;
        JsonElement needs;
        @SerializedName("if")
        String condition;
        List<StepDocument> steps;
        List<String> outputs;
        List<String> inputs;
        boolean allowSkippedNeeds;
        String timeout;
        Double timeoutMinutes;
        StrategyDocument strategy;
    }

    static class StepDocument {
        String name;
        String run;
        @SerializedName("if")
        String condition;
    }

    static class StrategyDocument {
        Boolean failFast;
        JsonObject matrix;
    }

    // ==================== ENTRY POINTS ====================

    public PipelineDefinition load(String json) {
        return load(new StringReader(json));
    }

    public PipelineDefinition load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    /**
     * Load a definition bundled on the classpath.
     *
     * @param resource resource name, e.g. {@code pipelines/l1.json}
     * @throws DefinitionException if the resource is missing or invalid
     */
    public PipelineDefinition loadResource(String resource) {
        InputStream in = PipelineLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new DefinitionException("Pipeline resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new DefinitionException("Failed to read pipeline resource " + resource, e);
        }
    }

    /**
     * Parse and validate a definition document.
     *
     * @param reader the JSON document
     * @return the validated definition
     * @throws DefinitionException             on any malformed or inconsistent content
     * @throws com.ciflow.core.CycleException when the needs graph has a cycle
     */
    public PipelineDefinition load(Reader reader) {
        PipelineDocument document;
        try {
            document = gson.fromJson(reader, PipelineDocument.class);
        } catch (JsonParseException e) {
            throw new DefinitionException("Malformed pipeline document: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new DefinitionException("Empty pipeline document");
        }
        if (document.name == null || document.name.isBlank()) {
            throw new DefinitionException("Pipeline document has no name");
        }
        if (document.jobs == null || document.jobs.isEmpty()) {
            throw new DefinitionException("Pipeline " + document.name + " declares no jobs");
        }

        PipelineDefinition.Builder builder = PipelineDefinition.builder(document.name);
        for (Trigger trigger : toTriggers(document.on)) {
            builder.trigger(trigger);
        }
        if (document.env != null) {
            for (Map.Entry<String, String> entry : document.env.entrySet()) {
                if (entry.getValue() == null) {
                    throw new DefinitionException("Environment variable '" + entry.getKey() + "' of "
                            + document.name + " has no value");
                }
                builder.env(entry.getKey(), entry.getValue());
            }
        }
        if (document.concurrency != null) {
            if (document.concurrency.group == null || document.concurrency.group.isBlank()) {
                throw new DefinitionException("Concurrency block of " + document.name + " has no group");
            }
            builder.concurrency(new ConcurrencyGroup(Template.parse(document.concurrency.group),
                    document.concurrency.cancelInProgress));
        }
        for (Map.Entry<String, JobDocument> entry : document.jobs.entrySet()) {
            builder.job(toJob(entry.getKey(), entry.getValue()));
        }
        if (document.required != null) {
            for (JsonElement element : document.required) {
                builder.required(toRequired(element));
            }
        }

        PipelineDefinition definition = builder.build();
        logger.info("Loaded pipeline " + definition.getName() + " with " + definition.getJobs().size()
                + " jobs and " + definition.getRequired().size() + " required checks");
        return definition;
    }

    // ==================== CONVERSION ====================

    private List<Trigger> toTriggers(JsonElement on) {
        List<Trigger> triggers = new ArrayList<>();
        if (on == null || on.isJsonNull()) {
            return triggers;
        }
        if (on.isJsonPrimitive()) {
            triggers.add(Trigger.on(on.getAsString()));
            return triggers;
        }
        if (!on.isJsonArray()) {
            throw new DefinitionException("'on' must be an event name or a list of triggers");
        }
        for (JsonElement element : on.getAsJsonArray()) {
            if (element == null || element.isJsonNull()) {
                throw new DefinitionException("'on' contains an empty trigger");
            }
            if (element.isJsonPrimitive()) {
                triggers.add(Trigger.on(element.getAsString()));
                continue;
            }
            TriggerDocument doc;
            try {
                doc = gson.fromJson(element, TriggerDocument.class);
            } catch (JsonParseException e) {
                throw new DefinitionException("Malformed trigger " + element + ": " + e.getMessage(), e);
            }
            if (doc == null || doc.event == null) {
                throw new DefinitionException("Trigger without event: " + element);
            }
            String where = "trigger " + doc.event;
            triggers.add(new Trigger(doc.event, strings(where, "branches", doc.branches),
                    strings(where, "paths", doc.paths), strings(where, "pathsIgnore", doc.pathsIgnore)));
        }
        return triggers;
    }

    private JobTemplate toJob(String id, JobDocument doc) {
        if (!JOB_ID.matcher(id).matches()) {
            throw new DefinitionException("Invalid job id '" + id + "'");
        }
        if (doc == null) {
            throw new DefinitionException("Job '" + id + "' has no body");
        }

        JobTemplate.Builder builder = JobTemplate.builder(id)
                .needs(toNeeds(id, doc.needs))
                .allowSkippedNeeds(doc.allowSkippedNeeds);
        if (doc.name != null) {
            builder.name(Template.parse(doc.name));
        }
        if (doc.condition != null) {
            builder.condition(parseCondition(id, doc.condition));
        }
        if (doc.steps != null) {
            for (StepDocument step : doc.steps) {
                if (step == null) {
                    throw new DefinitionException("Job '" + id + "' has an empty step");
                }
                if (step.run == null) {
                    throw new DefinitionException("Step of job '" + id + "' has no run command");
                }
                Expression condition = step.condition == null ? null : parseCondition(id, step.condition);
                builder.step(new Step(step.name, step.run, condition));
            }
        }
        strings("job '" + id + "'", "outputs", doc.outputs).forEach(builder::output);
        strings("job '" + id + "'", "inputs", doc.inputs).forEach(builder::input);
        builder.timeout(toTimeout(id, doc));
        if (doc.strategy != null && doc.strategy.matrix != null) {
            builder.matrix(toMatrix(id, doc.strategy));
        }
        return builder.build();
    }

    private List<String> toNeeds(String id, JsonElement needs) {
        List<String> result = new ArrayList<>();
        if (needs == null || needs.isJsonNull()) {
            return result;
        }
        if (needs.isJsonPrimitive()) {
            result.add(needs.getAsString());
        } else if (needs.isJsonArray()) {
            for (JsonElement need : needs.getAsJsonArray()) {
                if (!need.isJsonPrimitive()) {
                    throw new DefinitionException("'needs' of job '" + id + "' must only contain job ids");
                }
                result.add(need.getAsString());
            }
        } else {
            throw new DefinitionException("'needs' of job '" + id + "' must be a job id or a list of job ids");
        }
        return result;
    }

    private Expression parseCondition(String jobId, String source) {
        try {
            return ExpressionParser.parse(source);
        } catch (DefinitionException e) {
            throw new DefinitionException("Invalid condition in job '" + jobId + "': " + e.getMessage(), e);
        }
    }

    private Duration toTimeout(String id, JobDocument doc) {
        if (doc.timeout != null) {
            try {
                return Duration.parse(doc.timeout);
            } catch (DateTimeParseException e) {
                throw new DefinitionException("Invalid timeout '" + doc.timeout + "' in job '" + id + "'", e);
            }
        }
        if (doc.timeoutMinutes != null) {
            if (doc.timeoutMinutes <= 0) {
                throw new DefinitionException("timeoutMinutes of job '" + id + "' must be positive");
            }
            return Duration.ofMillis(Math.round(doc.timeoutMinutes * 60_000));
        }
        return null;
    }

    private Matrix toMatrix(String id, StrategyDocument strategy) {
        Matrix.Builder builder = Matrix.builder();
        if (strategy.failFast != null) {
            builder.failFast(strategy.failFast);
        }

        List<Map<String, String>> excludes = new ArrayList<>();
        for (Map.Entry<String, JsonElement> entry : strategy.matrix.entrySet()) {
            String key = entry.getKey();
            JsonElement value = entry.getValue();
            if (key.equals("include")) {
                toEntries(id, key, value).forEach(builder::include);
            } else if (key.equals("exclude")) {
                excludes.addAll(toEntries(id, key, value));
            } else {
                if (!value.isJsonArray()) {
                    throw new DefinitionException("Matrix axis '" + key + "' of job '" + id + "' must be a list");
                }
                List<String> values = new ArrayList<>();
                for (JsonElement item : value.getAsJsonArray()) {
                    values.add(scalar(id, key, item));
                }
                builder.axis(key, values);
            }
        }

        Matrix partial = builder.build();
        for (Map<String, String> exclude : excludes) {
            for (String axis : exclude.keySet()) {
                if (!partial.getAxes().containsKey(axis)) {
                    throw new DefinitionException("Exclude entry of job '" + id + "' references undefined matrix axis '"
                            + axis + "'");
                }
            }
            builder.exclude(exclude);
        }
        return builder.build();
    }

    private List<Map<String, String>> toEntries(String id, String key, JsonElement value) {
        if (!value.isJsonArray()) {
            throw new DefinitionException("Matrix '" + key + "' of job '" + id + "' must be a list of objects");
        }
        List<Map<String, String>> entries = new ArrayList<>();
        JsonArray array = value.getAsJsonArray();
        for (JsonElement element : array) {
            if (!element.isJsonObject()) {
                throw new DefinitionException("Matrix '" + key + "' of job '" + id + "' must be a list of objects");
            }
            Map<String, String> entry = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> field : element.getAsJsonObject().entrySet()) {
                entry.put(field.getKey(), scalar(id, field.getKey(), field.getValue()));
            }
            entries.add(entry);
        }
        return entries;
    }

    private static String scalar(String id, String key, JsonElement element) {
        if (!element.isJsonPrimitive()) {
            throw new DefinitionException("Matrix value '" + key + "' of job '" + id + "' must be a scalar");
        }
        return element.getAsString();
    }

    private RequiredCheck toRequired(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            throw new DefinitionException("'required' contains an empty check");
        }
        if (element.isJsonPrimitive()) {
            return RequiredCheck.of(element.getAsString());
        }
        if (element.isJsonObject()) {
            JsonObject object = element.getAsJsonObject();
            JsonElement job = object.get("job");
            if (job == null || !job.isJsonPrimitive()) {
                throw new DefinitionException("Required check without job id: " + element);
            }
            JsonElement allowSkipped = object.get("allowSkipped");
            if (allowSkipped != null && !(allowSkipped.isJsonPrimitive() && allowSkipped.getAsJsonPrimitive().isBoolean())) {
                throw new DefinitionException("'allowSkipped' of required check " + job.getAsString()
                        + " must be true or false");
            }
            return new RequiredCheck(job.getAsString(), allowSkipped != null && allowSkipped.getAsBoolean());
        }
        throw new DefinitionException("Required check must be a job id or an object: " + element);
    }

    private static List<String> strings(String owner, String field, List<String> values) {
        if (values == null) {
            return List.of();
        }
        if (values.contains(null)) {
            throw new DefinitionException("'" + field + "' of " + owner + " contains an empty entry");
        }
        return values;
    }
}
