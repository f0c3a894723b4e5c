package com.ciflow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A concrete job of one run: a template bound to one matrix combination (or to none).
 *
 * <p>The id is the template id for plain jobs and {@code templateId[axis=value,...]} for matrix
 * instances. It is a pure function of the template and the combination, so re-dispatching the
 * same run yields the same ids.</p>
 */
public final class JobInstance {
    private final String id;
    private final JobTemplate template;
    private final Map<String, String> matrixValues;
    private final String displayName;

    public JobInstance(String id, JobTemplate template, Map<String, String> matrixValues, String displayName) {
        this.id = id;
        this.template = template;
        this.matrixValues = Collections.unmodifiableMap(new LinkedHashMap<>(matrixValues));
        this.displayName = displayName != null ? displayName : id;
    }

    /**
     * Instance of a template without a matrix.
     */
    public static JobInstance single(JobTemplate template, String displayName) {
        return new JobInstance(template.getId(), template, Map.of(), displayName);
    }

    public String getId() {
        return id;
    }

    public JobTemplate getTemplate() {
        return template;
    }

    public String getTemplateId() {
        return template.getId();
    }

    public Map<String, String> getMatrixValues() {
        return matrixValues;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return true when this instance came out of a matrix expansion
     */
    public boolean isMatrixInstance() {
        return template.hasMatrix();
    }

    @Override
    public String toString() {
        return id;
    }
}
