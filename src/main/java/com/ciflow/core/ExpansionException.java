package com.ciflow.core;

/**
 * Thrown when a matrix cannot be expanded into job instances (an axis without values, every
 * combination excluded, or too many combinations).
 *
 * <p>The error is fatal for the affected matrix only: the run records the template as a single
 * failed job and the rest of the pipeline continues.</p>
 */
public class ExpansionException extends PipelineException {

    private final String templateId;

    public ExpansionException(String templateId, String message) {
        super("Cannot expand matrix of job '" + templateId + "': " + message);
        this.templateId = templateId;
    }

    /**
     * @return the id of the job template whose matrix failed to expand
     */
    public String getTemplateId() {
        return templateId;
    }
}
