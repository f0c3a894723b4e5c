package com.ciflow.core;

/**
 * Thrown when a pipeline definition cannot be loaded: malformed document, dangling
 * {@code needs} reference, undefined matrix axis, bad condition expression, unknown
 * required job, or an artifact input no upstream job produces.
 *
 * <p>This is a fatal pre-run error. Nothing is scheduled for a definition that fails to load.</p>
 */
public class DefinitionException extends PipelineException {

    public DefinitionException(String message) {
        super(message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
