package com.ciflow.core;

/**
 * Base class for every error raised by the pipeline engine.
 *
 * <p>Errors fall in two groups:</p>
 * <ul>
 *   <li><b>Pre-run</b> ({@link DefinitionException}, {@link CycleException}): the run is aborted
 *       before any job is dispatched and the message is surfaced verbatim to the caller.</li>
 *   <li><b>Per-job</b> ({@link ExpansionException}, {@link JobTimeoutException} and the artifact
 *       exceptions): the offending job is marked failed and its dependents are skipped.</li>
 * </ul>
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
