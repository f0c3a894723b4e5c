package com.ciflow.executors;

/**
 * Thrown by a scripted step that fails on purpose or cannot be understood.
 */
public class StepFailedException extends Exception {

    public StepFailedException(String message) {
        super(message);
    }
}
