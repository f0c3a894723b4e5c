package com.ciflow.graph;

/**
 * Why a job moved from PENDING straight to SKIPPED.
 */
public enum SkipCause {
    CONDITION("condition evaluated to false"),
    DEPENDENCY_FAILED("a dependency failed or was cancelled"),
    DEPENDENCY_SKIPPED("a dependency was skipped");

    private final String description;

    SkipCause(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
