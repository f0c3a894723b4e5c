package com.ciflow.aggregate;

/**
 * Single pass/fail signal of a required check, as an external gate consumes it.
 */
public enum CheckConclusion {
    PASS,
    FAIL
}
