package com.ciflow.core;

import com.ciflow.expr.Expression;

/**
 * One opaque command of a job. The engine never interprets {@code run}; it is handed to the
 * {@code JobExecutor}.
 */
public final class Step {
    private final String name;
    private final String run;
    private final Expression condition;

    /**
     * @param name      display name, may be null
     * @param run       the command text
     * @param condition step condition, null meaning {@code success()}
     */
    public Step(String name, String run, Expression condition) {
        this.name = name;
        this.run = run;
        this.condition = condition;
    }

    public static Step of(String run) {
        return new Step(null, run, null);
    }

    public String getName() {
        return name != null ? name : run;
    }

    public String getRun() {
        return run;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public String toString() {
        return getName();
    }
}
