package com.ciflow.expr;

/**
 * A node of a parsed condition or template expression.
 *
 * <p>Expressions are immutable trees produced by {@link ExpressionParser}. They are evaluated
 * against an {@link EvaluationContext}; evaluation never mutates the context.</p>
 */
public interface Expression {

    /**
     * Evaluate this expression.
     *
     * @param context run, matrix and dependency data visible to the expression
     * @return a String, Boolean, Double or null
     */
    Object evaluate(EvaluationContext context);

    /**
     * Whether the expression calls one of the status functions ({@code success()},
     * {@code failure()}, {@code always()}, {@code cancelled()}). A job condition that does
     * decides on its own whether the job runs after a failed dependency.
     *
     * @return true if a status function appears anywhere in the tree
     */
    default boolean usesStatusFunction() {
        return false;
    }

    /**
     * Evaluate and coerce the result to a boolean.
     *
     * @param context the evaluation context
     * @return the truthiness of the result
     */
    default boolean test(EvaluationContext context) {
        return Expressions.isTruthy(evaluate(context));
    }
}
