package com.ciflow.expr;

import java.util.List;
import java.util.Locale;

/**
 * Node types of the condition expression tree, plus the coercion rules they share.
 *
 * <p><b>Coercion:</b> null, false, the empty string and 0 are falsy; everything else is truthy.
 * Equality compares the string forms case-insensitively, with null equal to the empty
 * string.</p>
 */
public final class Expressions {

    private Expressions() {
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        return !value.toString().isEmpty();
    }

    public static String asString(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
        }
        return value.toString();
    }

    static boolean looselyEquals(Object left, Object right) {
        return asString(left).toLowerCase(Locale.ROOT).equals(asString(right).toLowerCase(Locale.ROOT));
    }

    /** A string, number, boolean or null literal. */
    public static final class Literal implements Expression {
        private final Object value;

        public Literal(Object value) {
            this.value = value;
        }

        @Override
        public Object evaluate(EvaluationContext context) {
            return value;
        }

        @Override
        public String toString() {
            return value instanceof String ? "'" + value + "'" : String.valueOf(value);
        }
    }

    /** A dotted context path such as {@code matrix.backend}. */
    public static final class PathRef implements Expression {
        private final String path;

        public PathRef(String path) {
            this.path = path;
        }

        public String getPath() {
            return path;
        }

        @Override
        public Object evaluate(EvaluationContext context) {
            return context.lookup(path);
        }

        @Override
        public String toString() {
            return path;
        }
    }

    /** {@code ==} and {@code !=}. */
    public static final class Comparison implements Expression {
        private final Expression left;
        private final Expression right;
        private final boolean negated;

        public Comparison(Expression left, Expression right, boolean negated) {
            this.left = left;
            this.right = right;
            this.negated = negated;
        }

        @Override
        public Object evaluate(EvaluationContext context) {
            boolean equal = looselyEquals(left.evaluate(context), right.evaluate(context));
            return negated != equal;
        }

        @Override
        public boolean usesStatusFunction() {
            return left.usesStatusFunction() || right.usesStatusFunction();
        }

        @Override
        public String toString() {
            return "(" + left + (negated ? " != " : " == ") + right + ")";
        }
    }

    /**
     * {@code &&} and {@code ||}. Both short-circuit and yield the deciding operand's value,
     * so {@code head_ref || run_id} evaluates to a string.
     */
    public static final class Logical implements Expression {
        private final Expression left;
        private final Expression right;
        private final boolean conjunction;

        public Logical(Expression left, Expression right, boolean conjunction) {
            this.left = left;
            this.right = right;
            this.conjunction = conjunction;
        }

        @Override
        public Object evaluate(EvaluationContext context) {
            Object leftValue = left.evaluate(context);
            if (conjunction) {
                return isTruthy(leftValue) ? right.evaluate(context) : leftValue;
            }
            return isTruthy(leftValue) ? leftValue : right.evaluate(context);
        }

        @Override
        public boolean usesStatusFunction() {
            return left.usesStatusFunction() || right.usesStatusFunction();
        }

        @Override
        public String toString() {
            return "(" + left + (conjunction ? " && " : " || ") + right + ")";
        }
    }

    /** {@code !expr}. */
    public static final class Not implements Expression {
        private final Expression operand;

        public Not(Expression operand) {
            this.operand = operand;
        }

        @Override
        public Object evaluate(EvaluationContext context) {
            return !isTruthy(operand.evaluate(context));
        }

        @Override
        public boolean usesStatusFunction() {
            return operand.usesStatusFunction();
        }

        @Override
        public String toString() {
            return "!" + operand;
        }
    }

    /** A call to one of the built-in functions. */
    public static final class FunctionCall implements Expression {
        private final String name;
        private final List<Expression> args;

        public FunctionCall(String name, List<Expression> args) {
            this.name = name;
            this.args = List.copyOf(args);
        }

        static boolean isStatusFunction(String name) {
            return name.equals("success") || name.equals("failure")
                    || name.equals("always") || name.equals("cancelled");
        }

        static int arity(String name) {
            if (isStatusFunction(name)) {
                return 0;
            }
            return switch (name) {
                case "contains", "startsWith", "endsWith" -> 2;
                default -> -1;
            };
        }

        @Override
        public Object evaluate(EvaluationContext context) {
            switch (name) {
                case "success":
                    return context.success();
                case "failure":
                    return context.failure();
                case "cancelled":
                    return context.cancelled();
                case "always":
                    return true;
                default:
                    break;
            }
            String first = asString(args.get(0).evaluate(context)).toLowerCase(Locale.ROOT);
            String second = asString(args.get(1).evaluate(context)).toLowerCase(Locale.ROOT);
            return switch (name) {
                case "contains" -> first.contains(second);
                case "startsWith" -> first.startsWith(second);
                case "endsWith" -> first.endsWith(second);
                default -> throw new IllegalStateException("Unknown function " + name);
            };
        }

        @Override
        public boolean usesStatusFunction() {
            return isStatusFunction(name) || args.stream().anyMatch(Expression::usesStatusFunction);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(name).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(args.get(i));
            }
            return sb.append(')').toString();
        }
    }
}
