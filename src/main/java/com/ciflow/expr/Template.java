package com.ciflow.expr;

import com.ciflow.core.DefinitionException;

import java.util.ArrayList;
import java.util.List;

/**
 * A string with {@code ${{ expr }}} interpolations, e.g. {@code "Hive - ${{ matrix.name }}"} or
 * {@code "${{ pipeline }}-${{ head_ref || run_id }}"}.
 *
 * <p>Templates are parsed once when the definition loads and rendered per run or per job
 * instance.</p>
 */
public final class Template {
    private final String source;
    private final List<Object> parts;

    private Template(String source, List<Object> parts) {
        this.source = source;
        this.parts = parts;
    }

    /**
     * Parse a template.
     *
     * @param source the template text
     * @return the parsed template
     * @throws DefinitionException on an unterminated interpolation or a bad expression
     */
    public static Template parse(String source) {
        List<Object> parts = new ArrayList<>();
        int cursor = 0;
        while (cursor < source.length()) {
            int open = source.indexOf("${{", cursor);
            if (open < 0) {
                parts.add(source.substring(cursor));
                break;
            }
            if (open > cursor) {
                parts.add(source.substring(cursor, open));
            }
            int close = source.indexOf("}}", open + 3);
            if (close < 0) {
                throw new DefinitionException("Unterminated '${{' in template: " + source);
            }
            parts.add(ExpressionParser.parse(source.substring(open + 3, close)));
            cursor = close + 2;
        }
        return new Template(source, parts);
    }

    public String render(EvaluationContext context) {
        StringBuilder sb = new StringBuilder();
        for (Object part : parts) {
            if (part instanceof Expression) {
                sb.append(Expressions.asString(((Expression) part).evaluate(context)));
            } else {
                sb.append(part);
            }
        }
        return sb.toString();
    }

    /**
     * @return true when the template contains at least one interpolation
     */
    public boolean isDynamic() {
        return parts.stream().anyMatch(part -> part instanceof Expression);
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }
}
