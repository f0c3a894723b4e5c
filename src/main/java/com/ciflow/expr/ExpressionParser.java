package com.ciflow.expr;

import com.ciflow.core.DefinitionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for condition expressions.
 *
 * <p><b>Grammar:</b></p>
 * <pre>
 * expr       := or
 * or         := and ( '||' and )*
 * and        := unary ( '&amp;&amp;' unary )*
 * unary      := '!' unary | comparison
 * comparison := primary ( ( '==' | '!=' ) primary )?
 * primary    := STRING | NUMBER | 'true' | 'false' | 'null'
 *             | '(' expr ')' | IDENT '(' args ')' | PATH
 * </pre>
 *
 * <p>A source wrapped in {@code ${{ ... }}} is unwrapped first. Any syntax error is reported as
 * a {@link DefinitionException} naming the offending position.</p>
 */
public final class ExpressionParser {

    private enum Kind { STRING, NUMBER, PATH, OP, END }

    private static final class Token {
        final Kind kind;
        final String text;
        final int position;

        Token(Kind kind, String text, int position) {
            this.kind = kind;
            this.text = text;
            this.position = position;
        }
    }

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    /**
     * Parse an expression.
     *
     * @param source the expression text, optionally wrapped in {@code ${{ }}}
     * @return the expression tree
     * @throws DefinitionException if the text is not a valid expression
     */
    public static Expression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new DefinitionException("Empty expression");
        }
        String text = unwrap(source.trim());
        ExpressionParser parser = new ExpressionParser(text);
        Expression expression = parser.parseOr();
        Token trailing = parser.peek();
        if (trailing.kind != Kind.END) {
            throw parser.error("Unexpected '" + trailing.text + "'", trailing);
        }
        return expression;
    }

    static String unwrap(String text) {
        if (text.startsWith("${{") && text.endsWith("}}")) {
            return text.substring(3, text.length() - 2).trim();
        }
        return text;
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (acceptOp("||")) {
            left = new Expressions.Logical(left, parseAnd(), false);
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseUnary();
        while (acceptOp("&&")) {
            left = new Expressions.Logical(left, parseUnary(), true);
        }
        return left;
    }

    private Expression parseUnary() {
        if (acceptOp("!")) {
            return new Expressions.Not(parseUnary());
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parsePrimary();
        if (acceptOp("==")) {
            return new Expressions.Comparison(left, parsePrimary(), false);
        }
        if (acceptOp("!=")) {
            return new Expressions.Comparison(left, parsePrimary(), true);
        }
        return left;
    }

    private Expression parsePrimary() {
        Token token = next();
        switch (token.kind) {
            case STRING:
                return new Expressions.Literal(token.text);
            case NUMBER:
                return new Expressions.Literal(Double.parseDouble(token.text));
            case OP:
                if (token.text.equals("(")) {
                    Expression inner = parseOr();
                    expectOp(")");
                    return inner;
                }
                throw error("Unexpected '" + token.text + "'", token);
            case PATH:
                return parsePathOrCall(token);
            default:
                throw error("Unexpected end of expression", token);
        }
    }

    private Expression parsePathOrCall(Token token) {
        switch (token.text) {
            case "true":
                return new Expressions.Literal(Boolean.TRUE);
            case "false":
                return new Expressions.Literal(Boolean.FALSE);
            case "null":
                return new Expressions.Literal(null);
            default:
                break;
        }
        if (!acceptOp("(")) {
            return new Expressions.PathRef(token.text);
        }

        List<Expression> args = new ArrayList<>();
        if (!acceptOp(")")) {
            do {
                args.add(parseOr());
            } while (acceptOp(","));
            expectOp(")");
        }

        int arity = Expressions.FunctionCall.arity(token.text);
        if (arity < 0) {
            throw error("Unknown function '" + token.text + "'", token);
        }
        if (arity != args.size()) {
            throw error("Function '" + token.text + "' takes " + arity + " argument(s)", token);
        }
        return new Expressions.FunctionCall(token.text, args);
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.kind != Kind.END) {
            index++;
        }
        return token;
    }

    private boolean acceptOp(String op) {
        Token token = peek();
        if (token.kind == Kind.OP && token.text.equals(op)) {
            index++;
            return true;
        }
        return false;
    }

    private void expectOp(String op) {
        Token token = peek();
        if (!acceptOp(op)) {
            throw error("Expected '" + op + "'", token);
        }
    }

    private DefinitionException error(String message, Token token) {
        return new DefinitionException(message + " at position " + token.position
                + " in expression: " + source);
    }

    private static List<Token> tokenize(String text) {
        List<Token> result = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;

            if (c == '\'') {
                // '' escapes a single quote inside a literal
                StringBuilder literal = new StringBuilder();
                i++;
                while (true) {
                    if (i >= text.length()) {
                        throw new DefinitionException("Unterminated string at position " + start
                                + " in expression: " + text);
                    }
                    char ch = text.charAt(i);
                    if (ch == '\'') {
                        if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                            literal.append('\'');
                            i += 2;
                            continue;
                        }
                        i++;
                        break;
                    }
                    literal.append(ch);
                    i++;
                }
                result.add(new Token(Kind.STRING, literal.toString(), start));
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < text.length()
                    && Character.isDigit(text.charAt(i + 1)))) {
                i++;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                result.add(new Token(Kind.NUMBER, text.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                while (i < text.length() && isPathChar(text.charAt(i))) {
                    i++;
                }
                String path = text.substring(start, i);
                if (path.endsWith(".")) {
                    throw new DefinitionException("Malformed path '" + path + "' at position " + start
                            + " in expression: " + text);
                }
                result.add(new Token(Kind.PATH, path, start));
            } else {
                String two = i + 1 < text.length() ? text.substring(i, i + 2) : "";
                if (two.equals("==") || two.equals("!=") || two.equals("&&") || two.equals("||")) {
                    result.add(new Token(Kind.OP, two, start));
                    i += 2;
                } else if (c == '!' || c == '(' || c == ')' || c == ',') {
                    result.add(new Token(Kind.OP, String.valueOf(c), start));
                    i++;
                } else {
                    throw new DefinitionException("Unexpected character '" + c + "' at position " + start
                            + " in expression: " + text);
                }
            }
        }
        result.add(new Token(Kind.END, "<end>", text.length()));
        return result;
    }

    private static boolean isPathChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }
}
