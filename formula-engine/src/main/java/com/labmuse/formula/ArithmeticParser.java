package com.labmuse.formula;

import com.labmuse.util.LoggingUtil;

/**
 * Recursive-descent evaluator for purely numeric arithmetic:
 * {@code + - * /}, parentheses, unary signs and decimal literals.
 * Nothing else is accepted, so substituted formula text can never execute code.
 * Whitespace separates tokens; two numbers with only whitespace between them are rejected.
 * <pre>
 *   expr   := term (('+' | '-') term)*
 *   term   := factor (('*' | '/') factor)*
 *   factor := ('+' | '-') factor | '(' expr ')' | number
 * </pre>
 */
public class ArithmeticParser {

    private final String expr;
    private int pos = 0;

    public ArithmeticParser(String expr) {
        this.expr = expr;
    }

    public double evaluate() {
        if (expr.isBlank()) {
            throw new EvaluationException("Empty arithmetic expression");
        }
        double value = parseExpr();
        skipWhitespace();
        if (pos < expr.length()) {
            throw new EvaluationException("Unexpected '" + current() + "' at position " + pos + " in \"" + expr + "\"");
        }
        return value;
    }

    private double parseExpr() {
        double left = parseTerm();
        while (peek("+") || peek("-")) {
            char op = expr.charAt(pos++);
            double right = parseTerm();
            left = op == '+' ? left + right : left - right;
        }
        return left;
    }

    private double parseTerm() {
        double left = parseFactor();
        while (peek("*") || peek("/")) {
            char op = expr.charAt(pos++);
            double right = parseFactor();
            left = op == '*' ? left * right : left / right;
        }
        return left;
    }

    private double parseFactor() {
        if (match("-")) return -parseFactor();
        if (match("+")) return parseFactor();

        if (match("(")) {
            if (peek(")")) {
                throw new EvaluationException("Empty parentheses at position " + pos + " in \"" + expr + "\"");
            }
            double value = parseExpr();
            if (!match(")")) {
                throw new EvaluationException("Unbalanced parentheses in \"" + expr + "\"");
            }
            return value;
        }

        skipWhitespace();
        if (isNumberStart(current())) return parseNumberLiteral();

        if (pos >= expr.length()) {
            throw new EvaluationException("Unexpected end of expression \"" + expr + "\"");
        }
        throw new EvaluationException("Unexpected '" + current() + "' at position " + pos + " in \"" + expr + "\"");
    }

    private double parseNumberLiteral() {
        int start = pos;
        while (pos < expr.length() && (Character.isDigit(expr.charAt(pos)) || expr.charAt(pos) == '.')) {
            pos++;
        }
        String num = expr.substring(start, pos);
        double value;
        try {
            value = Double.parseDouble(num);
        } catch (NumberFormatException e) {
            LoggingUtil.debug("Malformed number literal '" + num + "'", e);
            throw new EvaluationException("Malformed number '" + num + "' in \"" + expr + "\"", e);
        }
        skipWhitespace();
        if (isNumberStart(current())) {
            throw new EvaluationException("Missing operator after '" + num + "' at position " + pos
                    + " in \"" + expr + "\"");
        }
        return value;
    }

    private boolean match(String s) {
        if (peek(s)) {
            pos += s.length();
            return true;
        }
        return false;
    }

    private boolean peek(String s) {
        skipWhitespace();
        return expr.startsWith(s, pos);
    }

    private void skipWhitespace() {
        while (pos < expr.length() && Character.isWhitespace(expr.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isNumberStart(char c) {
        return Character.isDigit(c) || c == '.';
    }

    private char current() {
        return pos < expr.length() ? expr.charAt(pos) : '\0';
    }
}
