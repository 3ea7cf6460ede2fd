package com.labmuse.formula;

import java.util.*;
import java.util.regex.Pattern;

/**
 * One side of a condition, classified as a constant, a single variable, or
 * a combination of terms joined by arithmetic operators.
 * <p>
 * The expression keeps its token sequence so that variable references can be
 * renamed and the text rendered again; evaluation always works on text.
 */
public final class Expression {

    public enum Kind { CONSTANT, VARIABLE, COMBINATION }

    enum TokenType { NUMBER, IDENTIFIER, OPERATOR, OPEN, CLOSE }

    static final class Token {
        final TokenType type;
        final String text;

        Token(TokenType type, String text) {
            this.type = type;
            this.text = text;
        }
    }

    static final Pattern NUMBER = Pattern.compile("-?(\\d+\\.?\\d*|\\.\\d+)");
    private static final String OPERATORS = "+-*/";

    private final String text;
    private final List<Token> tokens;
    private final List<String> terms;
    private final List<String> operators;
    private final List<String> variables;
    private final Kind kind;

    private Expression(String text, List<Token> tokens) {
        this.text = text;
        this.tokens = List.copyOf(tokens);

        List<String> termList = new ArrayList<>();
        List<String> operatorList = new ArrayList<>();
        Set<String> variableSet = new LinkedHashSet<>();
        boolean expectOperand = true;
        String pendingSign = "";
        for (Token token : tokens) {
            switch (token.type) {
                case NUMBER:
                case IDENTIFIER:
                    termList.add(pendingSign + token.text);
                    pendingSign = "";
                    if (token.type == TokenType.IDENTIFIER) variableSet.add(token.text);
                    expectOperand = false;
                    break;
                case OPERATOR:
                    if (expectOperand) {
                        // unary sign
                        if (token.text.equals("-")) pendingSign = pendingSign.isEmpty() ? "-" : "";
                    } else {
                        operatorList.add(token.text);
                        expectOperand = true;
                    }
                    break;
                case OPEN:
                    pendingSign = "";
                    expectOperand = true;
                    break;
                case CLOSE:
                    expectOperand = false;
                    break;
            }
        }
        this.terms = List.copyOf(termList);
        this.operators = List.copyOf(operatorList);
        this.variables = List.copyOf(variableSet);

        boolean hasOperator = tokens.stream().anyMatch(t -> t.type == TokenType.OPERATOR);
        if (variables.isEmpty() && !hasOperator && terms.size() == 1) {
            kind = Kind.CONSTANT;
        } else if (variables.size() == 1 && !hasOperator && terms.size() == 1) {
            kind = Kind.VARIABLE;
        } else {
            kind = Kind.COMBINATION;
        }
    }

    public static Expression parse(String text) {
        String source = text == null ? "" : text.trim();
        if (NUMBER.matcher(source).matches()) {
            return new Expression(source, List.of(new Token(TokenType.NUMBER, source)));
        }
        return new Expression(source, tokenize(source));
    }

    private static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder operand = new StringBuilder();
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (OPERATORS.indexOf(c) >= 0 || c == '(' || c == ')') {
                flushOperand(operand, tokens);
                TokenType type = c == '(' ? TokenType.OPEN : c == ')' ? TokenType.CLOSE : TokenType.OPERATOR;
                tokens.add(new Token(type, String.valueOf(c)));
            } else {
                operand.append(c);
            }
        }
        flushOperand(operand, tokens);
        return tokens;
    }

    private static void flushOperand(StringBuilder operand, List<Token> tokens) {
        String value = operand.toString().trim().replaceAll("\\s+", " ");
        operand.setLength(0);
        if (value.isEmpty()) {
            return;
        }
        tokens.add(new Token(NUMBER.matcher(value).matches() ? TokenType.NUMBER : TokenType.IDENTIFIER, value));
    }

    public String getText() {
        return text;
    }

    public Kind getKind() {
        return kind;
    }

    public List<String> getTerms() {
        return terms;
    }

    public List<String> getOperators() {
        return operators;
    }

    /**
     * Distinct variable references, in order of first appearance.
     */
    public List<String> getVariables() {
        return variables;
    }

    public boolean isConstant() {
        return kind == Kind.CONSTANT;
    }

    /**
     * A lone variable reference without arithmetic, parentheses aside.
     */
    public boolean isBareVariable() {
        return kind == Kind.VARIABLE;
    }

    public boolean hasArithmetic() {
        return tokens.stream().anyMatch(t -> t.type == TokenType.OPERATOR);
    }

    public double getConstantValue() {
        if (kind != Kind.CONSTANT) {
            throw new IllegalStateException("Not a constant expression: " + text);
        }
        return Double.parseDouble(terms.get(0));
    }

    /**
     * Copy with variable references replaced according to {@code names};
     * references without an entry are kept.
     */
    public Expression renameVariables(Map<String, String> names) {
        List<Token> renamed = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.type == TokenType.IDENTIFIER && names.containsKey(token.text)) {
                renamed.add(new Token(TokenType.IDENTIFIER, names.get(token.text)));
            } else {
                renamed.add(token);
            }
        }
        return new Expression(render(renamed, false), renamed);
    }

    /**
     * Render the expression; with {@code bracketVariables} each variable is written as {@code [name]}.
     */
    public String render(boolean bracketVariables) {
        return render(tokens, bracketVariables);
    }

    private static String render(List<Token> tokens, boolean bracketVariables) {
        StringBuilder sb = new StringBuilder();
        boolean expectOperand = true;
        for (Token token : tokens) {
            switch (token.type) {
                case OPERATOR:
                    if (expectOperand) {
                        sb.append(token.text);
                    } else {
                        sb.append(' ').append(token.text).append(' ');
                        expectOperand = true;
                    }
                    break;
                case OPEN:
                    sb.append('(');
                    expectOperand = true;
                    break;
                case CLOSE:
                    sb.append(')');
                    expectOperand = false;
                    break;
                case IDENTIFIER:
                    sb.append(bracketVariables ? "[" + token.text + "]" : token.text);
                    expectOperand = false;
                    break;
                default:
                    sb.append(token.text);
                    expectOperand = false;
            }
        }
        return sb.toString();
    }

    /**
     * True when the first character opens a parenthesis closed by the last character.
     */
    public static boolean isEnclosed(String text) {
        String s = text.trim();
        if (s.length() < 2 || s.charAt(0) != '(' || s.charAt(s.length() - 1) != ')') {
            return false;
        }
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
            if (depth == 0 && i < s.length() - 1) {
                return false;
            }
        }
        return depth == 0;
    }

    /**
     * Remove every level of enclosing parentheses, so {@code ((A))} becomes {@code A}.
     */
    public static String stripEnclosing(String text) {
        String s = text.trim();
        while (isEnclosed(s)) {
            s = s.substring(1, s.length() - 1).trim();
        }
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expression)) return false;
        return text.equals(((Expression) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
