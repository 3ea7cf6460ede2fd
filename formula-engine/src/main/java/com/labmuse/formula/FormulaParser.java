package com.labmuse.formula;

import com.labmuse.util.LoggingUtil;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits formula text into conditions joined by AND / OR.
 * <p>
 * Examples of accepted input:
 * <pre>
 *   İletkenlik > 312
 *   [Toplam Fosfor] >= [Orto Fosfat]
 *   (A + B) > 0.001 AND C < 10
 *   Variable < 0.001 OR Variable > 1000
 * </pre>
 * Clauses with an empty side (e.g. {@code ">10"}) or an unknown comparison
 * operator are skipped, so a wholly malformed formula yields no conditions.
 * There is no precedence between AND and OR; the conditions are kept in
 * source order and combined left to right by {@link ConditionEvaluator}.
 */
public class FormulaParser {

    private static final Pattern BRACKETED_VARIABLE = Pattern.compile("\\[([^\\]]+)\\]");
    private static final Pattern LOGICAL_SPLIT = Pattern.compile("\\s+(AND|OR)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARITHMETIC_SPACING = Pattern.compile("\\s*([+\\-*/])\\s*");
    private static final String COMPARISON_CHARS = "<>=!";

    private final String formula;

    public FormulaParser(String formula) {
        this.formula = formula == null ? "" : formula;
    }

    public List<Condition> parse() {
        String clean = BRACKETED_VARIABLE.matcher(formula.trim()).replaceAll("$1");
        List<Condition> conditions = new ArrayList<>();
        if (clean.isEmpty()) {
            return conditions;
        }

        Matcher m = LOGICAL_SPLIT.matcher(clean);
        int start = 0;
        while (m.find()) {
            addClause(clean.substring(start, m.start()), LogicalOperator.fromKeyword(m.group(1)), conditions);
            start = m.end();
        }
        addClause(clean.substring(start), null, conditions);

        return Collections.unmodifiableList(conditions);
    }

    private void addClause(String clause, LogicalOperator logicalOperator, List<Condition> conditions) {
        String text = clause.trim();
        int opStart = -1;
        for (int i = 0; i < text.length(); i++) {
            if (COMPARISON_CHARS.indexOf(text.charAt(i)) >= 0) {
                opStart = i;
                break;
            }
        }
        if (opStart < 0) {
            LoggingUtil.debug("Skipping clause without comparison operator: '" + text + "'");
            return;
        }
        int opEnd = opStart;
        while (opEnd < text.length() && COMPARISON_CHARS.indexOf(text.charAt(opEnd)) >= 0) {
            opEnd++;
        }

        String left = text.substring(0, opStart).trim();
        String symbol = text.substring(opStart, opEnd);
        String right = text.substring(opEnd).trim();

        if (left.isEmpty() || right.isEmpty()) {
            LoggingUtil.debug("Skipping clause with empty side: '" + text + "'");
            return;
        }
        Optional<ComparisonOperator> operator = ComparisonOperator.fromSymbol(symbol);
        if (operator.isEmpty()) {
            LoggingUtil.debug("Skipping clause with unknown operator '" + symbol + "': '" + text + "'");
            return;
        }

        conditions.add(new Condition(normalizeSide(left), operator.get(), normalizeSide(right), logicalOperator));
    }

    /**
     * Bare numbers pass through. Anything else gets single spaces around
     * arithmetic operators, and arithmetic not already enclosed is wrapped in parentheses.
     */
    static String normalizeSide(String side) {
        String s = side.trim();
        if (Expression.NUMBER.matcher(s).matches()) {
            return s;
        }
        s = ARITHMETIC_SPACING.matcher(s).replaceAll(" $1 ");
        s = s.replaceAll("\\s+", " ")
                .replaceAll("\\(\\s+", "(")
                .replaceAll("\\s+\\)", ")")
                .trim();
        if (s.startsWith("- ") || s.startsWith("+ ")) {
            // leading sign stays attached to its operand
            s = s.charAt(0) + s.substring(2);
        }
        if (hasArithmetic(s) && !Expression.isEnclosed(s)) {
            s = "(" + s + ")";
        }
        return s;
    }

    private static boolean hasArithmetic(String s) {
        for (int i = 0; i < s.length(); i++) {
            if ("+-*/".indexOf(s.charAt(i)) >= 0) return true;
        }
        return false;
    }

    public static List<Condition> parseFormula(String formula) {
        return new FormulaParser(formula).parse();
    }

    /**
     * Parse through a caller-owned cache keyed by the raw formula text.
     * A null cache parses every time.
     */
    public static List<Condition> parse(String formula, ParseCache cache) {
        if (cache == null || formula == null) {
            return parseFormula(formula);
        }
        List<Condition> cached = cache.get(formula);
        if (cached != null) {
            return cached;
        }
        List<Condition> parsed = parseFormula(formula);
        cache.put(formula, parsed);
        return parsed;
    }

    /**
     * Like {@link #parse(String, ParseCache)} but an empty result is an error.
     */
    public static List<Condition> parseOrThrow(String formula, ParseCache cache) {
        List<Condition> conditions = parse(formula, cache);
        if (conditions.isEmpty()) {
            throw new FormulaParseException("No valid conditions found in formula: '" + formula + "'", formula);
        }
        return conditions;
    }

    /**
     * Render conditions back into formula text, variables in brackets.
     */
    public static String format(List<Condition> conditions) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < conditions.size(); i++) {
            Condition condition = conditions.get(i);
            sb.append(condition.getLeft().render(true))
                    .append(' ').append(condition.getOperator().getSymbol()).append(' ')
                    .append(condition.getRight().render(true));
            if (i < conditions.size() - 1) {
                LogicalOperator op = condition.getLogicalOperator();
                sb.append(' ').append(op == null ? LogicalOperator.AND : op).append(' ');
            }
        }
        return sb.toString();
    }
}
