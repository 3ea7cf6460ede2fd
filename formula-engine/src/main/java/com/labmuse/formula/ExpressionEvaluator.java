package com.labmuse.formula;

import com.labmuse.util.LoggingUtil;

import java.math.BigDecimal;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates one side of a condition against the variable bindings of a data column.
 * <ul>
 *   <li>{@code "312"} returns the number</li>
 *   <li>{@code "İletkenlik"} returns the bound value (exact name, then normalized name)</li>
 *   <li>{@code "(İletkenlik + Toplam Fosfor)"} substitutes values and evaluates the arithmetic</li>
 * </ul>
 * In a combination an unknown variable counts as zero and is reported in
 * {@link ExpressionValue#getMissingVariables()}; a lone unknown variable is an error.
 */
public class ExpressionEvaluator {

    private static final Pattern PLAIN_NUMBER = Pattern.compile("-?\\d+\\.?\\d*|-?\\.\\d+");
    private static final Pattern ARITHMETIC = Pattern.compile("[+\\-*/]");
    private static final Pattern LEFTOVER_IDENTIFIER =
            Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*(?:[ \\t]+[\\p{L}\\p{N}_]+)*");
    private static final Pattern ALLOWED = Pattern.compile("[-+*/()\\d.\\s]+");
    // A name directly next to another word, even across spaces, is part of a longer name
    private static final String NAME_BOUNDARY_BEFORE = "(?<![\\p{L}\\p{N}_.])(?<![\\p{L}\\p{N}_.][ \\t]{1,64})";
    private static final String NAME_BOUNDARY_AFTER = "(?![\\p{L}\\p{N}_])(?![ \\t]+[\\p{L}\\p{N}_.])";

    public ExpressionValue evaluate(String expression, Map<String, Double> bindings) {
        if (expression == null || expression.isBlank()) {
            throw new EvaluationException("Empty expression");
        }
        String clean = Expression.stripEnclosing(expression);

        if (PLAIN_NUMBER.matcher(clean).matches()) {
            return new ExpressionValue(Double.parseDouble(clean), List.of());
        }

        if (!ARITHMETIC.matcher(clean).find()) {
            return new ExpressionValue(lookup(clean, bindings), List.of());
        }

        return evaluateCombination(expression, clean, bindings);
    }

    public double evaluateValue(String expression, Map<String, Double> bindings) {
        return evaluate(expression, bindings).getValue();
    }

    private double lookup(String name, Map<String, Double> bindings) {
        String varName = name.trim();
        Double value = bindings.get(varName);
        if (isUsable(value)) {
            return value;
        }
        String normalized = IdentifierNormalizer.normalize(varName);
        for (Map.Entry<String, Double> entry : bindings.entrySet()) {
            if (IdentifierNormalizer.normalize(entry.getKey()).equals(normalized) && isUsable(entry.getValue())) {
                return entry.getValue();
            }
        }
        throw new VariableNotFoundException(varName);
    }

    private ExpressionValue evaluateCombination(String original, String clean, Map<String, Double> bindings) {
        String working = clean;
        String folded = IdentifierNormalizer.normalize(working);

        // Longest names first so "Toplam Fosfor" is not clobbered by "Fosfor"
        List<String> names = new ArrayList<>(bindings.keySet());
        names.sort(Comparator.comparingInt(String::length).reversed());
        for (String name : names) {
            Double value = bindings.get(name);
            String trimmed = name.trim();
            if (!isUsable(value) || trimmed.isEmpty()) {
                continue;
            }
            if (!folded.contains(IdentifierNormalizer.normalize(trimmed))) {
                continue;
            }
            Pattern namePattern = Pattern.compile(NAME_BOUNDARY_BEFORE + Pattern.quote(trimmed) + NAME_BOUNDARY_AFTER,
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            Matcher m = namePattern.matcher(working);
            if (m.find()) {
                working = m.replaceAll(Matcher.quoteReplacement(formatNumber(value)));
                folded = IdentifierNormalizer.normalize(working);
            }
        }

        List<String> missing = new ArrayList<>();
        Matcher leftover = LEFTOVER_IDENTIFIER.matcher(working);
        StringBuilder sb = new StringBuilder();
        while (leftover.find()) {
            String name = leftover.group().trim();
            if (!missing.contains(name)) {
                missing.add(name);
            }
            leftover.appendReplacement(sb, "0");
        }
        leftover.appendTail(sb);
        working = sb.toString().replaceAll("\\s+", " ").trim();

        if (!missing.isEmpty()) {
            LoggingUtil.warn("Variables not found in bindings, counted as 0: " + missing + " in \"" + original + "\"");
        }

        if (working.isEmpty()) {
            throw new EvaluationException("Empty expression after variable replacement: \"" + original + "\"");
        }
        if (!ALLOWED.matcher(working).matches()) {
            throw new EvaluationException("Invalid characters in expression: \"" + original + "\" -> \"" + working + "\"");
        }
        String compact = working.replaceAll("\\s+", "");
        if (compact.contains("()") || compact.contains("(-)") || compact.contains("(+)")) {
            throw new EvaluationException("Expression contains empty or invalid parentheses: \"" + original + "\"");
        }

        double result = new ArithmeticParser(working).evaluate();
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new EvaluationException("Expression did not evaluate to a finite number: \""
                    + original + "\" -> \"" + working + "\" = " + result);
        }
        LoggingUtil.debug("Evaluated \"" + original + "\" -> \"" + working + "\" = " + result);
        return new ExpressionValue(result, missing);
    }

    private static boolean isUsable(Double value) {
        return value != null && !value.isNaN() && !value.isInfinite();
    }

    private static String formatNumber(double value) {
        String plain = BigDecimal.valueOf(value).toPlainString();
        return value < 0 ? "(" + plain + ")" : plain;
    }
}
