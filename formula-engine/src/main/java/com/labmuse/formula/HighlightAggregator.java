package com.labmuse.formula;

import com.labmuse.util.EngineConfig;
import com.labmuse.util.LoggingUtil;

import java.util.*;

/**
 * Applies formulas to every data column of a table and collects the highlighted cells.
 * <p>
 * Each applicable formula is parsed and resolved once per table. A formula that
 * cannot be resolved is skipped with a warning; a formula that fails on one column
 * either leaves that column alone or, with error highlighting enabled, marks its
 * variables in the error color. Neither stops the remaining formulas.
 */
public class HighlightAggregator {

    public static final String DEFAULT_COLOR = "#ff0000";

    private final EngineConfig config;
    private final VariableResolver variableResolver;
    private final TargetResolver targetResolver;
    private final ConditionEvaluator conditionEvaluator;
    private final ParseCache cache;

    public HighlightAggregator() {
        this(new EngineConfig(), null);
    }

    /**
     * @param cache caller-owned parse cache, may be null
     */
    public HighlightAggregator(EngineConfig config, ParseCache cache) {
        this.config = config;
        this.variableResolver = new VariableResolver(config);
        this.targetResolver = new TargetResolver(new VariableMatcher(config));
        this.conditionEvaluator = new ConditionEvaluator(config);
        this.cache = cache;
    }

    public List<HighlightedCell> highlight(List<Formula> formulas, TableData table) {
        return highlight(formulas, table, null);
    }

    /**
     * @param tableId id of the table, used to filter formulas by scope; null applies every active formula
     */
    public List<HighlightedCell> highlight(List<Formula> formulas, TableData table, String tableId) {
        if (formulas == null || table == null) {
            throw new IllegalArgumentException("Formulas and table are required");
        }
        if (variableResolver.variableColumnIndex(table) < 0) {
            LoggingUtil.warn("Table has no '" + config.getVariableColumn() + "' column, nothing to highlight");
            return new ArrayList<>();
        }

        List<String> available = variableResolver.availableVariables(table);
        Map<String, Integer> rows = variableResolver.rowIndex(table);

        List<Plan> plans = new ArrayList<>();
        for (Formula formula : formulas) {
            if (formula == null || !formula.isApplicableTo(tableId)) {
                continue;
            }
            Plan plan = buildPlan(formula, available);
            if (plan != null) {
                plans.add(plan);
            }
        }
        LoggingUtil.debug("Applying " + plans.size() + " of " + formulas.size() + " formulas to " + table);

        Map<String, HighlightedCell> cells = new LinkedHashMap<>();
        for (String column : variableResolver.dataColumns(table)) {
            Map<String, Double> bindings = variableResolver.bindings(table, column);
            if (bindings.isEmpty()) {
                continue;
            }
            for (Plan plan : plans) {
                applyPlan(plan, column, bindings, rows, cells);
            }
        }
        LoggingUtil.info("Highlighted " + cells.size() + " cells");
        return new ArrayList<>(cells.values());
    }

    private Plan buildPlan(Formula formula, List<String> available) {
        String text = formula.getText();
        if (text == null || text.isBlank()) {
            LoggingUtil.warn("Skipping formula '" + label(formula) + "': empty formula text");
            return null;
        }
        List<Condition> conditions;
        TargetResolution resolution;
        try {
            conditions = FormulaParser.parseOrThrow(text, cache);
            resolution = targetResolver.resolve(conditions, formula.getEffectiveScope(), available);
        } catch (FormulaException e) {
            LoggingUtil.warn("Skipping formula '" + label(formula) + "': " + e.getMessage());
            return null;
        }
        List<Condition> renamed = new ArrayList<>(conditions.size());
        for (Condition condition : conditions) {
            renamed.add(condition.renameVariables(resolution.getVariableMapping()));
        }
        return new Plan(formula, renamed, resolution);
    }

    private void applyPlan(Plan plan, String column, Map<String, Double> bindings, Map<String, Integer> rows,
                           Map<String, HighlightedCell> cells) {
        Formula formula = plan.formula;
        FormulaEvaluation evaluation;
        try {
            evaluation = conditionEvaluator.evaluateFormula(plan.conditions, bindings);
        } catch (VariableNotFoundException e) {
            LoggingUtil.debug("Formula '" + label(formula) + "' skipped for column '" + column + "': "
                    + e.getMessage());
            return;
        } catch (FormulaException e) {
            LoggingUtil.warn("Formula '" + label(formula) + "' failed for column '" + column + "': "
                    + e.getMessage());
            if (config.isErrorHighlighting()) {
                recordError(plan, column, bindings, rows, cells);
            }
            return;
        }
        if (!evaluation.getResult()) {
            return;
        }

        HighlightedCell.FormulaDetail detail = new HighlightedCell.FormulaDetail(formula.getId(), formula.getName(),
                formula.getText(), evaluation.getLeftResult(), evaluation.getRightResult(), colorOf(formula));
        for (String target : targetsOf(plan, evaluation, bindings)) {
            mergeInto(cells, rows.get(target), column, detail, label(formula));
        }
    }

    /**
     * The resolved target, or for workspace formulas without one the variables of
     * the first condition that holds.
     */
    private static List<String> targetsOf(Plan plan, FormulaEvaluation evaluation, Map<String, Double> bindings) {
        if (plan.resolution.hasTarget()) {
            return List.of(plan.resolution.getTargetVariable());
        }
        List<String> targets = new ArrayList<>();
        for (ConditionResult result : evaluation.getConditionResults()) {
            if (result.holds()) {
                for (String variable : result.getCondition().getVariables()) {
                    if (bindings.containsKey(variable)) targets.add(variable);
                }
                break;
            }
        }
        return targets;
    }

    private void recordError(Plan plan, String column, Map<String, Double> bindings, Map<String, Integer> rows,
                             Map<String, HighlightedCell> cells) {
        Formula formula = plan.formula;
        HighlightedCell.FormulaDetail detail = new HighlightedCell.FormulaDetail(formula.getId(), formula.getName(),
                formula.getText(), null, null, config.getErrorColor());
        String errorLabel = label(formula) + config.getErrorMessageSuffix();
        Set<String> variables = new LinkedHashSet<>();
        if (plan.resolution.hasTarget()) {
            variables.add(plan.resolution.getTargetVariable());
        } else {
            variables.addAll(plan.resolution.getVariableMapping().values());
        }
        for (String variable : variables) {
            if (bindings.containsKey(variable)) {
                mergeInto(cells, rows.get(variable), column, detail, errorLabel);
            }
        }
    }

    private static void mergeInto(Map<String, HighlightedCell> cells, Integer rowIndex, String column,
                                  HighlightedCell.FormulaDetail detail, String label) {
        if (rowIndex == null) {
            return;
        }
        String row = HighlightedCell.rowId(rowIndex);
        HighlightedCell cell = cells.computeIfAbsent(row + "\u0000" + column,
                k -> new HighlightedCell(row, column, detail.getColor(), label));
        if (cell.hasFormula(detail.getId())) {
            return;
        }
        cell.merge(detail, label);
    }

    private static String colorOf(Formula formula) {
        return formula.getColor() == null || formula.getColor().isBlank() ? DEFAULT_COLOR : formula.getColor();
    }

    private static String label(Formula formula) {
        return formula.getName() != null ? formula.getName() : String.valueOf(formula.getId());
    }

    private static final class Plan {
        final Formula formula;
        final List<Condition> conditions;
        final TargetResolution resolution;

        Plan(Formula formula, List<Condition> conditions, TargetResolution resolution) {
            this.formula = formula;
            this.conditions = conditions;
            this.resolution = resolution;
        }
    }
}
