package com.labmuse.formula;

import com.labmuse.util.EngineConfig;
import com.labmuse.util.LoggingUtil;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Entry point bundling parser, evaluator, validator and highlight aggregator
 * behind one configuration and one parse cache.
 * <p>
 * The cache belongs to whoever constructed the engine; call {@link #clearCache()}
 * after formulas are edited.
 */
public class FormulaEngine {

    private final EngineConfig config;
    private final ParseCache cache;
    private final ConditionEvaluator conditionEvaluator;
    private final FormulaValidator validator;
    private final HighlightAggregator aggregator;
    private final VariableResolver variableResolver;

    public FormulaEngine() {
        this(new EngineConfig());
    }

    public FormulaEngine(EngineConfig config) {
        this(config, new ParseCache());
    }

    public FormulaEngine(EngineConfig config, ParseCache cache) {
        this.config = config;
        this.cache = cache;
        this.conditionEvaluator = new ConditionEvaluator(config);
        this.validator = new FormulaValidator(config, cache);
        this.aggregator = new HighlightAggregator(config, cache);
        this.variableResolver = new VariableResolver(config);
        LoggingUtil.initialize(config);
    }

    public List<Condition> parse(String formula) {
        return FormulaParser.parse(formula, cache);
    }

    /**
     * Evaluate formula text against explicit bindings; conditions that fail count as false.
     */
    public FormulaEvaluation evaluate(String formula, Map<String, Double> bindings) {
        List<Condition> conditions = parse(formula);
        if (conditions.isEmpty()) {
            return FormulaEvaluation.invalid("No valid conditions found in formula");
        }
        return conditionEvaluator.evaluateFormula(conditions, bindings, true);
    }

    public ValidationResult validate(String formula, Collection<String> availableVariables, FormulaScope scope) {
        return validator.validate(formula, availableVariables, scope);
    }

    /**
     * Validate against the variables of a table.
     */
    public ValidationResult validate(String formula, TableData table, FormulaScope scope) {
        return validator.validate(formula, variableResolver.availableVariables(table), scope);
    }

    public ValidationResult validateScopeConstraints(Formula formula, Collection<String> tableIds) {
        return validator.validateScopeConstraints(formula, tableIds);
    }

    public List<HighlightedCell> highlight(List<Formula> formulas, TableData table) {
        return aggregator.highlight(formulas, table);
    }

    public List<HighlightedCell> highlight(List<Formula> formulas, TableData table, String tableId) {
        return aggregator.highlight(formulas, table, tableId);
    }

    public FormulaSummary summarize(Collection<Formula> formulas) {
        return FormulaSummary.of(formulas);
    }

    public void clearCache() {
        cache.clear();
    }

    public ParseCache getCache() {
        return cache;
    }

    public EngineConfig getConfig() {
        return config;
    }
}
