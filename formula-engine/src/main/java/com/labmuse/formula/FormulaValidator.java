package com.labmuse.formula;

import com.labmuse.util.EngineConfig;
import com.labmuse.util.LoggingUtil;

import java.util.*;

/**
 * Checks formula text before it is stored or activated. Never throws: every
 * problem is reported through the returned {@link ValidationResult}.
 */
public class FormulaValidator {

    private final EngineConfig config;
    private final VariableMatcher matcher;
    private final TargetResolver targetResolver;
    private final ConditionEvaluator conditionEvaluator;
    private final ParseCache cache;

    public FormulaValidator() {
        this(new EngineConfig(), null);
    }

    public FormulaValidator(EngineConfig config, ParseCache cache) {
        this.config = config;
        this.matcher = new VariableMatcher(config);
        this.targetResolver = new TargetResolver(matcher);
        this.conditionEvaluator = new ConditionEvaluator(config);
        this.cache = cache;
    }

    public ValidationResult validate(String formula, Collection<String> availableVariables, FormulaScope scope) {
        if (formula == null || formula.isBlank()) {
            return ValidationResult.failure("Formula is empty");
        }
        Collection<String> available = availableVariables == null ? List.of() : availableVariables;
        FormulaScope effective = scope == null ? FormulaScope.TABLE : scope;

        List<Condition> conditions;
        try {
            conditions = FormulaParser.parseOrThrow(formula, cache);
        } catch (FormulaParseException e) {
            LoggingUtil.debug(e.getMessage());
            return ValidationResult.failure("No valid conditions found in formula");
        }
        if (effective == FormulaScope.TABLE && conditions.size() > 1) {
            return ValidationResult.failure("Table formulas may contain only one condition; found "
                    + conditions.size() + ". Use workspace scope for combined conditions");
        }

        Set<String> references = new LinkedHashSet<>();
        for (Condition condition : conditions) {
            references.addAll(condition.getVariables());
        }
        List<String> missing = new ArrayList<>();
        Map<String, String> mapping = matcher.matchAll(references, available, missing);
        if (!missing.isEmpty()) {
            ValidationResult result = ValidationResult.failure("Unknown variables: " + String.join(", ", missing));
            result.setMissingVariables(missing);
            return result;
        }

        ValidationResult result = ValidationResult.success();
        try {
            TargetResolution resolution = targetResolver.resolve(conditions, effective, available);
            result.setLeftVariables(resolution.getLeftVariables());
            result.setRightVariables(resolution.getRightVariables());
            if (resolution.hasTarget()) {
                result.setTargetVariable(resolution.getTargetVariable());
                if (effective == FormulaScope.TABLE) {
                    result.addWarning("Only '" + resolution.getTargetVariable() + "' will be highlighted");
                }
            }
        } catch (FormulaException e) {
            LoggingUtil.debug("Target resolution failed for '" + formula + "': " + e.getMessage());
            return result.fail(e.getMessage());
        }

        Map<String, Double> dummy = new LinkedHashMap<>();
        for (String name : available) {
            dummy.put(name, 1.0);
        }
        List<Condition> renamed = new ArrayList<>(conditions.size());
        for (Condition condition : conditions) {
            renamed.add(condition.renameVariables(mapping));
        }
        try {
            conditionEvaluator.evaluateFormula(renamed, dummy);
        } catch (FormulaException e) {
            LoggingUtil.debug("Dry run failed for '" + formula + "': " + e.getMessage());
            return result.fail("Formula cannot be evaluated: " + e.getMessage());
        }

        if (effective == FormulaScope.WORKSPACE) {
            if (conditions.size() > config.getMaxConditionsWarning()) {
                result.addWarning("Formula has " + conditions.size() + " conditions; "
                        + "consider splitting it for readability");
            }
            if (mapping.size() > config.getMaxVariablesWarning()) {
                result.addWarning("Formula references " + mapping.size() + " variables; "
                        + "evaluation may be slow on large tables");
            }
        }
        return result;
    }

    /**
     * Workspace formulas must not be bound to a table; table formulas must be
     * bound to one of {@code tableIds}.
     */
    public ValidationResult validateScopeConstraints(Formula formula, Collection<String> tableIds) {
        if (formula.getScope() == FormulaScope.WORKSPACE) {
            if (formula.getOwnerTableId() != null) {
                return ValidationResult.failure("Workspace formulas cannot be bound to a specific table");
            }
            return ValidationResult.success();
        }
        if (formula.getScope() == FormulaScope.TABLE) {
            if (formula.getOwnerTableId() == null) {
                return ValidationResult.failure("Table formulas must be bound to a table");
            }
            if (tableIds == null || !tableIds.contains(formula.getOwnerTableId())) {
                return ValidationResult.failure("Table '" + formula.getOwnerTableId()
                        + "' was not found in the workspace");
            }
        }
        return ValidationResult.success();
    }
}
