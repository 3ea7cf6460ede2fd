package com.labmuse.formula;

import com.labmuse.util.LoggingUtil;

import java.util.*;

/**
 * Decides which variable a formula highlights.
 * <p>
 * A table formula has exactly one condition. Each side is classified by its
 * distinct variable references: constant (none), single (one) or multiple.
 * The side holding a single bare variable supplies the target, left before right.
 * <pre>
 *   single   vs constant  -> left variable
 *   constant vs single    -> right variable
 *   single   vs multiple  -> left variable
 *   multiple vs single    -> right variable
 *   single   vs single    -> left variable
 *   multiple vs multiple  -> ambiguous
 *   constant vs constant  -> ambiguous
 * </pre>
 * Arithmetic on the single side and a target that reappears on the other side
 * are rejected. Workspace formulas may have several conditions and only need all
 * references to resolve; a single-condition workspace formula still gets a target
 * when the table above yields one.
 */
public class TargetResolver {

    private final VariableMatcher matcher;

    public TargetResolver() {
        this(new VariableMatcher());
    }

    public TargetResolver(VariableMatcher matcher) {
        this.matcher = matcher;
    }

    public TargetResolution resolve(List<Condition> conditions, FormulaScope scope,
                                    Collection<String> availableVariables) {
        if (conditions == null || conditions.isEmpty()) {
            throw new FormulaParseException("Formula has no conditions", null);
        }
        FormulaScope effective = scope == null ? FormulaScope.TABLE : scope;
        if (effective == FormulaScope.TABLE && conditions.size() > 1) {
            throw new ScopeViolationException("Table formulas must contain exactly one condition, found "
                    + conditions.size());
        }

        Set<String> references = new LinkedHashSet<>();
        for (Condition condition : conditions) {
            references.addAll(condition.getVariables());
        }
        List<String> missing = new ArrayList<>();
        Map<String, String> mapping = matcher.matchAll(references, availableVariables, missing);
        if (!missing.isEmpty()) {
            throw new VariableNotFoundException(missing);
        }

        List<String> leftVariables = new ArrayList<>();
        List<String> rightVariables = new ArrayList<>();
        for (Condition condition : conditions) {
            addResolved(condition.getLeft().getVariables(), mapping, leftVariables);
            addResolved(condition.getRight().getVariables(), mapping, rightVariables);
        }

        if (effective == FormulaScope.WORKSPACE) {
            if (conditions.size() == 1) {
                try {
                    return decideTarget(conditions.get(0), mapping, leftVariables, rightVariables);
                } catch (AmbiguousTargetException | ScopeViolationException e) {
                    LoggingUtil.debug("Workspace formula without single target: " + e.getMessage());
                }
            }
            return new TargetResolution(null, null, null, leftVariables, rightVariables, mapping);
        }
        return decideTarget(conditions.get(0), mapping, leftVariables, rightVariables);
    }

    private TargetResolution decideTarget(Condition condition, Map<String, String> mapping,
                                          List<String> leftVariables, List<String> rightVariables) {
        Expression left = condition.getLeft();
        Expression right = condition.getRight();
        int leftCount = left.getVariables().size();
        int rightCount = right.getVariables().size();

        if (leftCount == 0 && rightCount == 0) {
            throw new AmbiguousTargetException("Formula contains no variables");
        }
        if (leftCount > 1 && rightCount > 1) {
            throw new AmbiguousTargetException("Both sides contain multiple variables; "
                    + "one side must be a single variable");
        }

        String reference;
        TargetResolution.Side side;
        Expression other;
        if (leftCount == 1 && left.isBareVariable()) {
            reference = left.getVariables().get(0);
            side = TargetResolution.Side.LEFT;
            other = right;
        } else if (rightCount == 1 && right.isBareVariable()) {
            reference = right.getVariables().get(0);
            side = TargetResolution.Side.RIGHT;
            other = left;
        } else if (leftCount == 1 || rightCount == 1) {
            throw new ScopeViolationException("The single-variable side must be a bare variable without arithmetic: '"
                    + (leftCount == 1 ? left : right) + "'");
        } else {
            throw new AmbiguousTargetException("No side consists of a single variable");
        }

        String target = mapping.get(reference);
        for (String otherReference : other.getVariables()) {
            if (target.equals(mapping.get(otherReference))) {
                throw new ScopeViolationException("Target variable '" + target + "' appears on both sides");
            }
        }
        LoggingUtil.debug("Target of '" + condition + "' is '" + target + "' (" + side + ")");
        return new TargetResolution(target, reference, side, leftVariables, rightVariables, mapping);
    }

    private static void addResolved(List<String> references, Map<String, String> mapping, List<String> into) {
        for (String reference : references) {
            String name = mapping.get(reference);
            if (name != null && !into.contains(name)) {
                into.add(name);
            }
        }
    }
}
