package com.labmuse.formula;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * Counts of formulas by state and scope, for reports.
 */
public final class FormulaSummary {

    @JsonProperty("totalFormulas")
    private final int totalFormulas;

    @JsonProperty("activeFormulas")
    private final int activeFormulas;

    @JsonProperty("tableFormulas")
    private final int tableFormulas;

    @JsonProperty("workspaceFormulas")
    private final int workspaceFormulas;

    @JsonProperty("unscopedFormulas")
    private final int unscopedFormulas;

    private FormulaSummary(int totalFormulas, int activeFormulas, int tableFormulas, int workspaceFormulas,
                           int unscopedFormulas) {
        this.totalFormulas = totalFormulas;
        this.activeFormulas = activeFormulas;
        this.tableFormulas = tableFormulas;
        this.workspaceFormulas = workspaceFormulas;
        this.unscopedFormulas = unscopedFormulas;
    }

    public static FormulaSummary of(Collection<Formula> formulas) {
        int active = 0, table = 0, workspace = 0, unscoped = 0;
        for (Formula formula : formulas) {
            if (formula.isActive()) active++;
            if (formula.getScope() == FormulaScope.TABLE) table++;
            else if (formula.getScope() == FormulaScope.WORKSPACE) workspace++;
            else unscoped++;
        }
        return new FormulaSummary(formulas.size(), active, table, workspace, unscoped);
    }

    public int getTotalFormulas() {
        return totalFormulas;
    }

    public int getActiveFormulas() {
        return activeFormulas;
    }

    public int getTableFormulas() {
        return tableFormulas;
    }

    public int getWorkspaceFormulas() {
        return workspaceFormulas;
    }

    public int getUnscopedFormulas() {
        return unscopedFormulas;
    }

    @Override
    public String toString() {
        return "FormulaSummary{total=" + totalFormulas + ", active=" + activeFormulas + ", table=" + tableFormulas
                + ", workspace=" + workspaceFormulas + ", unscoped=" + unscopedFormulas + "}";
    }
}
