package com.labmuse.formula;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of {@link FormulaValidator#validate}. Empty fields are left out of the JSON form.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ValidationResult {

    @JsonProperty("isValid")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private boolean valid;

    @JsonProperty("error")
    private String error;

    @JsonProperty("missingVariables")
    private List<String> missingVariables = new ArrayList<>();

    @JsonProperty("targetVariable")
    private String targetVariable;

    @JsonProperty("leftVariables")
    private List<String> leftVariables = new ArrayList<>();

    @JsonProperty("rightVariables")
    private List<String> rightVariables = new ArrayList<>();

    @JsonProperty("warnings")
    private List<String> warnings = new ArrayList<>();

    public ValidationResult() {}

    static ValidationResult failure(String error) {
        ValidationResult result = new ValidationResult();
        result.valid = false;
        result.error = error;
        return result;
    }

    static ValidationResult success() {
        ValidationResult result = new ValidationResult();
        result.valid = true;
        return result;
    }

    ValidationResult fail(String error) {
        this.valid = false;
        this.error = error;
        return this;
    }

    public boolean isValid() {
        return valid;
    }

    public String getError() {
        return error;
    }

    public List<String> getMissingVariables() {
        return missingVariables;
    }

    void setMissingVariables(List<String> missingVariables) {
        this.missingVariables = new ArrayList<>(missingVariables);
    }

    public String getTargetVariable() {
        return targetVariable;
    }

    void setTargetVariable(String targetVariable) {
        this.targetVariable = targetVariable;
    }

    public List<String> getLeftVariables() {
        return leftVariables;
    }

    void setLeftVariables(List<String> leftVariables) {
        this.leftVariables = new ArrayList<>(leftVariables);
    }

    public List<String> getRightVariables() {
        return rightVariables;
    }

    void setRightVariables(List<String> rightVariables) {
        this.rightVariables = new ArrayList<>(rightVariables);
    }

    public List<String> getWarnings() {
        return warnings;
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + valid
                + (error == null ? "" : ", error='" + error + "'")
                + (missingVariables.isEmpty() ? "" : ", missing=" + missingVariables)
                + (targetVariable == null ? "" : ", target=" + targetVariable)
                + (warnings.isEmpty() ? "" : ", warnings=" + warnings) + "}";
    }
}
