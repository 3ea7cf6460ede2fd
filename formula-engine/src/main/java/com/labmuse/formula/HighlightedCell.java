package com.labmuse.formula;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A table cell marked by one or more formulas.
 * <p>
 * {@code row} is {@code "row-<n>"} with n the 1-based data row index, {@code col}
 * the data column header. When several formulas mark the same cell their ids,
 * details and names accumulate here; {@code color} stays that of the first one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HighlightedCell {

    @JsonProperty("row")
    private String row;

    @JsonProperty("col")
    private String col;

    @JsonProperty("color")
    private String color;

    @JsonProperty("message")
    private String message;

    @JsonProperty("formulaIds")
    private List<String> formulaIds = new ArrayList<>();

    @JsonProperty("formulaDetails")
    private List<FormulaDetail> formulaDetails = new ArrayList<>();

    /**
     * Default constructor for Jackson.
     */
    public HighlightedCell() {}

    public HighlightedCell(String row, String col, String color, String message) {
        this.row = row;
        this.col = col;
        this.color = color;
        this.message = message;
    }

    public static String rowId(int rowIndex) {
        return "row-" + (rowIndex + 1);
    }

    public boolean hasFormula(String formulaId) {
        return formulaIds.contains(formulaId);
    }

    /**
     * Add one formula's contribution. The first contributor also sets color and message.
     */
    public void merge(FormulaDetail detail, String label) {
        if (formulaIds.isEmpty()) {
            if (color == null) color = detail.getColor();
            if (message == null || message.isEmpty()) message = label;
        } else {
            message = message + ", " + label;
        }
        formulaIds.add(detail.getId());
        formulaDetails.add(detail);
    }

    public String getRow() {
        return row;
    }

    public String getCol() {
        return col;
    }

    public String getColor() {
        return color;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getFormulaIds() {
        return formulaIds;
    }

    public List<FormulaDetail> getFormulaDetails() {
        return formulaDetails;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HighlightedCell)) return false;
        HighlightedCell other = (HighlightedCell) o;
        return Objects.equals(row, other.row) && Objects.equals(col, other.col)
                && Objects.equals(color, other.color) && Objects.equals(message, other.message)
                && formulaIds.equals(other.formulaIds) && formulaDetails.equals(other.formulaDetails);
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col, color, message, formulaIds, formulaDetails);
    }

    @Override
    public String toString() {
        return "HighlightedCell{" + row + ", " + col + ", color=" + color + ", formulas=" + formulaIds + "}";
    }

    /**
     * One formula's share of a highlighted cell.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FormulaDetail {

        @JsonProperty("id")
        private String id;

        @JsonProperty("name")
        private String name;

        @JsonProperty("formula")
        private String formulaText;

        @JsonProperty("leftResult")
        private Double leftResult;

        @JsonProperty("rightResult")
        private Double rightResult;

        @JsonProperty("color")
        private String color;

        public FormulaDetail() {}

        public FormulaDetail(String id, String name, String formulaText, Double leftResult, Double rightResult,
                             String color) {
            this.id = id;
            this.name = name;
            this.formulaText = formulaText;
            this.leftResult = leftResult;
            this.rightResult = rightResult;
            this.color = color;
        }

        public String getId() {
            return id;
        }

        public String getName() {
            return name;
        }

        public String getFormulaText() {
            return formulaText;
        }

        public Double getLeftResult() {
            return leftResult;
        }

        public Double getRightResult() {
            return rightResult;
        }

        public String getColor() {
            return color;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof FormulaDetail)) return false;
            FormulaDetail other = (FormulaDetail) o;
            return Objects.equals(id, other.id) && Objects.equals(name, other.name)
                    && Objects.equals(formulaText, other.formulaText)
                    && Objects.equals(leftResult, other.leftResult)
                    && Objects.equals(rightResult, other.rightResult) && Objects.equals(color, other.color);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, name, formulaText, leftResult, rightResult, color);
        }
    }
}
