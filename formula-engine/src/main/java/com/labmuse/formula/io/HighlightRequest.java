package com.labmuse.formula.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.labmuse.formula.Formula;
import com.labmuse.formula.TableData;

import java.util.ArrayList;
import java.util.List;

/**
 * A table together with the formulas to apply to it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HighlightRequest {

    @JsonProperty("tableId")
    private String tableId;

    @JsonProperty("table")
    private TableData table;

    @JsonProperty("formulas")
    private List<Formula> formulas = new ArrayList<>();

    /**
     * Default constructor for Jackson.
     */
    public HighlightRequest() {}

    public HighlightRequest(String tableId, TableData table, List<Formula> formulas) {
        this.tableId = tableId;
        this.table = table;
        this.formulas = formulas;
    }

    public String getTableId() {
        return tableId;
    }

    public TableData getTable() {
        return table;
    }

    public List<Formula> getFormulas() {
        return formulas;
    }
}
