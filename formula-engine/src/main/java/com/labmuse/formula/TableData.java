package com.labmuse.formula;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A measurement table: ordered column headers and rows of raw cell values.
 * Cells are whatever the payload carried (numbers, strings such as {@code "<0.05"}, or null).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TableData {

    @JsonProperty("columns")
    private List<String> columns = new ArrayList<>();

    @JsonProperty("data")
    private List<List<Object>> data = new ArrayList<>();

    /**
     * Default constructor for Jackson.
     */
    public TableData() {}

    public TableData(List<String> columns, List<List<Object>> data) {
        this.columns = columns == null ? new ArrayList<>() : columns;
        this.data = data == null ? new ArrayList<>() : data;
    }

    public List<String> getColumns() {
        return columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns == null ? new ArrayList<>() : columns;
    }

    public List<List<Object>> getData() {
        return data;
    }

    public void setData(List<List<Object>> data) {
        this.data = data == null ? new ArrayList<>() : data;
    }

    @JsonIgnore
    public int getRowCount() {
        return data.size();
    }

    /**
     * Cell value, or null when the row is shorter than the header.
     */
    public Object cell(int row, int col) {
        List<Object> values = data.get(row);
        return values == null || col < 0 || col >= values.size() ? null : values.get(col);
    }

    @Override
    public String toString() {
        return "TableData{columns=" + columns + ", rows=" + data.size() + "}";
    }
}
