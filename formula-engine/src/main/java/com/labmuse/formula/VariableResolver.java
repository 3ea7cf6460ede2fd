package com.labmuse.formula;

import com.labmuse.util.EngineConfig;
import com.labmuse.util.LoggingUtil;

import java.util.*;

/**
 * Reads variable bindings out of a measurement table.
 * <p>
 * The {@code Variable} column names the measured parameter of each row; every
 * column not in the excluded set is a data column (one sampling point or date),
 * and yields its own bindings from variable name to numeric value.
 */
public class VariableResolver {

    private final String variableColumn;
    private final Set<String> excludedColumns;

    public VariableResolver() {
        this(new EngineConfig());
    }

    public VariableResolver(EngineConfig config) {
        this.variableColumn = config.getVariableColumn();
        this.excludedColumns = config.getExcludedColumns();
    }

    /**
     * @return index of the variable column, matched exactly, or -1
     */
    public int variableColumnIndex(TableData table) {
        return table.getColumns().indexOf(variableColumn);
    }

    public List<String> dataColumns(TableData table) {
        List<String> result = new ArrayList<>();
        for (String column : table.getColumns()) {
            if (column != null && !excludedColumns.contains(column)) {
                result.add(column);
            }
        }
        return result;
    }

    /**
     * Bindings of one data column. Rows with an empty name or an unparsable value
     * are omitted; when a name repeats, the later row wins.
     */
    public Map<String, Double> bindings(TableData table, String column) {
        Map<String, Double> result = new LinkedHashMap<>();
        int varIndex = variableColumnIndex(table);
        int colIndex = table.getColumns().indexOf(column);
        if (varIndex < 0 || colIndex < 0) {
            LoggingUtil.debug("No bindings for column '" + column + "': variable or data column missing");
            return result;
        }
        for (int row = 0; row < table.getRowCount(); row++) {
            String name = cleanVariableName(table.cell(row, varIndex));
            if (name.isEmpty()) continue;
            Double value = parseNumber(table.cell(row, colIndex));
            if (value != null) {
                result.put(name, value);
            }
        }
        return result;
    }

    /**
     * Row index of each cleaned variable name, later duplicates overriding
     * earlier ones in step with {@link #bindings(TableData, String)}.
     */
    public Map<String, Integer> rowIndex(TableData table) {
        Map<String, Integer> result = new LinkedHashMap<>();
        int varIndex = variableColumnIndex(table);
        if (varIndex < 0) {
            return result;
        }
        for (int row = 0; row < table.getRowCount(); row++) {
            String name = cleanVariableName(table.cell(row, varIndex));
            if (!name.isEmpty()) {
                result.put(name, row);
            }
        }
        return result;
    }

    public List<String> availableVariables(TableData table) {
        return new ArrayList<>(rowIndex(table).keySet());
    }

    public static String cleanVariableName(Object raw) {
        if (raw == null) return "";
        String name = raw.toString().trim();
        while (name.endsWith(",")) {
            name = name.substring(0, name.length() - 1).trim();
        }
        return name;
    }

    /**
     * Tolerant numeric parse: numbers pass through, strings keep only digits,
     * {@code .} and {@code -}. Returns null for anything that is not a finite number.
     */
    public static Double parseNumber(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
        }
        String cleaned = raw.toString().replaceAll("[^\\d.\\-]", "");
        if (cleaned.isEmpty() || cleaned.equals("-")) {
            return null;
        }
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            LoggingUtil.debug("Unparsable cell value '" + raw + "'");
            return null;
        }
    }
}
