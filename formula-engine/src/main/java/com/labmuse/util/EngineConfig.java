package com.labmuse.util;

import java.io.*;
import java.util.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * EngineConfig - settings for the formula engine, with defaults matching the
 * laboratory table layout. Values can be overridden from a JSON document:
 *
 * <pre>
 * {
 *   "table":      { "variableColumn": "Variable", "excludedColumns": [...] },
 *   "evaluation": { "equalityEpsilon": 1e-10 },
 *   "matching":   { "tokenOverlapThreshold": 0.6, "minTokenLength": 3 },
 *   "highlight":  { "errorHighlighting": true, "errorColor": "#ff6b6b" },
 *   "validation": { "maxConditionsWarning": 3, "maxVariablesWarning": 5 },
 *   "logging":    { "level": "INFO", "console": true, "consoleOutput": "split",
 *                   "file": false, "fileName": "formula-engine.log" }
 * }
 * </pre>
 */
public class EngineConfig {

    public static final List<String> DEFAULT_EXCLUDED_COLUMNS =
            List.of("id", "Variable", "Data Source", "Method", "Unit", "LOQ");

    // Table layout
    private String variableColumn = "Variable";
    private Set<String> excludedColumns = new LinkedHashSet<>(DEFAULT_EXCLUDED_COLUMNS);

    // Evaluation
    private double equalityEpsilon = 1e-10;

    // Fuzzy variable matching
    private double tokenOverlapThreshold = 0.6;
    private int minTokenLength = 3;

    // Highlighting
    private boolean errorHighlighting = true;
    private String errorColor = "#ff6b6b";
    private String errorMessageSuffix = " (evaluation error)";

    // Validation heuristics for workspace formulas
    private int maxConditionsWarning = 3;
    private int maxVariablesWarning = 5;

    // Logging configuration
    private String loggingLevel = "INFO";
    private boolean consoleLoggingEnabled = true;
    private LoggingUtil.ConsoleOutputMode consoleOutputMode = LoggingUtil.ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;
    private boolean fileLoggingEnabled = false;
    private String logFileName = "formula-engine.log";

    // Raw JSON config
    private JsonNode configJson;

    /**
     * Default configuration
     */
    public EngineConfig() {
    }

    /**
     * Constructor that loads from file
     */
    public EngineConfig(String configFilePath) throws IOException {
        loadFromFile(configFilePath);
    }

    /**
     * Load configuration from a JSON file. A missing file keeps the defaults.
     */
    public void loadFromFile(String configFilePath) throws IOException {
        File configFile = new File(configFilePath);
        if (!configFile.exists()) {
            LoggingUtil.warn("Engine config file not found: " + configFilePath);
            LoggingUtil.info("Using default engine configuration");
            return;
        }

        try (InputStream in = new FileInputStream(configFile)) {
            loadFromStream(in);
        }
    }

    /**
     * Load configuration from a classpath resource. A missing resource keeps the defaults.
     */
    public void loadFromResource(String resourceName) throws IOException {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                LoggingUtil.warn("Engine config resource not found: " + resourceName);
                return;
            }
            loadFromStream(in);
        }
    }

    /**
     * Load configuration from a JSON stream
     */
    public void loadFromStream(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        configJson = mapper.readTree(in);
        if (configJson == null || !configJson.isObject()) {
            throw new IOException("Engine configuration must be a JSON object");
        }

        if (configJson.has("table")) {
            JsonNode tableNode = configJson.get("table");

            if (tableNode.has("variableColumn")) {
                variableColumn = tableNode.get("variableColumn").asText();
            }

            if (tableNode.has("excludedColumns")) {
                JsonNode columnsNode = tableNode.get("excludedColumns");
                if (columnsNode.isArray()) {
                    excludedColumns.clear();
                    for (JsonNode columnNode : columnsNode) {
                        excludedColumns.add(columnNode.asText());
                    }
                }
            }
            // The variable column never holds values
            excludedColumns.add(variableColumn);
        }

        if (configJson.has("evaluation")) {
            JsonNode evaluationNode = configJson.get("evaluation");

            if (evaluationNode.has("equalityEpsilon")) {
                equalityEpsilon = evaluationNode.get("equalityEpsilon").asDouble(equalityEpsilon);
            }
        }

        if (configJson.has("matching")) {
            JsonNode matchingNode = configJson.get("matching");

            if (matchingNode.has("tokenOverlapThreshold")) {
                tokenOverlapThreshold = matchingNode.get("tokenOverlapThreshold").asDouble(tokenOverlapThreshold);
            }

            if (matchingNode.has("minTokenLength")) {
                minTokenLength = matchingNode.get("minTokenLength").asInt(minTokenLength);
            }
        }

        if (configJson.has("highlight")) {
            JsonNode highlightNode = configJson.get("highlight");

            if (highlightNode.has("errorHighlighting")) {
                errorHighlighting = highlightNode.get("errorHighlighting").asBoolean();
            }

            if (highlightNode.has("errorColor")) {
                errorColor = highlightNode.get("errorColor").asText();
            }

            if (highlightNode.has("errorMessageSuffix")) {
                errorMessageSuffix = highlightNode.get("errorMessageSuffix").asText();
            }
        }

        if (configJson.has("validation")) {
            JsonNode validationNode = configJson.get("validation");

            if (validationNode.has("maxConditionsWarning")) {
                maxConditionsWarning = validationNode.get("maxConditionsWarning").asInt(maxConditionsWarning);
            }

            if (validationNode.has("maxVariablesWarning")) {
                maxVariablesWarning = validationNode.get("maxVariablesWarning").asInt(maxVariablesWarning);
            }
        }

        if (configJson.has("logging")) {
            JsonNode loggingNode = configJson.get("logging");

            if (loggingNode.has("level")) {
                loggingLevel = loggingNode.get("level").asText();
            }

            if (loggingNode.has("console")) {
                consoleLoggingEnabled = loggingNode.get("console").asBoolean();
            }

            if (loggingNode.has("consoleOutput")) {
                consoleOutputMode = parseConsoleOutput(loggingNode.get("consoleOutput").asText());
            }

            if (loggingNode.has("file")) {
                fileLoggingEnabled = loggingNode.get("file").asBoolean();
            }

            if (loggingNode.has("fileName")) {
                logFileName = loggingNode.get("fileName").asText();
            }
        }

        validate();
        LoggingUtil.debug("Loaded engine configuration: " + this);
    }

    /**
     * "out", "err" or "split" (severe messages to stderr, the rest to stdout).
     */
    private LoggingUtil.ConsoleOutputMode parseConsoleOutput(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "out": return LoggingUtil.ConsoleOutputMode.ALL_TO_OUT;
            case "err": return LoggingUtil.ConsoleOutputMode.ALL_TO_ERR;
            case "split": return LoggingUtil.ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;
            default:
                LoggingUtil.warn("Unknown console output '" + value + "', keeping " + consoleOutputMode);
                return consoleOutputMode;
        }
    }

    private void validate() throws IOException {
        if (variableColumn == null || variableColumn.isBlank()) {
            throw new IOException("table.variableColumn must not be blank");
        }
        if (equalityEpsilon < 0) {
            throw new IOException("evaluation.equalityEpsilon must not be negative: " + equalityEpsilon);
        }
        if (tokenOverlapThreshold <= 0 || tokenOverlapThreshold > 1) {
            throw new IOException("matching.tokenOverlapThreshold must be in (0, 1]: " + tokenOverlapThreshold);
        }
        if (minTokenLength < 1) {
            throw new IOException("matching.minTokenLength must be positive: " + minTokenLength);
        }
    }

    public String getVariableColumn() {
        return variableColumn;
    }

    public void setVariableColumn(String variableColumn) {
        this.variableColumn = variableColumn;
        this.excludedColumns.add(variableColumn);
    }

    public Set<String> getExcludedColumns() {
        return Collections.unmodifiableSet(excludedColumns);
    }

    public void setExcludedColumns(Collection<String> columns) {
        excludedColumns = new LinkedHashSet<>(columns);
        excludedColumns.add(variableColumn);
    }

    public double getEqualityEpsilon() {
        return equalityEpsilon;
    }

    public void setEqualityEpsilon(double equalityEpsilon) {
        this.equalityEpsilon = equalityEpsilon;
    }

    public double getTokenOverlapThreshold() {
        return tokenOverlapThreshold;
    }

    public void setTokenOverlapThreshold(double tokenOverlapThreshold) {
        this.tokenOverlapThreshold = tokenOverlapThreshold;
    }

    public int getMinTokenLength() {
        return minTokenLength;
    }

    public void setMinTokenLength(int minTokenLength) {
        this.minTokenLength = minTokenLength;
    }

    public boolean isErrorHighlighting() {
        return errorHighlighting;
    }

    public void setErrorHighlighting(boolean errorHighlighting) {
        this.errorHighlighting = errorHighlighting;
    }

    public String getErrorColor() {
        return errorColor;
    }

    public void setErrorColor(String errorColor) {
        this.errorColor = errorColor;
    }

    public String getErrorMessageSuffix() {
        return errorMessageSuffix;
    }

    public int getMaxConditionsWarning() {
        return maxConditionsWarning;
    }

    public int getMaxVariablesWarning() {
        return maxVariablesWarning;
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public LoggingUtil.ConsoleOutputMode getConsoleOutputMode() {
        return consoleOutputMode;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }

    public JsonNode getConfigJson() {
        return configJson;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "variableColumn='" + variableColumn + '\'' +
                ", excludedColumns=" + excludedColumns +
                ", equalityEpsilon=" + equalityEpsilon +
                ", tokenOverlapThreshold=" + tokenOverlapThreshold +
                ", minTokenLength=" + minTokenLength +
                ", errorHighlighting=" + errorHighlighting +
                ", errorColor='" + errorColor + '\'' +
                ", loggingLevel='" + loggingLevel + '\'' +
                ", consoleOutput=" + consoleOutputMode +
                '}';
    }
}
