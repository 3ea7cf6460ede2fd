package com.labmuse.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EngineConfigTest {

    private EngineConfig config;

    @BeforeEach
    public void setup() {
        config = new EngineConfig();
    }

    @AfterEach
    public void tearDown() {
        LoggingUtil.reset();
    }

    private static ByteArrayInputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testDefaults() {
        assertEquals("Variable", config.getVariableColumn());
        assertTrue(config.getExcludedColumns().containsAll(EngineConfig.DEFAULT_EXCLUDED_COLUMNS));
        assertEquals(1e-10, config.getEqualityEpsilon());
        assertEquals(0.6, config.getTokenOverlapThreshold());
        assertEquals(3, config.getMinTokenLength());
        assertTrue(config.isErrorHighlighting());
        assertEquals("#ff6b6b", config.getErrorColor());
        assertEquals(3, config.getMaxConditionsWarning());
        assertEquals(5, config.getMaxVariablesWarning());
        assertEquals("INFO", config.getLoggingLevel());
    }

    @Test
    public void testLoadFromResource() throws IOException {
        config.loadFromResource("engine-config.json");

        assertEquals("Parametre", config.getVariableColumn());
        assertTrue(config.getExcludedColumns().contains("Parametre"));
        assertTrue(config.getExcludedColumns().contains("Yöntem"));
        assertFalse(config.getExcludedColumns().contains("Variable"));
        assertEquals(0.001, config.getEqualityEpsilon());
        assertEquals(0.75, config.getTokenOverlapThreshold());
        assertEquals(4, config.getMinTokenLength());
        assertFalse(config.isErrorHighlighting());
        assertEquals("#cc0000", config.getErrorColor());
        assertEquals(2, config.getMaxConditionsWarning());
        assertEquals(5, config.getMaxVariablesWarning());
        assertEquals("DEBUG", config.getLoggingLevel());
        assertFalse(config.isConsoleLoggingEnabled());
    }

    @Test
    public void testMissingFileKeepsDefaults() throws IOException {
        config.loadFromFile("does-not-exist/engine-config.json");

        assertEquals("Variable", config.getVariableColumn());
        assertNull(config.getConfigJson());
    }

    @Test
    public void testInvalidValuesRejected() {
        assertThrows(IOException.class,
                () -> config.loadFromStream(json("{\"matching\": {\"tokenOverlapThreshold\": 1.5}}")));
        assertThrows(IOException.class,
                () -> new EngineConfig().loadFromStream(json("{\"evaluation\": {\"equalityEpsilon\": -1}}")));
        assertThrows(IOException.class, () -> new EngineConfig().loadFromStream(json("[1, 2]")));
    }

    @Test
    public void testVariableColumnAlwaysExcluded() {
        config.setExcludedColumns(List.of("id"));
        assertTrue(config.getExcludedColumns().contains("Variable"));

        config.setVariableColumn("Parametre");
        assertTrue(config.getExcludedColumns().contains("Parametre"));
    }

    @Test
    public void testLoggingInitializedFromConfig() throws IOException {
        config.loadFromStream(json("{\"logging\": {\"level\": \"DEBUG\", \"console\": false}}"));
        LoggingUtil.reset();
        LoggingUtil.initialize(config);

        assertTrue(LoggingUtil.isDebugEnabled());
    }

    @Test
    public void testConsoleOutputParsed() throws IOException {
        assertEquals(LoggingUtil.ConsoleOutputMode.SPLIT_SEVERE_TO_ERR, config.getConsoleOutputMode());

        config.loadFromStream(json("{\"logging\": {\"consoleOutput\": \"err\"}}"));
        assertEquals(LoggingUtil.ConsoleOutputMode.ALL_TO_ERR, config.getConsoleOutputMode());

        config.loadFromStream(json("{\"logging\": {\"consoleOutput\": \"sideways\"}}"));
        assertEquals(LoggingUtil.ConsoleOutputMode.ALL_TO_ERR, config.getConsoleOutputMode());
    }

    @Test
    public void testConsoleOutputRoutesWarningsToStdout() throws IOException {
        config.loadFromStream(json("{\"logging\": {\"level\": \"INFO\", \"console\": true, \"consoleOutput\": \"out\"}}"));
        LoggingUtil.reset();

        PrintStream original = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
            LoggingUtil.initialize(config);
            LoggingUtil.warn("Column 'Ocak' has no numeric values");
        } finally {
            LoggingUtil.reset();
            System.setOut(original);
        }

        assertTrue(captured.toString(StandardCharsets.UTF_8).contains("Column 'Ocak' has no numeric values"));
    }
}
