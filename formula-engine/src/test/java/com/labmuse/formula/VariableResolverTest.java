package com.labmuse.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class VariableResolverTest {

    private VariableResolver resolver;
    private TableData table;

    @BeforeEach
    public void setup() {
        resolver = new VariableResolver();
        table = new TableData(
                List.of("id", "Variable", "Data Source", "Method", "Unit", "LOQ", "Ocak", "Şubat"),
                List.of(
                        Arrays.asList(1, "İletkenlik", "Lab", "EN 27888", "µS/cm", 1, 420, "380"),
                        Arrays.asList(2, "Toplam Fosfor,", "Lab", "SM 4500", "mg/L", 0.01, "<0.05", "0.12"),
                        Arrays.asList(3, "Nitrat", "Lab", "SM 4500", "mg/L", 0.1, "n/a", "-"),
                        Arrays.asList(4, "  ", "Lab", null, null, null, 5, 6),
                        Arrays.asList(5, "Nitrat", "Lab", "SM 4500", "mg/L", 0.1, 2.5, null)));
    }

    @Test
    public void testDataColumnsExcludeMetadata() {
        assertEquals(1, resolver.variableColumnIndex(table));
        assertEquals(List.of("Ocak", "Şubat"), resolver.dataColumns(table));
    }

    @Test
    public void testBindingsPerColumn() {
        Map<String, Double> ocak = resolver.bindings(table, "Ocak");

        assertEquals(420.0, ocak.get("İletkenlik"));
        assertEquals(0.05, ocak.get("Toplam Fosfor"));
        // later duplicate wins
        assertEquals(2.5, ocak.get("Nitrat"));
        assertEquals(3, ocak.size());
    }

    @Test
    public void testUnparsableValuesOmitted() {
        Map<String, Double> subat = resolver.bindings(table, "Şubat");

        assertEquals(380.0, subat.get("İletkenlik"));
        assertEquals(0.12, subat.get("Toplam Fosfor"));
        assertFalse(subat.containsKey("Nitrat"));
    }

    @Test
    public void testRowIndexFollowsBindings() {
        Map<String, Integer> rows = resolver.rowIndex(table);

        assertEquals(0, rows.get("İletkenlik"));
        assertEquals(1, rows.get("Toplam Fosfor"));
        assertEquals(4, rows.get("Nitrat"));
        assertEquals(List.of("İletkenlik", "Toplam Fosfor", "Nitrat"), resolver.availableVariables(table));
    }

    @Test
    public void testMissingVariableColumn() {
        TableData noVariables = new TableData(List.of("Name", "Ocak"), List.of(Arrays.asList("A", 1)));

        assertEquals(-1, resolver.variableColumnIndex(noVariables));
        assertTrue(resolver.bindings(noVariables, "Ocak").isEmpty());
        assertTrue(resolver.availableVariables(noVariables).isEmpty());
    }

    @Test
    public void testShortRowsTolerated() {
        TableData ragged = new TableData(List.of("Variable", "Ocak", "Şubat"),
                List.of(Arrays.asList("A", 1), Arrays.asList("B", 2, 3)));

        assertEquals(Map.of("B", 3.0), resolver.bindings(ragged, "Şubat"));
    }

    @Test
    public void testParseNumber() {
        assertEquals(12.0, VariableResolver.parseNumber(12));
        assertEquals(0.05, VariableResolver.parseNumber("<0.05"));
        assertEquals(1234.5, VariableResolver.parseNumber("1,234.5"));
        assertEquals(-3.0, VariableResolver.parseNumber(" -3 mg/L"));
        assertNull(VariableResolver.parseNumber(null));
        assertNull(VariableResolver.parseNumber(""));
        assertNull(VariableResolver.parseNumber("-"));
        assertNull(VariableResolver.parseNumber("n/a"));
        assertNull(VariableResolver.parseNumber("1-2"));
        assertNull(VariableResolver.parseNumber(Double.NaN));
    }

    @Test
    public void testCleanVariableName() {
        assertEquals("Toplam Fosfor", VariableResolver.cleanVariableName("  Toplam Fosfor,, "));
        assertEquals("", VariableResolver.cleanVariableName(null));
    }
}
