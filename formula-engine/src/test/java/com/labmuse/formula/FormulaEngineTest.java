package com.labmuse.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaEngineTest {

    private FormulaEngine engine;
    private TableData table;

    @BeforeEach
    public void setup() {
        engine = new FormulaEngine();
        table = new TableData(
                List.of("id", "Variable", "Data Source", "Method", "Unit", "LOQ", "Nokta 1", "Nokta 2"),
                List.of(
                        Arrays.asList(1, "İletkenlik", "Lab", "EN 27888", "µS/cm", 1, 420, 250),
                        Arrays.asList(2, "Toplam Fosfor", "Lab", "SM 4500", "mg/L", 0.01, "0.30", "0.05"),
                        Arrays.asList(3, "Orto Fosfat", "Lab", "SM 4500", "mg/L", 0.01, "0.10", "0.08")));
    }

    @Test
    public void testHighlightWaterQualityTable() {
        List<Formula> formulas = List.of(
                new Formula("f1", "Yüksek iletkenlik", "İletkenlik > 312", "#ff0000"),
                new Formula("f2", "Fosfor dengesi", "[Toplam Fosfor] >= [Orto Fosfat] * 2", "#ffaa00"));

        List<HighlightedCell> cells = engine.highlight(formulas, table);

        assertEquals(2, cells.size());
        assertEquals("row-1", cells.get(0).getRow());
        assertEquals("Nokta 1", cells.get(0).getCol());
        assertEquals(List.of("f1"), cells.get(0).getFormulaIds());
        assertEquals("row-2", cells.get(1).getRow());
        assertEquals("Nokta 1", cells.get(1).getCol());
        assertEquals(List.of("f2"), cells.get(1).getFormulaIds());
    }

    @Test
    public void testParseCacheSharedAndCleared() {
        engine.parse("A > 1");
        engine.validate("İletkenlik > 312", table, FormulaScope.TABLE);

        assertEquals(2, engine.getCache().size());
        engine.clearCache();
        assertEquals(0, engine.getCache().size());
    }

    @Test
    public void testEvaluateWithBindings() {
        FormulaEvaluation evaluation = engine.evaluate("A == 0.3", Map.of("A", 0.1 + 0.2));

        assertTrue(evaluation.isValid());
        assertTrue(evaluation.getResult());
        assertFalse(engine.evaluate("<", Map.of()).isValid());
    }

    @Test
    public void testValidateAgainstTable() {
        ValidationResult result = engine.validate("iletkenlik > 312", table, FormulaScope.TABLE);

        assertTrue(result.isValid());
        assertEquals("İletkenlik", result.getTargetVariable());
        assertFalse(engine.validate("Klorür > 1", table, FormulaScope.TABLE).isValid());
    }

    @Test
    public void testSummary() {
        Formula inactive = new Formula("3", "c", "A > 1", null);
        inactive.setActive(false);
        List<Formula> formulas = List.of(
                new Formula("1", "a", "A > 1", null, FormulaScope.TABLE, "t1"),
                new Formula("2", "b", "A > 1", null, FormulaScope.WORKSPACE, null),
                inactive);

        FormulaSummary summary = engine.summarize(formulas);

        assertEquals(3, summary.getTotalFormulas());
        assertEquals(2, summary.getActiveFormulas());
        assertEquals(1, summary.getTableFormulas());
        assertEquals(1, summary.getWorkspaceFormulas());
        assertEquals(1, summary.getUnscopedFormulas());
    }
}
