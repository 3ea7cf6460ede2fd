package com.labmuse.formula;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParseCacheTest {

    @Test
    public void testPutGetClear() {
        ParseCache cache = new ParseCache();
        List<Condition> conditions = new ArrayList<>(FormulaParser.parseFormula("A > 1"));

        cache.put("A > 1", conditions);
        conditions.clear();

        assertEquals(1, cache.get("A > 1").size());
        assertNull(cache.get("B > 1"));

        cache.clear();
        assertEquals(0, cache.size());
        assertNull(cache.get("A > 1"));
    }

    @Test
    public void testCachedListIsImmutable() {
        ParseCache cache = new ParseCache();
        cache.put("A > 1", FormulaParser.parseFormula("A > 1"));

        assertThrows(UnsupportedOperationException.class, () -> cache.get("A > 1").clear());
    }

    @Test
    public void testEmptyResultsAreCachedToo() {
        ParseCache cache = new ParseCache();

        assertTrue(FormulaParser.parse(">10", cache).isEmpty());
        assertEquals(1, cache.size());
    }
}
