package com.labmuse.formula;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-owned cache of parsed formulas keyed by raw formula text.
 * The engine never holds one implicitly; pass it in and clear it when formulas change.
 */
public class ParseCache {

    private final Map<String, List<Condition>> entries = new HashMap<>();

    public synchronized List<Condition> get(String formula) {
        return entries.get(formula);
    }

    public synchronized void put(String formula, List<Condition> conditions) {
        entries.put(formula, List.copyOf(conditions));
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }
}
