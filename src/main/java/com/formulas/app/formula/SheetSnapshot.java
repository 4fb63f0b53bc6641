package com.formulas.app.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of one sheet's rows, taken when a context is built.
 */
public final class SheetSnapshot {

    private final String id;
    private final String label;
    private final List<Map<String, Object>> rows;

    SheetSnapshot(String id, String label, List<Map<String, Object>> rows) {
        this.id = id;
        this.label = label;
        List<Map<String, Object>> copy = new ArrayList<>();
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                // values may legitimately be null, so no Map.copyOf here
                copy.add(Collections.unmodifiableMap(row == null ? new LinkedHashMap<>() : new LinkedHashMap<>(row)));
            }
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    /** The row at a 0-based index, or null past the end. */
    public Map<String, Object> getRow(int index) {
        return index >= 0 && index < rows.size() ? rows.get(index) : null;
    }
}
