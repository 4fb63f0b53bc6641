package com.formulas.app.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One dataset snapshot as supplied by the caller:
 * - a stable 'id' (e.g. snapshot id)
 * - a display 'label' used in cross-sheet references (e.g. "Jan 2026")
 * - ordered 'rows', each a map of column key -> primitive value
 */
public class SheetData {
    private String id;
    private String label;
    private List<Map<String, Object>> rows = new ArrayList<>();

    // Default constructor needed for JSON (de)serialization
    public SheetData() {
    }

    public SheetData(String id, String label, List<Map<String, Object>> rows) {
        this.id = id;
        this.label = label;
        this.rows = rows;
    }

    /**
     * Convenience for tests and callers that build rows inline.
     */
    @SafeVarargs
    public static SheetData of(String id, String label, Map<String, Object>... rows) {
        List<Map<String, Object>> copy = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            copy.add(new LinkedHashMap<>(row));
        }
        return new SheetData(id, label, copy);
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
    public void setId(String id) {
        this.id = id;
    }
    public void setLabel(String label) {
        this.label = label;
    }
    public void setRows(List<Map<String, Object>> rows) {
        this.rows = rows == null ? new ArrayList<>() : rows;
    }
}
