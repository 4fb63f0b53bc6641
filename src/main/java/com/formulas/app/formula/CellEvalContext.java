package com.formulas.app.formula;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup structures for A1 cell formulas: sheets by id and label, and the visible column order
 * shared by all sheets (column index 0 is "A"). Built by {@link FormulaContextBuilder}.
 */
public final class CellEvalContext {

    private final String currentSheetId;
    private final Map<String, SheetSnapshot> sheets;
    private final Map<String, String> sheetLabelToId;
    private final Map<String, Integer> columnKeyToIndex;
    private final List<String> columnKeys;

    CellEvalContext(String currentSheetId, Map<String, SheetSnapshot> sheets, Map<String, String> sheetLabelToId,
                    Map<String, Integer> columnKeyToIndex, List<String> columnKeys) {
        this.currentSheetId = currentSheetId;
        this.sheets = Collections.unmodifiableMap(sheets);
        this.sheetLabelToId = Collections.unmodifiableMap(sheetLabelToId);
        this.columnKeyToIndex = Collections.unmodifiableMap(columnKeyToIndex);
        this.columnKeys = List.copyOf(columnKeys);
    }

    public String getCurrentSheetId() {
        return currentSheetId;
    }

    public Optional<SheetSnapshot> getSheet(String sheetId) {
        return Optional.ofNullable(sheets.get(sheetId));
    }

    public Optional<String> resolveSheetLabel(String label) {
        return Optional.ofNullable(sheetLabelToId.get(label));
    }

    /** Column key at a 0-based visible index, or empty when out of range. */
    public Optional<String> columnKeyAt(int index) {
        return index >= 0 && index < columnKeys.size() ? Optional.of(columnKeys.get(index)) : Optional.empty();
    }

    public Optional<Integer> columnIndexOf(String key) {
        return Optional.ofNullable(columnKeyToIndex.get(key));
    }

    public int getColumnCount() {
        return columnKeys.size();
    }
}
