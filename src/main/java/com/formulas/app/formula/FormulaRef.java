package com.formulas.app.formula;

import java.util.Objects;

/**
 * Dependency descriptor for a reference found while parsing. Used to learn which sheets and
 * columns a formula touches without evaluating it.
 *
 * @param sheetId resolved sheet id, null until resolved or for the current sheet
 * @param sheetLabel sheet qualifier as written, null for the current sheet
 * @param columnKey column name as written (column letters for A1 references)
 * @param displayName the reference text, e.g. {@code {Jan.Revenue}} or {@code A1:B2}
 */
public record FormulaRef(String sheetId, String sheetLabel, String columnKey, String displayName) {

    public FormulaRef {
        Objects.requireNonNull(columnKey, "columnKey");
        Objects.requireNonNull(displayName, "displayName");
    }

    public FormulaRef withSheetId(String id) {
        return new FormulaRef(id, sheetLabel, columnKey, displayName);
    }
}
