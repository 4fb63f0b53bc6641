package com.formulas.app.formula.column;

import com.formulas.app.formula.FormulaContext;
import com.formulas.app.formula.SheetSnapshot;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The row a column formula is being evaluated for.
 */
public final class RowContext {

    /** Fields consulted, in order, when no identity key is configured. */
    static final List<String> LEGACY_IDENTITY_FIELDS = List.of("id", "identity", "rowId");

    private final int rowIndex;
    private final Map<String, Object> row;
    private final Object identity;

    /**
     * @param rowIndex 0-based index of the row in the current sheet, used in error text
     * @param row the row's values by column key
     * @param identity the row's identity value for cross-sheet matching, or null
     */
    public RowContext(int rowIndex, Map<String, Object> row, Object identity) {
        this.rowIndex = rowIndex;
        this.row = row == null ? Collections.emptyMap() : row;
        this.identity = identity;
    }

    /**
     * Context for row {@code rowIndex} of the context's current sheet. The identity is read from
     * the configured identity key, or else from the first of id/identity/rowId that is set.
     *
     * @throws IndexOutOfBoundsException if the current sheet has no such row
     */
    public static RowContext of(FormulaContext context, int rowIndex) {
        SheetSnapshot sheet = context.getSheet(context.getCurrentSheetId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown sheet " + context.getCurrentSheetId()));
        Map<String, Object> row = sheet.getRows().get(rowIndex);
        return new RowContext(rowIndex, row, identityOf(context, row));
    }

    static Object identityOf(FormulaContext context, Map<String, Object> row) {
        if (context.getIdentityKey() != null) {
            return row.get(context.getIdentityKey());
        }
        for (String field : LEGACY_IDENTITY_FIELDS) {
            if (row.get(field) != null) {
                return row.get(field);
            }
        }
        return null;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    public Map<String, Object> getRow() {
        return row;
    }

    public Object getIdentity() {
        return identity;
    }
}
