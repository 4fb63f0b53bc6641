package com.formulas.app.formula;

import java.util.Objects;

/**
 * Named column reference: {@code {Revenue}} or {@code {Jan 2026.Revenue}}.
 *
 * @param sheetLabel sheet qualifier, or null for the current sheet
 * @param columnName column label or key as written
 * @param raw the reference exactly as it appeared in the formula
 */
public record ColumnReference(String sheetLabel, String columnName, String raw) implements FormulaNode {

    public ColumnReference {
        Objects.requireNonNull(columnName, "columnName");
        Objects.requireNonNull(raw, "raw");
    }

    public boolean isCrossSheet() {
        return sheetLabel != null;
    }

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitColumnReference(this);
    }
}
