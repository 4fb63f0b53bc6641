package com.formulas.app.formula;

import java.util.Objects;

/**
 * Rectangular A1 range. The corners are kept as written; evaluation normalises each axis,
 * so {@code A1:B2} and {@code B2:A1} cover the same cells. The sheet is taken from {@code start}.
 */
public record CellRange(CellRef start, CellRef end) implements FormulaNode {

    public CellRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public int firstRow() {
        return Math.min(start.row(), end.row());
    }

    public int lastRow() {
        return Math.max(start.row(), end.row());
    }

    public int firstColumn() {
        return Math.min(start.col(), end.col());
    }

    public int lastColumn() {
        return Math.max(start.col(), end.col());
    }

    /** Number of cells covered by the normalised rectangle. */
    public long cellCount() {
        return (long) (lastRow() - firstRow() + 1) * (lastColumn() - firstColumn() + 1);
    }

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitCellRange(this);
    }
}
