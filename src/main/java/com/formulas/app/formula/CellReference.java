package com.formulas.app.formula;

import java.util.Objects;

/** Single A1-style cell reference such as {@code B5} or {@code 'Jan'!$A$1}. */
public record CellReference(CellRef ref) implements FormulaNode {

    public CellReference {
        Objects.requireNonNull(ref, "ref");
    }

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitCellReference(this);
    }
}
