package com.formulas.app.formula;

import java.util.Objects;

/** Parenthesised expression. Kept in the tree so printing reproduces the source grouping. */
public record Group(FormulaNode expression) implements FormulaNode {

    public Group {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitGroup(this);
    }
}
