package com.formulas.app.formula;

import java.util.Objects;

/** Negation, the only unary operator. */
public record UnaryOp(FormulaNode operand) implements FormulaNode {

    public UnaryOp {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
