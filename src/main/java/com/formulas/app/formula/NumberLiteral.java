package com.formulas.app.formula;

/** Numeric literal value. Always non-negative; a sign is a {@link UnaryOp}. */
public record NumberLiteral(double value) implements FormulaNode {

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitNumber(this);
    }
}
