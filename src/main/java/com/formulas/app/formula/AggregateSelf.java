package com.formulas.app.formula;

/**
 * The {@code {column}} placeholder. In a row formula it stands for every value of the column
 * being evaluated; in a column formula it is an ordinary reference to a column named "column".
 */
public record AggregateSelf(String raw) implements FormulaNode {

    public static final String PLACEHOLDER = "column";

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitAggregateSelf(this);
    }
}
