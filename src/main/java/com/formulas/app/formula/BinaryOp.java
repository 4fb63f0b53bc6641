package com.formulas.app.formula;

import java.util.Objects;

/** Binary arithmetic expression combining two sub-expressions. */
public record BinaryOp(Operator operator, FormulaNode left, FormulaNode right) implements FormulaNode {

    public BinaryOp {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitBinaryOp(this);
    }

    /** Arithmetic operators for binary expressions. */
    public enum Operator {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Operator fromSymbol(String s) {
            switch (s) {
                case "+":
                    return ADD;
                case "-":
                    return SUB;
                case "*":
                    return MUL;
                case "/":
                    return DIV;
                default:
                    throw new IllegalArgumentException("Unknown arithmetic operator: " + s);
            }
        }
    }
}
