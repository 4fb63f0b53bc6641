package com.formulas.app.formula;

import java.util.List;
import java.util.Objects;

/**
 * Function application. {@code name} is upper-cased by the lexer; whether it is a known function
 * is decided by the parser (named language) or the evaluator (A1 language).
 */
public record FunctionCall(String name, List<FormulaNode> args) implements FormulaNode {

    public FunctionCall {
        Objects.requireNonNull(name, "name");
        args = List.copyOf(args);
    }

    @Override
    public <T> T accept(FormulaVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
