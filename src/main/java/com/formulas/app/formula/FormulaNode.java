package com.formulas.app.formula;

/**
 * Parsed formula syntax tree, shared by the A1 cell language and the named-column language.
 *
 * <p>Nodes are immutable and depend only on the formula text, so a parsed tree can be cached
 * and evaluated any number of times against different contexts.
 *
 * <pre>
 * // =SUM(A1:A3)*2
 * FormulaNode ast = new BinaryOp(
 *     BinaryOp.Operator.MUL,
 *     new FunctionCall("SUM", List.of(new CellRange(a1, a3))),
 *     new NumberLiteral(2));
 * </pre>
 */
public sealed interface FormulaNode
        permits NumberLiteral, CellReference, CellRange, ColumnReference, AggregateSelf,
                BinaryOp, UnaryOp, FunctionCall, Group {

    <T> T accept(FormulaVisitor<T> visitor);
}
