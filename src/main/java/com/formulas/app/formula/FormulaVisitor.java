package com.formulas.app.formula;

/**
 * Double-dispatch over {@link FormulaNode} variants.
 */
public interface FormulaVisitor<T> {

    T visitNumber(NumberLiteral node);

    T visitCellReference(CellReference node);

    T visitCellRange(CellRange node);

    T visitColumnReference(ColumnReference node);

    T visitAggregateSelf(AggregateSelf node);

    T visitBinaryOp(BinaryOp node);

    T visitUnaryOp(UnaryOp node);

    T visitFunctionCall(FunctionCall node);

    T visitGroup(Group node);
}
