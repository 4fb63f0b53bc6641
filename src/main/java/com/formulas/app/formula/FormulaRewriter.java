package com.formulas.app.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Copying visitor: rebuilds the tree node by node. Subclasses override the hooks for the
 * nodes they change; everything else is reproduced unchanged.
 */
public abstract class FormulaRewriter implements FormulaVisitor<FormulaNode> {

    public FormulaNode rewrite(FormulaNode root) {
        return root.accept(this);
    }

    @Override
    public FormulaNode visitNumber(NumberLiteral node) {
        return node;
    }

    @Override
    public FormulaNode visitCellReference(CellReference node) {
        return node;
    }

    @Override
    public FormulaNode visitCellRange(CellRange node) {
        return node;
    }

    @Override
    public FormulaNode visitColumnReference(ColumnReference node) {
        return node;
    }

    @Override
    public FormulaNode visitAggregateSelf(AggregateSelf node) {
        return node;
    }

    @Override
    public FormulaNode visitBinaryOp(BinaryOp node) {
        return new BinaryOp(node.operator(), node.left().accept(this), node.right().accept(this));
    }

    @Override
    public FormulaNode visitUnaryOp(UnaryOp node) {
        return new UnaryOp(node.operand().accept(this));
    }

    @Override
    public FormulaNode visitFunctionCall(FunctionCall node) {
        List<FormulaNode> args = new ArrayList<>(node.args().size());
        for (FormulaNode arg : node.args()) {
            args.add(arg.accept(this));
        }
        return new FunctionCall(node.name(), args);
    }

    @Override
    public FormulaNode visitGroup(Group node) {
        return new Group(node.expression().accept(this));
    }
}
