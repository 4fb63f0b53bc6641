package com.formulas.app.formula;

import java.math.BigDecimal;
import java.util.StringJoiner;

/**
 * Renders a tree back to formula text (without a leading {@code =}). Parsing the output
 * yields a structurally equal tree: grouping is preserved through {@link Group} nodes.
 */
public final class FormulaPrinter implements FormulaVisitor<String> {

    private static final FormulaPrinter INSTANCE = new FormulaPrinter();

    private FormulaPrinter() {
    }

    public static String toFormula(FormulaNode ast) {
        return ast.accept(INSTANCE);
    }

    /**
     * Plain decimal text, no exponent and no trailing zeros: 3 -> "3", 0.5 -> "0.5".
     */
    public static String formatNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public String visitNumber(NumberLiteral node) {
        return formatNumber(node.value());
    }

    @Override
    public String visitCellReference(CellReference node) {
        return node.ref().toString();
    }

    @Override
    public String visitCellRange(CellRange node) {
        return node.start() + ":" + node.end().toA1();
    }

    @Override
    public String visitColumnReference(ColumnReference node) {
        return node.raw();
    }

    @Override
    public String visitAggregateSelf(AggregateSelf node) {
        return node.raw();
    }

    @Override
    public String visitBinaryOp(BinaryOp node) {
        return node.left().accept(this) + node.operator().symbol() + node.right().accept(this);
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return "-" + node.operand().accept(this);
    }

    @Override
    public String visitFunctionCall(FunctionCall node) {
        StringJoiner args = new StringJoiner(",", node.name() + "(", ")");
        for (FormulaNode arg : node.args()) {
            args.add(arg.accept(this));
        }
        return args.toString();
    }

    @Override
    public String visitGroup(Group node) {
        return "(" + node.expression().accept(this) + ")";
    }
}
