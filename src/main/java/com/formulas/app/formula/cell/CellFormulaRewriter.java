package com.formulas.app.formula.cell;

import com.formulas.app.formula.CellRange;
import com.formulas.app.formula.CellRef;
import com.formulas.app.formula.CellReference;
import com.formulas.app.formula.FormulaNode;
import com.formulas.app.formula.FormulaPrinter;
import com.formulas.app.formula.FormulaRewriter;
import com.formulas.app.formula.ParseResult;

import java.util.Optional;

/**
 * Structural edits of cell formulas: shifting relative references when a formula is copied,
 * and growing ranges when rows or columns are appended to the data.
 */
public final class CellFormulaRewriter {

    private CellFormulaRewriter() {
    }

    /**
     * Moves every relative coordinate by the given deltas; {@code $}-pinned coordinates stay.
     *
     * @throws IllegalArgumentException if a reference would move above row 1 or left of column A
     */
    public static FormulaNode adjust(FormulaNode ast, int colDelta, int rowDelta) {
        return new FormulaRewriter() {
            @Override
            public FormulaNode visitCellReference(CellReference node) {
                return new CellReference(node.ref().shift(colDelta, rowDelta));
            }

            @Override
            public FormulaNode visitCellRange(CellRange node) {
                return new CellRange(node.start().shift(colDelta, rowDelta), node.end().shift(colDelta, rowDelta));
            }
        }.rewrite(ast);
    }

    /**
     * Grows every range whose end sits on {@code oldMax} (0-based, along {@code axis}) to end on
     * {@code newMax} instead. Absolute ends and single-cell references are never moved.
     */
    public static FormulaNode expandRanges(FormulaNode ast, ExpansionAxis axis, int oldMax, int newMax) {
        return new FormulaRewriter() {
            @Override
            public FormulaNode visitCellRange(CellRange node) {
                CellRef end = node.end();
                if (axis == ExpansionAxis.ROW && !end.absRow() && end.row() == oldMax) {
                    return new CellRange(node.start(), new CellRef(end.col(), newMax, end.absCol(), false, end.sheet()));
                }
                if (axis == ExpansionAxis.COLUMN && !end.absCol() && end.col() == oldMax) {
                    return new CellRange(node.start(), new CellRef(newMax, end.row(), false, end.absRow(), end.sheet()));
                }
                return node;
            }
        }.rewrite(ast);
    }

    /**
     * Text form of {@link #expandRanges(FormulaNode, ExpansionAxis, int, int)}: returns the
     * rewritten formula with a leading {@code =}, or empty when the formula does not parse.
     */
    public static Optional<String> expandRanges(String formula, ExpansionAxis axis, int oldMax, int newMax) {
        ParseResult parsed = CellFormulaParser.parse(formula);
        if (!parsed.isOk()) {
            return Optional.empty();
        }
        return Optional.of("=" + FormulaPrinter.toFormula(expandRanges(parsed.getAst(), axis, oldMax, newMax)));
    }
}
