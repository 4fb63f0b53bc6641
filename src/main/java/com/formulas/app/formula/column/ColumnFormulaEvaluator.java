package com.formulas.app.formula.column;

import com.formulas.app.formula.FormulaContext;
import com.formulas.app.formula.FormulaEvaluator;
import com.formulas.app.formula.FormulaNode;
import com.formulas.app.formula.FormulaResult;
import com.formulas.app.formula.ParseResult;

/**
 * Entry points for evaluating named-column formulas in either mode. Never throws.
 */
public final class ColumnFormulaEvaluator {

    private ColumnFormulaEvaluator() {
    }

    /**
     * Column formula: evaluated for one row, e.g. {@code {Revenue} - {Cost}}.
     */
    public static FormulaResult evaluateColumnFormula(FormulaNode ast, FormulaContext context, RowContext row) {
        return FormulaEvaluator.evaluate(ast, new ColumnFormulaResolver(context, row));
    }

    public static FormulaResult evaluateColumnFormula(String expression, FormulaContext context, RowContext row) {
        ParseResult parsed = ColumnFormulaParser.parse(expression);
        if (!parsed.isOk()) {
            return parsed.toFailure();
        }
        return evaluateColumnFormula(parsed.getAst(), context, row);
    }

    /**
     * Row formula: evaluated for one column, e.g. {@code SUM({column})}.
     */
    public static FormulaResult evaluateRowFormula(FormulaNode ast, FormulaContext context, ColumnContext column) {
        return FormulaEvaluator.evaluate(ast, new RowFormulaResolver(context, column));
    }

    public static FormulaResult evaluateRowFormula(String expression, FormulaContext context, ColumnContext column) {
        ParseResult parsed = ColumnFormulaParser.parse(expression);
        if (!parsed.isOk()) {
            return parsed.toFailure();
        }
        return evaluateRowFormula(parsed.getAst(), context, column);
    }
}
