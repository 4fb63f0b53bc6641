package com.formulas.app.formula.cell;

import com.formulas.app.formula.CellEvalContext;
import com.formulas.app.formula.FormulaEvaluator;
import com.formulas.app.formula.FormulaNode;
import com.formulas.app.formula.FormulaResult;
import com.formulas.app.formula.ParseResult;

/**
 * Entry points for evaluating A1 cell formulas. Never throws.
 */
public final class CellFormulaEvaluator {

    private CellFormulaEvaluator() {
    }

    public static FormulaResult evaluate(FormulaNode ast, CellEvalContext context) {
        return FormulaEvaluator.evaluate(ast, new CellReferenceResolver(context));
    }

    /**
     * Parses and evaluates in one step; parse failures come back as failed results.
     */
    public static FormulaResult evaluate(String formula, CellEvalContext context) {
        ParseResult parsed = CellFormulaParser.parse(formula);
        if (!parsed.isOk()) {
            return parsed.toFailure();
        }
        return evaluate(parsed.getAst(), context);
    }
}
