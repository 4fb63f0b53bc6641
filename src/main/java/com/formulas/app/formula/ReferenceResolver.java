package com.formulas.app.formula;

import java.util.Set;

/**
 * Strategy plugged into {@link FormulaEvaluator}: turns reference nodes into values.
 *
 * <p>The {@code resolve*} methods are used where a reference stands for one value; the
 * {@code expand*} methods are used for aggregate function arguments, where a reference may stand
 * for many values. Reference kinds a language does not have are rejected by the defaults.
 */
public interface ReferenceResolver {

    /** Functions the evaluator may dispatch to. */
    Set<FormulaFunction> supportedFunctions();

    default FormulaResult resolveCell(CellReference node) {
        return unsupported(node.ref().toString());
    }

    default ValueList expandRange(CellRange node) {
        return ValueList.failure(unsupported(node.start() + ":" + node.end().toA1()));
    }

    default FormulaResult resolveColumn(ColumnReference node) {
        return unsupported(node.raw());
    }

    default ValueList expandColumn(ColumnReference node) {
        return ValueList.single(resolveColumn(node));
    }

    default FormulaResult resolveAggregateSelf(AggregateSelf node) {
        return unsupported(node.raw());
    }

    default ValueList expandAggregateSelf(AggregateSelf node) {
        return ValueList.single(resolveAggregateSelf(node));
    }

    private static FormulaResult unsupported(String reference) {
        return FormulaResult.failure(FormulaErrorKind.RESOLUTION,
                "Reference " + reference + " cannot be used in this kind of formula");
    }
}
