package com.formulas.app.formula;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaEvaluatorTest {

    /**
     * A failing resolver yields an EVALUATION result without exception details.
     */
    @Test
    void testUnexpectedFaultIsAResult() {
        ReferenceResolver broken = new ReferenceResolver() {
            @Override
            public Set<FormulaFunction> supportedFunctions() {
                return FormulaFunction.AGGREGATES;
            }

            @Override
            public FormulaResult resolveColumn(ColumnReference node) {
                throw new NullPointerException("row was null");
            }
        };

        FormulaResult result = FormulaEvaluator.evaluate(new ColumnReference(null, "Revenue", "{Revenue}"), broken);
        assertFalse(result.isOk());
        assertEquals(FormulaErrorKind.EVALUATION, result.getErrorKind());
        assertEquals("Evaluation error", result.getError());
    }
}
