package com.formulas.app.formula.cell;

import com.formulas.app.formula.CellEvalContext;
import com.formulas.app.formula.FormulaContextBuilder;
import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.FormulaResult;
import com.formulas.app.formula.ValueFormat;
import com.formulas.app.models.ColumnDefinition;
import com.formulas.app.models.SheetData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Evaluation of A1 formulas against an in-memory workbook:
 *
 * <pre>
 *          A      B     C
 *   1     10    "$5"   "x"
 *   2     20     3
 *   3  "30.5"
 * </pre>
 *
 * plus a second sheet "Jan 2026" with A1 = 100.
 */
class CellFormulaEvaluatorTest {

    private static final List<ColumnDefinition> COLUMNS = List.of(
            new ColumnDefinition("a", "A"),
            new ColumnDefinition("b", "B"),
            new ColumnDefinition("c", "C"));

    private CellEvalContext context;

    @BeforeEach
    void setUp() {
        SheetData main = SheetData.of("s1", "Sheet1",
                Map.of("a", 10, "b", "$5", "c", "x"),
                Map.of("a", 20, "b", 3),
                Map.of("a", "30.5"));
        SheetData jan = SheetData.of("s2", "Jan 2026", Map.of("a", 100));
        context = FormulaContextBuilder.buildCellContext("s1", List.of(main, jan), COLUMNS);
    }

    private FormulaResult eval(String formula) {
        return CellFormulaEvaluator.evaluate(formula, context);
    }

    private double value(String formula) {
        FormulaResult result = eval(formula);
        assertTrue(result.isOk(), formula + ": " + result.getError());
        return result.getValue();
    }

    @Test
    void testLiterals() {
        for (double n : new double[]{0, 42, 0.5, 123456.75}) {
            assertEquals(FormulaResult.of(n), eval("=" + n));
        }
        assertEquals(7.0, value("=1+2*3"));
        assertEquals(9.0, value("=(1+2)*3"));
        assertEquals(-4.0, value("=-(2+2)"));
    }

    @Test
    void testDivisionByZero() {
        FormulaResult result = eval("=1/0");
        assertFalse(result.isOk());
        assertEquals(FormulaErrorKind.ARITHMETIC, result.getErrorKind());
        assertTrue(result.getError().contains("Division by zero"));

        // an empty cell is zero too
        assertEquals(FormulaErrorKind.ARITHMETIC, eval("=A1/B3").getErrorKind());
    }

    @Test
    void testCellValues() {
        assertEquals(FormulaResult.of(10), eval("=A1"));
        assertEquals(FormulaResult.of(5, ValueFormat.CURRENCY), eval("=B1"));
        assertEquals(FormulaResult.of(30.5), eval("=A3"));
        assertEquals(FormulaResult.zero(), eval("=B3"));
        assertEquals(FormulaResult.zero(), eval("=A99"));
        assertEquals(200.0, value("='Jan 2026'!A1*2"));
    }

    @Test
    void testRanges() {
        assertEquals(FormulaResult.of(38, ValueFormat.CURRENCY), eval("=SUM(A1:B2)"));
        assertEquals(eval("=SUM(A1:B2)"), eval("=SUM(B2:A1)"));
        assertEquals(eval("=SUM(A1:B2)"), eval("=SUM(A2:B1)"));

        // text is skipped inside ranges
        assertEquals(FormulaResult.of(15, ValueFormat.CURRENCY), eval("=SUM(A1:C1)"));
        assertEquals(FormulaResult.of(4, ValueFormat.PLAIN), eval("=COUNT(A1:B2)"));
        assertEquals(60.5, value("=SUM(A1:A3)"));
        assertEquals(30.5, value("=MAX(A1:A3)"));
        assertEquals(3.0, value("=MIN(A1:C3)"));

        // a bare range is its sum
        assertEquals(30.0, value("=A1:A2"));
    }

    @Test
    void testEmptyAggregatesAreZero() {
        for (String fn : new String[]{"SUM", "COUNT", "AVERAGE", "MIN", "MAX"}) {
            assertEquals(FormulaResult.zero(), eval("=" + fn + "(C5:C9)"), fn);
            assertEquals(FormulaResult.zero(), eval("=" + fn + "()"), fn);
        }
    }

    @Test
    void testFormatPropagation() {
        CellEvalContext ctx = FormulaContextBuilder.buildCellContext("s1",
                List.of(SheetData.of("s1", "Sheet1", Map.of("a", "$5"), Map.of("a", 3), Map.of("a", "50%"))),
                COLUMNS);

        assertEquals(FormulaResult.of(8, ValueFormat.CURRENCY), CellFormulaEvaluator.evaluate("=A1+A2", ctx));
        assertEquals(FormulaResult.of(50, ValueFormat.PERCENT), CellFormulaEvaluator.evaluate("=A3", ctx));
        assertEquals(FormulaResult.of(55, ValueFormat.CURRENCY), CellFormulaEvaluator.evaluate("=A3+A1", ctx));
        assertEquals(FormulaResult.of(3, ValueFormat.PLAIN), CellFormulaEvaluator.evaluate("=COUNT(A1:A3)", ctx));
        assertEquals(FormulaResult.of(5, ValueFormat.CURRENCY), CellFormulaEvaluator.evaluate("=ABS(-A1)", ctx));
    }

    @Test
    void testRoundEndToEnd() {
        assertEquals(20.17, value("=ROUND(SUM(A1:A3)/3,2)"), 1e-9);
        assertEquals(20.0, value("=ROUND(AVERAGE(A1:A3))"));
        assertEquals(1200.0, value("=ROUND(1234.5,-2)"));
        assertEquals(-3.0, value("=ROUND(-2.5)"));
    }

    @Test
    void testFunctions() {
        assertEquals(2.0, value("=AVG(1,3)"));
        assertEquals(7.0, value("=abs(-7)"));
        assertEquals(33.0, value("=SUM(A1:A2,B2)"));

        FormulaResult unknown = eval("=FOO(1)");
        assertEquals(FormulaErrorKind.RESOLUTION, unknown.getErrorKind());
        assertEquals("Unknown function: FOO", unknown.getError());

        FormulaResult arity = eval("=ABS(1,2)");
        assertEquals(FormulaErrorKind.ARITY, arity.getErrorKind());
        assertEquals(FormulaErrorKind.ARITY, eval("=ROUND()").getErrorKind());
    }

    @Test
    void testResolutionErrors() {
        FormulaResult sheet = eval("='Nope'!A1");
        assertEquals(FormulaErrorKind.RESOLUTION, sheet.getErrorKind());
        assertTrue(sheet.getError().contains("Nope"));
        assertTrue(eval("=SUM('Nope'!A1:A2)").getError().contains("Nope"));

        FormulaResult column = eval("=D1");
        assertEquals("Column D not found", column.getError());
        assertEquals("Column D not found", eval("=SUM(A1:D1)").getError());

        CellEvalContext orphan = FormulaContextBuilder.buildCellContext("gone", List.of(), COLUMNS);
        assertEquals("Sheet data not found for ID \"gone\"", CellFormulaEvaluator.evaluate("=A1", orphan).getError());
    }

    @Test
    void testConversionError() {
        FormulaResult result = eval("=C1+1");
        assertEquals(FormulaErrorKind.CONVERSION, result.getErrorKind());
        assertTrue(result.getError().contains("\"x\""));
        assertTrue(result.getError().contains("C1"));
    }

    @Test
    void testFirstErrorWins() {
        assertEquals("Column D not found", eval("=D1+1/0").getError());
        assertEquals("Division by zero", eval("=SUM(1/0, D1)").getError());
    }

    @Test
    void testOverflowIsAnError() {
        CellEvalContext ctx = FormulaContextBuilder.buildCellContext("s1",
                List.of(SheetData.of("s1", "Sheet1", Map.of("a", 1e308))), COLUMNS);
        FormulaResult result = CellFormulaEvaluator.evaluate("=A1*10", ctx);
        assertEquals(FormulaErrorKind.ARITHMETIC, result.getErrorKind());
        assertEquals("Numeric overflow", result.getError());
        assertEquals(FormulaErrorKind.ARITHMETIC, CellFormulaEvaluator.evaluate("=SUM(A1,A1)", ctx).getErrorKind());
    }

    @Test
    void testParseFailureIsAResult() {
        FormulaResult result = eval("=A1+");
        assertFalse(result.isOk());
        assertEquals(FormulaErrorKind.PARSE, result.getErrorKind());
    }
}
