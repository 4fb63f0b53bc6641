package com.formulas.app.formula.column;

import com.formulas.app.formula.FormulaContext;
import com.formulas.app.formula.FormulaContextBuilder;
import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.FormulaResult;
import com.formulas.app.formula.ValueFormat;
import com.formulas.app.models.ColumnDefinition;
import com.formulas.app.models.ColumnType;
import com.formulas.app.models.SheetData;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Column formulas: one evaluation per row.
 */
class ColumnFormulaEvaluatorTest {

    private static final List<ColumnDefinition> COLUMNS = List.of(
            new ColumnDefinition("id", "ID"),
            new ColumnDefinition("revenue", "Revenue"),
            new ColumnDefinition("cost", "Cost", ColumnType.CURRENCY),
            new ColumnDefinition("margin", "Margin"),
            new ColumnDefinition("zero", "Zero", ColumnType.NUMBER));

    private static final SheetData JAN = SheetData.of("jan", "Jan",
            Map.of("id", "y", "revenue", 80),
            Map.of("id", " X ", "revenue", 100));

    private static final SheetData FEB = SheetData.of("feb", "Feb",
            Map.of("id", "x", "revenue", "$1,200.00", "cost", 300, "margin", "12.5%", "zero", 0),
            Map.of("id", "z", "revenue", "abc"));

    private static FormulaResult evaluate(String expression, FormulaContext context, int row) {
        return ColumnFormulaEvaluator.evaluateColumnFormula(expression, context, RowContext.of(context, row));
    }

    private static FormulaContext withIdentity() {
        return FormulaContextBuilder.buildFormulaContext("feb", List.of(JAN, FEB), COLUMNS, "id");
    }

    @Test
    void testRevenueMinusCost() {
        FormulaContext ctx = withIdentity();
        assertEquals(FormulaResult.of(900, ValueFormat.CURRENCY), evaluate("{Revenue} - {Cost}", ctx, 0));
        assertEquals(FormulaResult.of(1500, ValueFormat.CURRENCY), evaluate("SUM({Revenue}, {Cost})", ctx, 0));
        assertEquals(FormulaResult.of(2, ValueFormat.PLAIN), evaluate("COUNT({Revenue}, {Cost})", ctx, 0));
        assertEquals(FormulaResult.of(2400, ValueFormat.CURRENCY), evaluate("revenue * 2", ctx, 0));
    }

    @Test
    void testColumnTypeAndValueFormats() {
        FormulaContext ctx = withIdentity();
        // a plain 300 read through a CURRENCY column
        assertEquals(FormulaResult.of(300, ValueFormat.CURRENCY), evaluate("{Cost}", ctx, 0));
        assertEquals(FormulaResult.of(12.5, ValueFormat.PERCENT), evaluate("{Margin}", ctx, 0));
        assertEquals(ValueFormat.CURRENCY, evaluate("{Margin} + {Cost}", ctx, 0).getFormat());
    }

    @Test
    void testCrossSheetIdentityLookup() {
        FormulaContext ctx = withIdentity();
        assertEquals(FormulaResult.of(100), evaluate("{Jan.Revenue}", ctx, 0));
        assertEquals(FormulaResult.of(1100, ValueFormat.CURRENCY), evaluate("{Revenue} - {Jan.Revenue}", ctx, 0));

        // a qualifier naming the current sheet reads the current row
        assertEquals(FormulaResult.of(1200, ValueFormat.CURRENCY), evaluate("{Feb.Revenue}", ctx, 0));
    }

    @Test
    void testCrossSheetMiss() {
        FormulaContext ctx = withIdentity();
        FormulaResult result = evaluate("{Jan.Revenue}", ctx, 1);
        assertEquals(FormulaErrorKind.RESOLUTION, result.getErrorKind());
        assertEquals("No matching row found in sheet \"Jan\" for identity \"z\"", result.getError());

        Map<String, Object> anonymous = new HashMap<>();
        anonymous.put("revenue", 5);
        FormulaResult noIdentity = ColumnFormulaEvaluator.evaluateColumnFormula("{Jan.Revenue}", ctx,
                new RowContext(4, anonymous, null));
        assertEquals("Row 5 has no value for identity key \"id\"", noIdentity.getError());
    }

    @Test
    void testCrossSheetRequiresIdentityKey() {
        FormulaContext ctx = FormulaContextBuilder.buildFormulaContext("feb", List.of(JAN, FEB), COLUMNS);
        FormulaResult result = evaluate("{Jan.Revenue}", ctx, 0);
        assertEquals(FormulaErrorKind.RESOLUTION, result.getErrorKind());
        assertEquals("Cross-sheet reference {Jan.Revenue} requires an identity key", result.getError());
    }

    /**
     * The opt-in legacy scan matches the first row holding the identity in any field.
     */
    @Test
    void testLegacyIdentityScan() {
        SheetData mar = SheetData.of("mar", "Mar",
                Map.of("id", "q", "revenue", 1, "note", "x"),
                Map.of("id", "x", "revenue", 2));
        FormulaContext ctx = FormulaContextBuilder.buildFormulaContext("feb", List.of(mar, FEB), COLUMNS, null, true);

        assertTrue(ctx.isLegacyIdentityScan());
        // "x" first appears in the note of the first row
        assertEquals(FormulaResult.of(1), evaluate("{Mar.Revenue}", ctx, 0));
        assertEquals("No matching row found in sheet \"Mar\" for identity \"z\"",
                evaluate("{Mar.Revenue}", ctx, 1).getError());
    }

    @Test
    void testUnknownNames() {
        FormulaContext ctx = withIdentity();
        FormulaResult column = evaluate("{Profit} + 1", ctx, 0);
        assertEquals(FormulaErrorKind.RESOLUTION, column.getErrorKind());
        assertTrue(column.getError().contains("Profit"));

        FormulaResult sheet = evaluate("{Mar.Revenue}", ctx, 0);
        assertEquals(FormulaErrorKind.RESOLUTION, sheet.getErrorKind());
        assertTrue(sheet.getError().contains("Mar"));
    }

    @Test
    void testValueErrors() {
        FormulaContext ctx = withIdentity();
        FormulaResult text = evaluate("{Revenue} + 1", ctx, 1);
        assertEquals(FormulaErrorKind.CONVERSION, text.getErrorKind());
        assertTrue(text.getError().contains("column \"Revenue\""));

        assertEquals(FormulaErrorKind.ARITHMETIC, evaluate("{Revenue} / {Zero}", ctx, 0).getErrorKind());
        // missing values are empty, and empty is zero
        assertEquals(FormulaResult.of(1), evaluate("{Margin} + 1", ctx, 1));
    }

    @Test
    void testPlaceholderIsAnOrdinaryColumnPerRow() {
        FormulaContext ctx = withIdentity();
        FormulaResult result = evaluate("{column}", ctx, 0);
        assertEquals(FormulaErrorKind.RESOLUTION, result.getErrorKind());
        assertTrue(result.getError().contains("column"));
    }

    @Test
    void testParseFailureIsAResult() {
        FormulaResult result = evaluate("FOO({Revenue})", withIdentity(), 0);
        assertEquals(FormulaErrorKind.PARSE, result.getErrorKind());
    }
}
