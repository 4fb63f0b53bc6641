package com.formulas.app.formula.cell;

import com.formulas.app.formula.CellEvalContext;
import com.formulas.app.formula.CellRange;
import com.formulas.app.formula.CellRef;
import com.formulas.app.formula.CellReference;
import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.FormulaFunction;
import com.formulas.app.formula.FormulaResult;
import com.formulas.app.formula.NumericCoercion;
import com.formulas.app.formula.ReferenceResolver;
import com.formulas.app.formula.SheetSnapshot;
import com.formulas.app.formula.ValueList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves A1 references against a {@link CellEvalContext}.
 *
 * <p>A missing row reads as an empty cell (0); a column past the visible columns is an error.
 * Ranges skip empty and non-numeric cells, as spreadsheets do.
 */
final class CellReferenceResolver implements ReferenceResolver {

    private final CellEvalContext context;

    CellReferenceResolver(CellEvalContext context) {
        this.context = context;
    }

    @Override
    public Set<FormulaFunction> supportedFunctions() {
        return FormulaFunction.ALL;
    }

    @Override
    public FormulaResult resolveCell(CellReference node) {
        CellRef ref = node.ref();
        Optional<SheetSnapshot> sheet = sheetOf(ref.sheet());
        if (sheet.isEmpty()) {
            return sheetNotFound(ref.sheet());
        }
        Map<String, Object> row = sheet.get().getRow(ref.row());
        if (row == null) {
            return FormulaResult.zero();
        }
        Optional<String> columnKey = context.columnKeyAt(ref.col());
        if (columnKey.isEmpty()) {
            return columnNotFound(ref.col());
        }
        return NumericCoercion.coerce(row.get(columnKey.get()), "cell " + ref);
    }

    @Override
    public ValueList expandRange(CellRange node) {
        String sheetLabel = node.start().sheet();
        Optional<SheetSnapshot> sheet = sheetOf(sheetLabel);
        if (sheet.isEmpty()) {
            return ValueList.failure(sheetNotFound(sheetLabel));
        }
        List<String> columnKeys = new ArrayList<>();
        for (int col = node.firstColumn(); col <= node.lastColumn(); col++) {
            Optional<String> key = context.columnKeyAt(col);
            if (key.isEmpty()) {
                return ValueList.failure(columnNotFound(col));
            }
            columnKeys.add(key.get());
        }

        List<FormulaResult> values = new ArrayList<>();
        List<Map<String, Object>> rows = sheet.get().getRows();
        int lastRow = Math.min(node.lastRow(), rows.size() - 1);
        for (int r = node.firstRow(); r <= lastRow; r++) {
            Map<String, Object> row = rows.get(r);
            for (String key : columnKeys) {
                Object raw = row.get(key);
                if (NumericCoercion.isEmpty(raw)) {
                    continue;
                }
                FormulaResult value = NumericCoercion.coerce(raw, "range");
                if (value.isOk()) {
                    values.add(value);
                }
            }
        }
        return ValueList.of(values);
    }

    private Optional<SheetSnapshot> sheetOf(String label) {
        if (label == null) {
            return context.getSheet(context.getCurrentSheetId());
        }
        return context.resolveSheetLabel(label).flatMap(context::getSheet);
    }

    private FormulaResult sheetNotFound(String label) {
        if (label == null) {
            return FormulaResult.failure(FormulaErrorKind.RESOLUTION,
                    "Sheet data not found for ID \"" + context.getCurrentSheetId() + "\"");
        }
        return FormulaResult.failure(FormulaErrorKind.RESOLUTION, "Sheet \"" + label + "\" not found");
    }

    private static FormulaResult columnNotFound(int col) {
        return FormulaResult.failure(FormulaErrorKind.RESOLUTION,
                "Column " + CellRef.columnToLetter(col) + " not found");
    }
}
