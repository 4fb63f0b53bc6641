package com.formulas.app.formula.column;

import com.formulas.app.formula.FormulaResult;
import com.formulas.app.formula.NumericCoercion;
import com.formulas.app.formula.SheetSnapshot;
import com.formulas.app.formula.ValueFormat;
import com.formulas.app.formula.ValueList;
import com.formulas.app.models.ColumnType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reading numbers out of named columns.
 */
final class ColumnValues {

    private ColumnValues() {
    }

    /**
     * Coerces one value; a plain number read through a CURRENCY or PERCENT column takes the
     * column's format.
     */
    static FormulaResult coerce(Object raw, String description, ColumnType type) {
        FormulaResult result = NumericCoercion.coerce(raw, description);
        if (result.isOk() && result.getFormat() == ValueFormat.PLAIN && type != null) {
            return result.withFormat(type.impliedFormat());
        }
        return result;
    }

    /**
     * Every numeric value of one column across all rows of a sheet. Empty and non-numeric
     * cells are skipped, as in a spreadsheet range.
     */
    static ValueList collect(SheetSnapshot sheet, String columnKey, ColumnType type) {
        List<FormulaResult> values = new ArrayList<>();
        for (Map<String, Object> row : sheet.getRows()) {
            Object raw = row.get(columnKey);
            if (NumericCoercion.isEmpty(raw)) {
                continue;
            }
            FormulaResult value = coerce(raw, "column", type);
            if (value.isOk()) {
                values.add(value);
            }
        }
        return ValueList.of(values);
    }
}
