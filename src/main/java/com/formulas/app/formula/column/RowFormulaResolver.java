package com.formulas.app.formula.column;

import com.formulas.app.formula.AggregateSelf;
import com.formulas.app.formula.ColumnReference;
import com.formulas.app.formula.FormulaContext;
import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.FormulaFunction;
import com.formulas.app.formula.FormulaResult;
import com.formulas.app.formula.ReferenceResolver;
import com.formulas.app.formula.SheetSnapshot;
import com.formulas.app.formula.ValueList;
import com.formulas.app.models.ColumnDefinition;

import java.util.Optional;
import java.util.Set;

/**
 * Row-formula mode: the formula is evaluated once per column.
 *
 * <ul>
 *   <li>{@code {column}} stands for every value of the target column in the current sheet.</li>
 *   <li>With an identity key, {@code {Label}} is the target column's value in the row whose
 *       identity is "Label" ({@code {Sheet.Label}} looks in another sheet).</li>
 *   <li>Without one, {@code {Name}} is every value of column "Name" (summed outside a function).</li>
 * </ul>
 */
final class RowFormulaResolver implements ReferenceResolver {

    private final FormulaContext context;
    private final ColumnContext columnContext;

    RowFormulaResolver(FormulaContext context, ColumnContext columnContext) {
        this.context = context;
        this.columnContext = columnContext;
    }

    @Override
    public Set<FormulaFunction> supportedFunctions() {
        return FormulaFunction.AGGREGATES;
    }

    @Override
    public FormulaResult resolveAggregateSelf(AggregateSelf node) {
        return expandAggregateSelf(node).sum();
    }

    @Override
    public ValueList expandAggregateSelf(AggregateSelf node) {
        Optional<SheetSnapshot> sheet = context.getSheet(context.getCurrentSheetId());
        if (sheet.isEmpty()) {
            return ValueList.failure(FormulaResult.failure(FormulaErrorKind.RESOLUTION,
                    "Sheet data not found for ID \"" + context.getCurrentSheetId() + "\""));
        }
        return ColumnValues.collect(sheet.get(), columnContext.getColumnKey(), columnContext.getColumnType());
    }

    @Override
    public FormulaResult resolveColumn(ColumnReference node) {
        if (context.hasIdentityIndex()) {
            return lookupRow(node);
        }
        return expandColumn(node).sum();
    }

    @Override
    public ValueList expandColumn(ColumnReference node) {
        if (context.hasIdentityIndex()) {
            return ValueList.single(lookupRow(node));
        }
        Optional<ColumnDefinition> column = context.findColumn(node.columnName());
        if (column.isEmpty()) {
            return ValueList.failure(FormulaResult.failure(FormulaErrorKind.RESOLUTION,
                    "Column \"" + node.columnName() + "\" not found"));
        }
        Optional<SheetSnapshot> sheet = sheetOf(node);
        if (sheet.isEmpty()) {
            return ValueList.failure(sheetNotFound(node));
        }
        return ColumnValues.collect(sheet.get(), column.get().getKey(), column.get().getType());
    }

    private FormulaResult lookupRow(ColumnReference node) {
        Optional<SheetSnapshot> sheet = sheetOf(node);
        if (sheet.isEmpty()) {
            return sheetNotFound(node);
        }
        return context.findRowByIdentity(sheet.get().getId(), node.columnName())
                .map(row -> ColumnValues.coerce(row.get(columnContext.getColumnKey()),
                        "row \"" + node.columnName() + "\", column \"" + columnContext.getColumnLabel() + "\"",
                        columnContext.getColumnType()))
                .orElseGet(() -> FormulaResult.failure(FormulaErrorKind.RESOLUTION,
                        "Row \"" + node.columnName() + "\" not found in sheet \"" + sheet.get().getLabel() + "\""));
    }

    private Optional<SheetSnapshot> sheetOf(ColumnReference node) {
        if (!node.isCrossSheet()) {
            return context.getSheet(context.getCurrentSheetId());
        }
        return context.resolveSheetLabel(node.sheetLabel()).flatMap(context::getSheet);
    }

    private FormulaResult sheetNotFound(ColumnReference node) {
        String label = node.isCrossSheet() ? node.sheetLabel() : context.getCurrentSheetId();
        return FormulaResult.failure(FormulaErrorKind.RESOLUTION, "Sheet \"" + label + "\" not found");
    }
}
