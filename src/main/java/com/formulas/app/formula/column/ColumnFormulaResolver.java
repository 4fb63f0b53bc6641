package com.formulas.app.formula.column;

import com.formulas.app.formula.AggregateSelf;
import com.formulas.app.formula.ColumnReference;
import com.formulas.app.formula.FormulaContext;
import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.FormulaFunction;
import com.formulas.app.formula.FormulaResult;
import com.formulas.app.formula.ReferenceResolver;
import com.formulas.app.formula.SheetSnapshot;
import com.formulas.app.models.ColumnDefinition;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Column-formula mode: every reference reads one value from the row being evaluated, or from
 * the matching row of another sheet for {@code {Sheet.Column}}.
 */
final class ColumnFormulaResolver implements ReferenceResolver {

    private final FormulaContext context;
    private final RowContext rowContext;

    ColumnFormulaResolver(FormulaContext context, RowContext rowContext) {
        this.context = context;
        this.rowContext = rowContext;
    }

    @Override
    public Set<FormulaFunction> supportedFunctions() {
        return FormulaFunction.AGGREGATES;
    }

    @Override
    public FormulaResult resolveColumn(ColumnReference node) {
        Optional<ColumnDefinition> column = context.findColumn(node.columnName());
        if (column.isEmpty()) {
            return FormulaResult.failure(FormulaErrorKind.RESOLUTION, "Column \"" + node.columnName() + "\" not found");
        }

        Map<String, Object> row = rowContext.getRow();
        if (node.isCrossSheet()) {
            Optional<String> sheetId = context.resolveSheetLabel(node.sheetLabel());
            if (sheetId.isEmpty()) {
                return FormulaResult.failure(FormulaErrorKind.RESOLUTION, "Sheet \"" + node.sheetLabel() + "\" not found");
            }
            if (!sheetId.get().equals(context.getCurrentSheetId())) {
                RowMatch match = matchingRow(sheetId.get(), node);
                if (match.failure != null) {
                    return match.failure;
                }
                row = match.row;
            }
        }
        return ColumnValues.coerce(row.get(column.get().getKey()),
                "column \"" + node.columnName() + "\"", column.get().getType());
    }

    /**
     * {@code {column}} has no special meaning per row: it refers to a column named "column".
     */
    @Override
    public FormulaResult resolveAggregateSelf(AggregateSelf node) {
        return resolveColumn(new ColumnReference(null, AggregateSelf.PLACEHOLDER, node.raw()));
    }

    private RowMatch matchingRow(String sheetId, ColumnReference node) {
        Optional<SheetSnapshot> sheet = context.getSheet(sheetId);
        if (sheet.isEmpty()) {
            return RowMatch.failed("Sheet data not found for ID \"" + sheetId + "\"");
        }
        Object identity = rowContext.getIdentity();

        if (context.hasIdentityIndex()) {
            if (FormulaContext.normalizeIdentity(identity) == null) {
                return RowMatch.failed("Row " + (rowContext.getRowIndex() + 1) + " has no value for identity key \""
                        + context.getIdentityKey() + "\"");
            }
            return context.findRowByIdentity(sheetId, identity)
                    .map(RowMatch::found)
                    .orElseGet(() -> noMatch(node, identity));
        }

        if (!context.isLegacyIdentityScan()) {
            return RowMatch.failed("Cross-sheet reference " + node.raw() + " requires an identity key");
        }
        if (identity == null) {
            return noMatch(node, null);
        }
        // Legacy heuristic: first row holding the identity value in any field.
        String wanted = String.valueOf(identity);
        for (Map<String, Object> candidate : sheet.get().getRows()) {
            for (Object value : candidate.values()) {
                if (value != null && String.valueOf(value).equals(wanted)) {
                    return RowMatch.found(candidate);
                }
            }
        }
        return noMatch(node, identity);
    }

    private static RowMatch noMatch(ColumnReference node, Object identity) {
        return RowMatch.failed("No matching row found in sheet \"" + node.sheetLabel() + "\" for identity \""
                + identity + "\"");
    }

    private static final class RowMatch {
        private final Map<String, Object> row;
        private final FormulaResult failure;

        private RowMatch(Map<String, Object> row, FormulaResult failure) {
            this.row = row;
            this.failure = failure;
        }

        static RowMatch found(Map<String, Object> row) {
            return new RowMatch(row, null);
        }

        static RowMatch failed(String message) {
            return new RowMatch(null, FormulaResult.failure(FormulaErrorKind.RESOLUTION, message));
        }
    }
}
