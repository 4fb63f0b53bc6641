package com.formulas.app.formula.column;

import com.formulas.app.models.ColumnDefinition;
import com.formulas.app.models.ColumnType;

/**
 * The column a row formula is being evaluated for.
 */
public final class ColumnContext {

    private final String columnKey;
    private final String columnLabel;
    private final ColumnType columnType;

    public ColumnContext(String columnKey, String columnLabel, ColumnType columnType) {
        this.columnKey = columnKey;
        this.columnLabel = columnLabel == null ? columnKey : columnLabel;
        this.columnType = columnType == null ? ColumnType.TEXT : columnType;
    }

    public static ColumnContext of(ColumnDefinition column) {
        return new ColumnContext(column.getKey(), column.getLabel(), column.getType());
    }

    public String getColumnKey() {
        return columnKey;
    }

    public String getColumnLabel() {
        return columnLabel;
    }

    public ColumnType getColumnType() {
        return columnType;
    }
}
