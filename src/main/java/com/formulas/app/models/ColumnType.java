package com.formulas.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.formulas.app.formula.ValueFormat;

/**
 * Declared data type of a column.
 * Only CURRENCY and PERCENT influence evaluation: they lend their format to numeric values
 * read from the column.
 */
public enum ColumnType {
    TEXT,
    NUMBER,
    CURRENCY,
    PERCENT,
    DATE,
    BOOLEAN,
    FORMULA;

    /**
     * Allows case-insensitive JSON input.
     * For example, "currency" -> CURRENCY, "Number" -> NUMBER.
     */
    @JsonCreator
    public static ColumnType fromValue(String value) {
        return ColumnType.valueOf(value.trim().toUpperCase());
    }

    /**
     * Format implied by the declaration, or PLAIN for types that imply none.
     */
    public ValueFormat impliedFormat() {
        switch (this) {
            case CURRENCY:
                return ValueFormat.CURRENCY;
            case PERCENT:
                return ValueFormat.PERCENT;
            default:
                return ValueFormat.PLAIN;
        }
    }
}
