package com.formulas.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * The two formula languages:
 * CELL for A1-style spreadsheet formulas ("=SUM(A1:B2)"),
 * COLUMN for named-column formulas ("{Revenue} - {Cost}").
 */
public enum FormulaDialect {
    CELL,
    COLUMN;

    @JsonCreator
    public static FormulaDialect fromValue(String value) {
        return FormulaDialect.valueOf(value.trim().toUpperCase());
    }
}
