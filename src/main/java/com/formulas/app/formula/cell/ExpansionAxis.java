package com.formulas.app.formula.cell;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Direction in which new data is appended: ROW grows ranges downwards, COLUMN to the right.
 */
public enum ExpansionAxis {
    ROW,
    COLUMN;

    @JsonCreator
    public static ExpansionAxis fromValue(String value) {
        return ExpansionAxis.valueOf(value.trim().toUpperCase());
    }
}
