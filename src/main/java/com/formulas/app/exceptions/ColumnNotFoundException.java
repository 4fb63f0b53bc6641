package com.formulas.app.exceptions;

/**
 * Thrown when a row formula targets a column that doesn't exist
 * in the request's column schema.
 * For example, "Column revenue not found in sheet schema".
 */
public class ColumnNotFoundException extends RuntimeException {
    public ColumnNotFoundException(String message) {
        super(message);
    }
}
