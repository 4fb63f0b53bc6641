package com.formulas.app.exceptions;

/**
 * Thrown when a request's current sheet id is not among
 * the sheets it supplies.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
