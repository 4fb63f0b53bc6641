package com.formulas.app.exceptions;

/**
 * Thrown when a request is missing its formula or other required fields,
 * or asks to rewrite a formula that doesn't parse.
 */
public class InvalidFormulaRequestException extends RuntimeException {
    public InvalidFormulaRequestException(String message) {
        super(message);
    }
}
