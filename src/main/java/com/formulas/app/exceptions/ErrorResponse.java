package com.formulas.app.exceptions;

/**
 * Simple DTO to structure error responses with a code and message.
 * For example:
 * {
 *   "code": "SHEET_NOT_FOUND",
 *   "message": "Sheet not found: feb-2026"
 * }
 */
public class ErrorResponse {
    private String code;
    private String message;

    // Default constructor needed for JSON (de)serialization
    public ErrorResponse() {
    }

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
