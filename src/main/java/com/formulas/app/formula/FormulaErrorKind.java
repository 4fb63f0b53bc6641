package com.formulas.app.formula;

/**
 * Categories of failure a formula can produce. None of them is fatal:
 * each is reported as a {@link ParseResult} or {@link FormulaResult} value.
 */
public enum FormulaErrorKind {
    /** Unexpected character, unterminated sheet name, malformed reference or number. */
    LEX,
    /** Unexpected token, unknown function name, unbalanced braces or parentheses. */
    PARSE,
    /** Unknown sheet label, unknown column, identity lookup miss. */
    RESOLUTION,
    /** A non-empty value that is not a number. */
    CONVERSION,
    /** Wrong argument count. */
    ARITY,
    /** Division by zero or a non-finite result. */
    ARITHMETIC,
    /** Unexpected fault caught at an entry point. */
    EVALUATION
}
