package com.formulas.app.formula;

/**
 * Raised inside the lexers and parsers on malformed input. Never escapes a parser's public
 * entry point: it is converted to a failed {@link ParseResult} there.
 */
public class FormulaSyntaxException extends RuntimeException {

    private final FormulaErrorKind kind;
    private final int position;

    public FormulaSyntaxException(FormulaErrorKind kind, String message, int position) {
        super(message);
        this.kind = kind;
        this.position = position;
    }

    public FormulaErrorKind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }
}
