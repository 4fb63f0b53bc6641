package com.formulas.app.formula;

/**
 * One lexical token.
 *
 * @param type token kind
 * @param text source text of the token (upper-cased for functions, brace content for column refs)
 * @param literal parsed payload: a {@link Double} for NUMBER, a {@link CellRef} for CELL_REF, else null
 * @param position 0-based offset of the token in the formula text
 */
public record Token(TokenType type, String text, Object literal, int position) {

    public static Token of(TokenType type, String text, int position) {
        return new Token(type, text, null, position);
    }

    public double number() {
        return (Double) literal;
    }

    public CellRef cellRef() {
        return (CellRef) literal;
    }

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
