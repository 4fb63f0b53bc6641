package com.formulas.app.formula;

/** Token kinds produced by both lexers. */
public enum TokenType {
    NUMBER,
    /** A1 cell address, possibly sheet-qualified. Cell lexer only. */
    CELL_REF,
    /** {@code {...}} or bare identifier reference. Column lexer only. */
    COLUMN_REF,
    FUNCTION,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    LPAREN,
    RPAREN,
    COMMA,
    /** Range separator. Cell lexer only. */
    COLON,
    EOF
}
