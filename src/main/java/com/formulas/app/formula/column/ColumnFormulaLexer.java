package com.formulas.app.formula.column;

import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.FormulaSyntaxException;
import com.formulas.app.formula.Token;
import com.formulas.app.formula.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tokenizer for named-column formulas such as {@code SUM({Jan 2026.Revenue}) - {Cost}}.
 *
 * <p>A COLUMN_REF token's text is the trimmed reference content and its literal the reference
 * as written ({@code {Revenue}}, or {@code Revenue} for a bare identifier).
 */
final class ColumnFormulaLexer {

    private final String expression;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    private ColumnFormulaLexer(String expression) {
        this.expression = expression;
    }

    /**
     * @throws FormulaSyntaxException on the first malformed token
     */
    static List<Token> tokenize(String expression) {
        return new ColumnFormulaLexer(expression).run();
    }

    private List<Token> run() {
        while (pos < expression.length()) {
            char c = expression.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '{') {
                readBracedReference();
            } else if (c == '}') {
                throw new FormulaSyntaxException(FormulaErrorKind.PARSE,
                        "Unexpected '}' at position " + pos, pos);
            } else if (isDigit(c) || (c == '.' && pos + 1 < expression.length() && isDigit(expression.charAt(pos + 1)))) {
                readNumber();
            } else if (isIdentifierChar(c)) {
                readIdentifier();
            } else {
                TokenType type = singleCharToken(c);
                if (type == null) {
                    throw new FormulaSyntaxException(FormulaErrorKind.LEX,
                            "Unexpected character '" + c + "' at position " + pos, pos);
                }
                tokens.add(Token.of(type, String.valueOf(c), pos));
                pos++;
            }
        }
        tokens.add(Token.of(TokenType.EOF, "", pos));
        return tokens;
    }

    private static TokenType singleCharToken(char c) {
        switch (c) {
            case '+':
                return TokenType.PLUS;
            case '-':
                return TokenType.MINUS;
            case '*':
                return TokenType.STAR;
            case '/':
                return TokenType.SLASH;
            case '(':
                return TokenType.LPAREN;
            case ')':
                return TokenType.RPAREN;
            case ',':
                return TokenType.COMMA;
            default:
                return null;
        }
    }

    private void readBracedReference() {
        int start = pos;
        int close = expression.indexOf('}', pos + 1);
        if (close < 0) {
            throw new FormulaSyntaxException(FormulaErrorKind.PARSE,
                    "Unclosed column reference at position " + start, start);
        }
        String content = expression.substring(pos + 1, close).trim();
        tokens.add(new Token(TokenType.COLUMN_REF, content, "{" + content + "}", start));
        pos = close + 1;
    }

    private void readNumber() {
        int start = pos;
        while (pos < expression.length() && (isDigit(expression.charAt(pos)) || expression.charAt(pos) == '.')) {
            pos++;
        }
        String text = expression.substring(start, pos);
        if (text.indexOf('.') != text.lastIndexOf('.')) {
            throw new FormulaSyntaxException(FormulaErrorKind.LEX,
                    "Invalid number \"" + text + "\" at position " + start, start);
        }
        tokens.add(new Token(TokenType.NUMBER, text, Double.parseDouble(text), start));
    }

    /**
     * An identifier is a function name iff the next non-blank character is {@code (};
     * otherwise it is a bare column reference.
     */
    private void readIdentifier() {
        int start = pos;
        while (pos < expression.length() && isIdentifierChar(expression.charAt(pos))) {
            pos++;
        }
        String name = expression.substring(start, pos);
        int next = pos;
        while (next < expression.length() && Character.isWhitespace(expression.charAt(next))) {
            next++;
        }
        if (next < expression.length() && expression.charAt(next) == '(') {
            tokens.add(Token.of(TokenType.FUNCTION, name.toUpperCase(Locale.ROOT), start));
        } else {
            tokens.add(new Token(TokenType.COLUMN_REF, name, name, start));
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }
}
