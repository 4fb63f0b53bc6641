package com.formulas.app.formula.cell;

import com.formulas.app.formula.CellRef;
import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.FormulaSyntaxException;
import com.formulas.app.formula.Token;
import com.formulas.app.formula.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tokenizer for A1-style cell formulas such as {@code =SUM($A$1:B10)*'Jan 2026'!C3}.
 *
 * <p>A single leading {@code =} is skipped. Token positions are offsets into the original text,
 * including the {@code =}.
 */
final class CellFormulaLexer {

    // ZZZZZZ is the widest column whose index still fits in an int
    private static final int MAX_COLUMN_LETTERS = 6;
    private static final int MAX_ROW_DIGITS = 9;

    private final String formula;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    private CellFormulaLexer(String formula) {
        this.formula = formula;
        this.pos = formula.startsWith("=") ? 1 : 0;
    }

    /**
     * Splits {@code formula} into tokens, ending with EOF.
     *
     * @throws FormulaSyntaxException on the first malformed token
     */
    static List<Token> tokenize(String formula) {
        return new CellFormulaLexer(formula).run();
    }

    private List<Token> run() {
        while (pos < formula.length()) {
            char c = formula.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            if (isDigit(c) || (c == '.' && pos + 1 < formula.length() && isDigit(formula.charAt(pos + 1)))) {
                readNumber();
                continue;
            }
            TokenType single = singleCharToken(c);
            if (single != null) {
                tokens.add(Token.of(single, String.valueOf(c), pos));
                pos++;
                continue;
            }
            if (c == '\'') {
                readQualifiedReference();
                continue;
            }
            if (c == '$' || isLetter(c)) {
                readIdentifier();
                continue;
            }
            throw error("Unexpected character '" + c + "'", pos);
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
            case ':':
                return TokenType.COLON;
            default:
                return null;
        }
    }

    private void readNumber() {
        int start = pos;
        while (pos < formula.length() && (isDigit(formula.charAt(pos)) || formula.charAt(pos) == '.')) {
            pos++;
        }
        String text = formula.substring(start, pos);
        if (text.indexOf('.') != text.lastIndexOf('.')) {
            throw error("Invalid number \"" + text + "\"", start);
        }
        tokens.add(new Token(TokenType.NUMBER, text, Double.parseDouble(text), start));
    }

    /**
     * {@code 'Sheet Name'!A1}. A doubled quote inside the name stands for one quote.
     */
    private void readQualifiedReference() {
        int start = pos;
        pos++;
        StringBuilder sheet = new StringBuilder();
        while (true) {
            if (pos >= formula.length()) {
                throw error("Unterminated sheet name", start);
            }
            char c = formula.charAt(pos);
            if (c == '\'') {
                if (pos + 1 < formula.length() && formula.charAt(pos + 1) == '\'') {
                    sheet.append('\'');
                    pos += 2;
                    continue;
                }
                pos++;
                break;
            }
            sheet.append(c);
            pos++;
        }
        if (sheet.length() == 0) {
            throw error("Empty sheet name", start);
        }
        if (pos >= formula.length() || formula.charAt(pos) != '!') {
            throw error("Expected ! after sheet name", pos);
        }
        pos++;
        readCellReference(start, sheet.toString());
    }

    /**
     * Letters directly followed (after whitespace) by {@code (} form a function name;
     * anything else starting with {@code $} or a letter must be a cell reference.
     */
    private void readIdentifier() {
        int start = pos;
        int end = pos;
        while (end < formula.length() && isLetter(formula.charAt(end))) {
            end++;
        }
        if (end > start) {
            int next = end;
            while (next < formula.length() && Character.isWhitespace(formula.charAt(next))) {
                next++;
            }
            if (next < formula.length() && formula.charAt(next) == '(') {
                String name = formula.substring(start, end).toUpperCase(Locale.ROOT);
                tokens.add(Token.of(TokenType.FUNCTION, name, start));
                pos = end;
                return;
            }
        }
        readCellReference(start, null);
    }

    private void readCellReference(int tokenStart, String sheet) {
        int refStart = pos;
        boolean absCol = false;
        boolean absRow = false;
        if (pos < formula.length() && formula.charAt(pos) == '$') {
            absCol = true;
            pos++;
        }
        int lettersStart = pos;
        while (pos < formula.length() && isLetter(formula.charAt(pos))) {
            pos++;
        }
        String letters = formula.substring(lettersStart, pos);
        if (letters.isEmpty()) {
            throw error("Expected column letters in cell reference", pos);
        }
        if (letters.length() > MAX_COLUMN_LETTERS) {
            throw error("Column \"" + letters + "\" is out of range", lettersStart);
        }
        if (pos < formula.length() && formula.charAt(pos) == '$') {
            absRow = true;
            pos++;
        }
        int digitsStart = pos;
        while (pos < formula.length() && isDigit(formula.charAt(pos))) {
            pos++;
        }
        String digits = formula.substring(digitsStart, pos);
        if (digits.isEmpty()) {
            throw error("Expected row number in cell reference", pos);
        }
        if (digits.length() > MAX_ROW_DIGITS) {
            throw error("Row " + digits + " is out of range", digitsStart);
        }
        int rowNumber = Integer.parseInt(digits);
        if (rowNumber < 1) {
            throw error("Row numbers start at 1", digitsStart);
        }
        CellRef ref = new CellRef(CellRef.letterToColumn(letters), rowNumber - 1, absCol, absRow, sheet);
        tokens.add(new Token(TokenType.CELL_REF, formula.substring(refStart, pos), ref, tokenStart));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static FormulaSyntaxException error(String message, int position) {
        return new FormulaSyntaxException(FormulaErrorKind.LEX, message + " at position " + position, position);
    }
}
