package com.formulas.app.formula.cell;

import com.formulas.app.formula.AbstractFormulaParser;
import com.formulas.app.formula.CellRange;
import com.formulas.app.formula.CellRef;
import com.formulas.app.formula.CellReference;
import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.FormulaNode;
import com.formulas.app.formula.FormulaNodes;
import com.formulas.app.formula.FormulaRef;
import com.formulas.app.formula.FormulaSyntaxException;
import com.formulas.app.formula.FunctionCall;
import com.formulas.app.formula.NumberLiteral;
import com.formulas.app.formula.ParseResult;
import com.formulas.app.formula.Token;
import com.formulas.app.formula.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parser for A1-style cell formulas.
 *
 * <pre>
 * primary := NUMBER | CELL_REF (':' CELL_REF)? | FUNCTION arguments | '(' expression ')'
 * </pre>
 *
 * Function names are not checked here; unknown names are rejected when evaluated.
 */
public final class CellFormulaParser extends AbstractFormulaParser {

    private final List<FormulaRef> references = new ArrayList<>();

    private CellFormulaParser(List<Token> tokens) {
        super(tokens);
    }

    /**
     * Parses a cell formula; the leading {@code =} is optional. Never throws.
     */
    public static ParseResult parse(String formula) {
        if (formula == null || formula.trim().isEmpty() || formula.trim().equals("=")) {
            return ParseResult.failure(FormulaErrorKind.PARSE, "Formula is empty", 0);
        }
        try {
            CellFormulaParser parser = new CellFormulaParser(CellFormulaLexer.tokenize(formula));
            FormulaNode ast = parser.parseAll();
            return ParseResult.success(ast, parser.references);
        } catch (FormulaSyntaxException ex) {
            return ParseResult.failure(ex);
        } catch (StackOverflowError ex) {
            return ParseResult.failure(FormulaErrorKind.PARSE, "Formula is nested too deeply", null);
        }
    }

    /**
     * Whether a cell value is a formula rather than a literal: it starts with {@code =}.
     */
    public static boolean isFormula(String value) {
        return value != null && value.trim().startsWith("=");
    }

    /**
     * Every cell a tree refers to, in source order. A range contributes both corners.
     */
    public static List<CellRef> extractCellRefs(FormulaNode ast) {
        List<CellRef> refs = new ArrayList<>();
        for (FormulaNode node : FormulaNodes.preOrder(ast)) {
            if (node instanceof CellReference cell) {
                refs.add(cell.ref());
            } else if (node instanceof CellRange range) {
                refs.add(range.start());
                refs.add(range.end());
            }
        }
        return refs;
    }

    @Override
    protected FormulaNode primary() {
        Token token = current();
        switch (token.type()) {
            case NUMBER:
                advance();
                return new NumberLiteral(token.number());
            case FUNCTION:
                advance();
                return new FunctionCall(token.text(), arguments(token.text()));
            case CELL_REF:
                advance();
                return reference(token);
            case LPAREN:
                advance();
                return group();
            default:
                throw unexpected(token);
        }
    }

    private FormulaNode reference(Token startToken) {
        CellRef start = startToken.cellRef();
        if (!check(TokenType.COLON)) {
            references.add(new FormulaRef(null, start.sheet(), CellRef.columnToLetter(start.col()), start.toString()));
            return new CellReference(start);
        }
        advance();
        Token endToken = current();
        if (endToken.type() != TokenType.CELL_REF) {
            throw error("Expected cell reference after ':'", endToken);
        }
        advance();
        CellRef end = endToken.cellRef();
        if (end.sheet() != null && !Objects.equals(end.sheet(), start.sheet())) {
            throw error("A range cannot span sheets", endToken);
        }
        // the range's sheet lives on its start corner
        CellRange range = new CellRange(start, end.withSheet(null));
        String columns = CellRef.columnToLetter(range.firstColumn());
        if (range.lastColumn() != range.firstColumn()) {
            columns += ":" + CellRef.columnToLetter(range.lastColumn());
        }
        references.add(new FormulaRef(null, start.sheet(), columns, start + ":" + end.toA1()));
        return range;
    }
}
