package com.formulas.app.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser skeleton shared by both formula languages.
 *
 * <pre>
 * expression := term (('+'|'-') term)*
 * term       := factor (('*'|'/') factor)*
 * factor     := '-' factor | primary
 * </pre>
 *
 * Subclasses supply {@link #primary()}: literals, references, function calls and groups.
 * Errors are thrown as {@link FormulaSyntaxException} and converted to a failed
 * {@link ParseResult} by the subclass entry point.
 */
public abstract class AbstractFormulaParser {

    private final List<Token> tokens;
    private int pos;

    protected AbstractFormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses the whole token stream as one expression.
     */
    protected FormulaNode parseAll() {
        FormulaNode ast = expression();
        if (!check(TokenType.EOF)) {
            throw unexpected(current());
        }
        return ast;
    }

    protected FormulaNode expression() {
        FormulaNode left = term();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Token op = advance();
            FormulaNode right = term();
            left = new BinaryOp(BinaryOp.Operator.fromSymbol(op.text()), left, right);
        }
        return left;
    }

    protected FormulaNode term() {
        FormulaNode left = factor();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            Token op = advance();
            FormulaNode right = factor();
            left = new BinaryOp(BinaryOp.Operator.fromSymbol(op.text()), left, right);
        }
        return left;
    }

    protected FormulaNode factor() {
        if (check(TokenType.MINUS)) {
            advance();
            return new UnaryOp(factor());
        }
        return primary();
    }

    protected abstract FormulaNode primary();

    /**
     * {@code '(' (expression (',' expression)*)? ')'}, the opening parenthesis not yet consumed.
     */
    protected List<FormulaNode> arguments(String functionName) {
        expect(TokenType.LPAREN, "'(' after function name " + functionName);
        List<FormulaNode> args = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            args.add(expression());
            while (check(TokenType.COMMA)) {
                advance();
                args.add(expression());
            }
        }
        expect(TokenType.RPAREN, "')' to close " + functionName + "(");
        return args;
    }

    /**
     * {@code '(' expression ')'}, the opening parenthesis already consumed.
     */
    protected FormulaNode group() {
        FormulaNode inner = expression();
        expect(TokenType.RPAREN, "')'");
        return new Group(inner);
    }

    protected Token current() {
        return tokens.get(pos);
    }

    protected boolean check(TokenType type) {
        return current().type() == type;
    }

    protected Token advance() {
        Token token = current();
        if (token.type() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    protected Token expect(TokenType type, String what) {
        Token token = current();
        if (token.type() != type) {
            throw error("Expected " + what + " but found " + describe(token), token);
        }
        return advance();
    }

    protected FormulaSyntaxException unexpected(Token token) {
        return error("Unexpected " + describe(token), token);
    }

    protected FormulaSyntaxException error(String message, Token token) {
        return new FormulaSyntaxException(FormulaErrorKind.PARSE,
                message + " at position " + token.position(), token.position());
    }

    private static String describe(Token token) {
        return token.type() == TokenType.EOF ? "end of formula" : "\"" + token.text() + "\"";
    }
}
