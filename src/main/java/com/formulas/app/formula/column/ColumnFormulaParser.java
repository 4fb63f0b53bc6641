package com.formulas.app.formula.column;

import com.formulas.app.formula.AbstractFormulaParser;
import com.formulas.app.formula.AggregateSelf;
import com.formulas.app.formula.ColumnReference;
import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.FormulaFunction;
import com.formulas.app.formula.FormulaNode;
import com.formulas.app.formula.FormulaRef;
import com.formulas.app.formula.FormulaSyntaxException;
import com.formulas.app.formula.FunctionCall;
import com.formulas.app.formula.NumberLiteral;
import com.formulas.app.formula.ParseResult;
import com.formulas.app.formula.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for named-column formulas.
 *
 * <pre>
 * primary := NUMBER | COLUMN_REF | FUNCTION arguments | '(' expression ')'
 * </pre>
 *
 * Only SUM, AVERAGE, COUNT, MIN and MAX are accepted, checked while parsing. Every column
 * reference met is recorded for dependency tracking. An unqualified {@code {column}} becomes
 * an {@link AggregateSelf} node.
 */
public final class ColumnFormulaParser extends AbstractFormulaParser {

    private static final Pattern BRACED_REFERENCE = Pattern.compile("\\{([^}]+)\\}");

    private final List<FormulaRef> references = new ArrayList<>();

    private ColumnFormulaParser(List<Token> tokens) {
        super(tokens);
    }

    /**
     * Parses a named-column formula (no leading marker). Never throws.
     */
    public static ParseResult parse(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            return ParseResult.failure(FormulaErrorKind.PARSE, "Formula expression is empty", 0);
        }
        try {
            ColumnFormulaParser parser = new ColumnFormulaParser(ColumnFormulaLexer.tokenize(expression));
            FormulaNode ast = parser.parseAll();
            return ParseResult.success(ast, parser.references);
        } catch (FormulaSyntaxException ex) {
            return ParseResult.failure(ex);
        } catch (StackOverflowError ex) {
            return ParseResult.failure(FormulaErrorKind.PARSE, "Formula is nested too deeply", null);
        }
    }

    /**
     * Cheap pre-check of brace and parenthesis balance, for editors that validate while typing.
     *
     * @return the first problem found, or empty when the text is balanced
     */
    public static Optional<String> validateSyntax(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            return Optional.of("Formula expression is empty");
        }
        Optional<String> braces = checkBalance(expression, '{', '}', "Unclosed column reference '{'");
        if (braces.isPresent()) {
            return braces;
        }
        return checkBalance(expression, '(', ')', "Unclosed parenthesis '('");
    }

    private static Optional<String> checkBalance(String expression, char open, char close, String unclosed) {
        int depth = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth < 0) {
                    return Optional.of("Unexpected '" + close + "' at position " + i);
                }
            }
        }
        return depth > 0 ? Optional.of(unclosed) : Optional.empty();
    }

    /**
     * Raw contents of every {@code {...}} in the text, without parsing it. Works on formulas
     * that do not parse.
     */
    public static List<String> extractColumnReferences(String expression) {
        List<String> refs = new ArrayList<>();
        if (expression == null) {
            return refs;
        }
        Matcher matcher = BRACED_REFERENCE.matcher(expression);
        while (matcher.find()) {
            refs.add(matcher.group(1).trim());
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
            case COLUMN_REF:
                advance();
                return reference(token);
            case FUNCTION:
                advance();
                if (FormulaFunction.lookup(token.text(), FormulaFunction.AGGREGATES).isEmpty()) {
                    throw error("Unknown function \"" + token.text() + "\". Supported: SUM, AVERAGE, COUNT, MIN, MAX",
                            token);
                }
                return new FunctionCall(token.text(), arguments(token.text()));
            case LPAREN:
                advance();
                return group();
            default:
                throw unexpected(token);
        }
    }

    private FormulaNode reference(Token token) {
        String content = token.text();
        String raw = (String) token.literal();
        String sheetLabel = null;
        String columnName = content;

        // the first dot separates the sheet label; later dots belong to the column name
        int dot = content.indexOf('.');
        if (dot >= 0) {
            sheetLabel = content.substring(0, dot).trim();
            columnName = content.substring(dot + 1).trim();
            if (sheetLabel.isEmpty()) {
                throw error("Empty sheet name in reference " + raw, token);
            }
        }
        if (columnName.isEmpty()) {
            throw error("Empty column name in reference " + raw, token);
        }

        references.add(new FormulaRef(null, sheetLabel, columnName, raw));
        if (sheetLabel == null && columnName.equalsIgnoreCase(AggregateSelf.PLACEHOLDER)) {
            return new AggregateSelf(raw);
        }
        return new ColumnReference(sheetLabel, columnName, raw);
    }
}
