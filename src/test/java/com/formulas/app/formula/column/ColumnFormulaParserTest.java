package com.formulas.app.formula.column;

import com.formulas.app.formula.AggregateSelf;
import com.formulas.app.formula.BinaryOp;
import com.formulas.app.formula.ColumnReference;
import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.FormulaNode;
import com.formulas.app.formula.FormulaRef;
import com.formulas.app.formula.FunctionCall;
import com.formulas.app.formula.ParseResult;
import com.formulas.app.formula.Token;
import com.formulas.app.formula.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ColumnFormulaParserTest {

    private static FormulaNode ast(String expression) {
        ParseResult result = ColumnFormulaParser.parse(expression);
        assertTrue(result.isOk(), expression + ": " + result.getError());
        return result.getAst();
    }

    @Test
    void testTokens() {
        List<Token> tokens = ColumnFormulaLexer.tokenize("sum ({ Jan.Revenue }) + Cost");
        assertEquals(List.of(TokenType.FUNCTION, TokenType.LPAREN, TokenType.COLUMN_REF, TokenType.RPAREN,
                TokenType.PLUS, TokenType.COLUMN_REF, TokenType.EOF), tokens.stream().map(Token::type).toList());
        assertEquals("SUM", tokens.get(0).text());
        assertEquals("Jan.Revenue", tokens.get(2).text());
        assertEquals("{Jan.Revenue}", tokens.get(2).literal());
        assertEquals("Cost", tokens.get(5).literal());
    }

    @Test
    void testReferences() {
        assertEquals(new BinaryOp(BinaryOp.Operator.SUB,
                        new ColumnReference(null, "Revenue", "{Revenue}"),
                        new ColumnReference(null, "Cost", "{Cost}")),
                ast("{Revenue} - {Cost}"));

        // only the first dot separates the sheet
        assertEquals(new ColumnReference("Jan 2026", "Revenue.Net", "{Jan 2026.Revenue.Net}"),
                ast("{Jan 2026.Revenue.Net}"));
        assertEquals(new ColumnReference(null, "Revenue", "Revenue"), ast("Revenue"));
    }

    @Test
    void testAggregateSelf() {
        assertEquals(new FunctionCall("SUM", List.of(new AggregateSelf("{column}"))), ast("SUM({column})"));
        assertEquals(new AggregateSelf("{Column}"), ast("{Column}"));
        assertEquals(new AggregateSelf("column"), ast("column"));
        // qualified, it is an ordinary column
        assertEquals(new ColumnReference("Jan", "column", "{Jan.column}"), ast("{Jan.column}"));
    }

    @Test
    void testEveryReferenceIsRecorded() {
        ParseResult result = ColumnFormulaParser.parse("{A} + SUM({Jan.B}) / {A} + {column}");
        assertEquals(List.of(
                new FormulaRef(null, null, "A", "{A}"),
                new FormulaRef(null, "Jan", "B", "{Jan.B}"),
                new FormulaRef(null, null, "A", "{A}"),
                new FormulaRef(null, null, "column", "{column}")), result.getReferences());
    }

    @Test
    void testFunctionAllowList() {
        assertTrue(ColumnFormulaParser.parse("AVERAGE({A}) + min({A}, 1) + MAX() + COUNT({A})").isOk());

        ParseResult unknown = ColumnFormulaParser.parse("FOO({A})");
        assertEquals(FormulaErrorKind.PARSE, unknown.getErrorKind());
        assertTrue(unknown.getError().startsWith("Unknown function \"FOO\". Supported: SUM, AVERAGE, COUNT, MIN, MAX"));
        assertEquals(0, unknown.getPosition());

        // AVG is a cell formula alias only
        ParseResult alias = ColumnFormulaParser.parse("AVG({Revenue})");
        assertFalse(alias.isOk());
        assertEquals(FormulaErrorKind.PARSE, alias.getErrorKind());
        assertTrue(alias.getError().startsWith("Unknown function \"AVG\""));

        // scalar functions belong to cell formulas only
        assertEquals(FormulaErrorKind.PARSE, ColumnFormulaParser.parse("ABS({A})").getErrorKind());
        assertEquals(FormulaErrorKind.PARSE, ColumnFormulaParser.parse("ROUND({A}, 2)").getErrorKind());
    }

    @Test
    void testErrors() {
        assertError("", FormulaErrorKind.PARSE, "Formula expression is empty");
        assertError("{Revenue", FormulaErrorKind.PARSE, "Unclosed column reference at position 0");
        assertError("{A}}", FormulaErrorKind.PARSE, "Unexpected '}' at position 3");
        assertError("{A} # 2", FormulaErrorKind.LEX, "Unexpected character '#' at position 4");
        assertError("{A} * 1.2.3", FormulaErrorKind.LEX, "Invalid number \"1.2.3\"");
        assertError("{.Revenue}", FormulaErrorKind.PARSE, "Empty sheet name in reference {.Revenue}");
        assertError("{Jan.}", FormulaErrorKind.PARSE, "Empty column name in reference {Jan.}");
        assertError("{ }", FormulaErrorKind.PARSE, "Empty column name");
        assertError("({A} + 1", FormulaErrorKind.PARSE, "Expected ')'");
        assertError("{A} {B}", FormulaErrorKind.PARSE, "Unexpected \"B\"");
    }

    @Test
    void testValidateSyntax() {
        assertEquals(Optional.empty(), ColumnFormulaParser.validateSyntax("SUM({A}) + 1"));
        assertEquals(Optional.of("Unclosed column reference '{'"), ColumnFormulaParser.validateSyntax("{A + 1"));
        assertEquals(Optional.of("Unclosed parenthesis '('"), ColumnFormulaParser.validateSyntax("({A} + 1"));
        assertEquals(Optional.of("Unexpected ')' at position 3"), ColumnFormulaParser.validateSyntax("{A}) + (1"));
        assertEquals(Optional.of("Formula expression is empty"), ColumnFormulaParser.validateSyntax(" "));
    }

    @Test
    void testExtractColumnReferences() {
        assertEquals(List.of("Jan.Revenue", "Cost"),
                ColumnFormulaParser.extractColumnReferences("SUM({Jan.Revenue}) + { Cost } + {"));
        assertEquals(List.of(), ColumnFormulaParser.extractColumnReferences(null));
    }

    private static void assertError(String expression, FormulaErrorKind kind, String expectedPrefix) {
        ParseResult result = ColumnFormulaParser.parse(expression);
        assertFalse(result.isOk(), expression);
        assertEquals(kind, result.getErrorKind(), expression);
        assertTrue(result.getError().startsWith(expectedPrefix), result.getError());
    }
}
