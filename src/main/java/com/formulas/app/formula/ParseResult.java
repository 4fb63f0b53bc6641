package com.formulas.app.formula;

import java.util.List;

/**
 * Outcome of parsing formula text: the tree plus every reference encountered,
 * or an error message with a best-effort position.
 */
public final class ParseResult {

    private final FormulaNode ast;
    private final List<FormulaRef> references;
    private final String error;
    private final FormulaErrorKind errorKind;
    private final Integer position;

    private ParseResult(FormulaNode ast, List<FormulaRef> references, String error,
                        FormulaErrorKind errorKind, Integer position) {
        this.ast = ast;
        this.references = references;
        this.error = error;
        this.errorKind = errorKind;
        this.position = position;
    }

    public static ParseResult success(FormulaNode ast, List<FormulaRef> references) {
        return new ParseResult(ast, List.copyOf(references), null, null, null);
    }

    public static ParseResult failure(FormulaErrorKind kind, String error, Integer position) {
        return new ParseResult(null, List.of(), error, kind, position);
    }

    public static ParseResult failure(FormulaSyntaxException ex) {
        return failure(ex.getKind(), ex.getMessage(), ex.getPosition());
    }

    public boolean isOk() {
        return error == null;
    }

    public FormulaNode getAst() {
        return ast;
    }

    public List<FormulaRef> getReferences() {
        return references;
    }

    public String getError() {
        return error;
    }

    public FormulaErrorKind getErrorKind() {
        return errorKind;
    }

    /** Offset of the offending token, or null when unknown. */
    public Integer getPosition() {
        return position;
    }

    /**
     * Converts a failed parse into a failed evaluation, for one-step parse-and-evaluate callers.
     */
    public FormulaResult toFailure() {
        if (isOk()) {
            throw new IllegalStateException("Parse succeeded");
        }
        return FormulaResult.failure(errorKind, error);
    }

    @Override
    public String toString() {
        return isOk() ? "ParseResult{ast=" + ast + ", references=" + references + "}"
                : "ParseResult{" + errorKind + ": " + error + " at " + position + "}";
    }
}
