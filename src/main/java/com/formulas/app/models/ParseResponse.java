package com.formulas.app.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.FormulaPrinter;
import com.formulas.app.formula.FormulaRef;
import com.formulas.app.formula.ParseResult;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a ParseResult. On success carries the formula re-printed from its syntax tree
 * ('normalized') and the references it depends on; on failure the error and its position.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParseResponse {
    private boolean ok;
    private String normalized;
    private List<FormulaRef> references = new ArrayList<>();
    private String error;
    private FormulaErrorKind errorKind;
    private Integer position;

    // Default constructor needed for JSON (de)serialization
    public ParseResponse() {
    }

    public static ParseResponse from(ParseResult result) {
        ParseResponse response = new ParseResponse();
        response.ok = result.isOk();
        if (result.isOk()) {
            response.normalized = FormulaPrinter.toFormula(result.getAst());
            response.references = result.getReferences();
        } else {
            response.error = result.getError();
            response.errorKind = result.getErrorKind();
            response.position = result.getPosition();
        }
        return response;
    }

    public boolean isOk() {
        return ok;
    }
    public String getNormalized() {
        return normalized;
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
    public Integer getPosition() {
        return position;
    }
    public void setOk(boolean ok) {
        this.ok = ok;
    }
    public void setNormalized(String normalized) {
        this.normalized = normalized;
    }
    public void setReferences(List<FormulaRef> references) {
        this.references = references;
    }
    public void setError(String error) {
        this.error = error;
    }
    public void setErrorKind(FormulaErrorKind errorKind) {
        this.errorKind = errorKind;
    }
    public void setPosition(Integer position) {
        this.position = position;
    }
}
