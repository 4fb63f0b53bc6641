package com.formulas.app.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.FormulaFormatter;
import com.formulas.app.formula.FormulaResult;
import com.formulas.app.formula.ValueFormat;

/**
 * JSON form of a FormulaResult plus its display text. For example:
 * { "ok": true, "value": 900.0, "format": "currency", "display": "$900.00" }
 * { "ok": false, "error": "Division by zero", "errorKind": "ARITHMETIC", "display": "Division by zero" }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvaluationResponse {
    private boolean ok;
    private Double value;
    private ValueFormat format;
    private String error;
    private FormulaErrorKind errorKind;
    private String display;

    // Default constructor needed for JSON (de)serialization
    public EvaluationResponse() {
    }

    public static EvaluationResponse from(FormulaResult result, FormulaFormatter formatter) {
        EvaluationResponse response = new EvaluationResponse();
        response.ok = result.isOk();
        if (result.isOk()) {
            response.value = result.getValue();
            response.format = result.getFormat();
        } else {
            response.error = result.getError();
            response.errorKind = result.getErrorKind();
        }
        response.display = formatter.format(result);
        return response;
    }

    public boolean isOk() {
        return ok;
    }
    public Double getValue() {
        return value;
    }
    public ValueFormat getFormat() {
        return format;
    }
    public String getError() {
        return error;
    }
    public FormulaErrorKind getErrorKind() {
        return errorKind;
    }
    public String getDisplay() {
        return display;
    }
    public void setOk(boolean ok) {
        this.ok = ok;
    }
    public void setValue(Double value) {
        this.value = value;
    }
    public void setFormat(ValueFormat format) {
        this.format = format;
    }
    public void setError(String error) {
        this.error = error;
    }
    public void setErrorKind(FormulaErrorKind errorKind) {
        this.errorKind = errorKind;
    }
    public void setDisplay(String display) {
        this.display = display;
    }
}
