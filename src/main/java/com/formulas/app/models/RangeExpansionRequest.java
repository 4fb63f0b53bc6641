package com.formulas.app.models;

import com.formulas.app.formula.cell.ExpansionAxis;

/**
 * Body of a range expansion: grow the ranges of 'formula' that end on 'oldMax'
 * (0-based row or column, per 'axis') so that they end on 'newMax'.
 */
public class RangeExpansionRequest {
    private String formula;
    private ExpansionAxis axis = ExpansionAxis.ROW;
    private int oldMax;
    private int newMax;

    // Default constructor needed for JSON (de)serialization
    public RangeExpansionRequest() {
    }

    public RangeExpansionRequest(String formula, ExpansionAxis axis, int oldMax, int newMax) {
        this.formula = formula;
        this.axis = axis;
        this.oldMax = oldMax;
        this.newMax = newMax;
    }

    public String getFormula() {
        return formula;
    }
    public ExpansionAxis getAxis() {
        return axis;
    }
    public int getOldMax() {
        return oldMax;
    }
    public int getNewMax() {
        return newMax;
    }
    public void setFormula(String formula) {
        this.formula = formula;
    }
    public void setAxis(ExpansionAxis axis) {
        this.axis = axis;
    }
    public void setOldMax(int oldMax) {
        this.oldMax = oldMax;
    }
    public void setNewMax(int newMax) {
        this.newMax = newMax;
    }
}
