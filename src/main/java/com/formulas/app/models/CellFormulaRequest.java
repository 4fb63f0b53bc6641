package com.formulas.app.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a cell formula evaluation:
 * the formula, the sheet it lives on, every sheet it may reference,
 * and the visible column order (first column = "A").
 */
public class CellFormulaRequest {
    private String formula;
    private String currentSheetId;
    private List<SheetData> sheets = new ArrayList<>();
    private List<ColumnDefinition> columns = new ArrayList<>();

    // Default constructor needed for JSON (de)serialization
    public CellFormulaRequest() {
    }

    public CellFormulaRequest(String formula, String currentSheetId, List<SheetData> sheets,
                              List<ColumnDefinition> columns) {
        this.formula = formula;
        this.currentSheetId = currentSheetId;
        this.sheets = sheets;
        this.columns = columns;
    }

    public String getFormula() {
        return formula;
    }
    public String getCurrentSheetId() {
        return currentSheetId;
    }
    public List<SheetData> getSheets() {
        return sheets;
    }
    public List<ColumnDefinition> getColumns() {
        return columns;
    }
    public void setFormula(String formula) {
        this.formula = formula;
    }
    public void setCurrentSheetId(String currentSheetId) {
        this.currentSheetId = currentSheetId;
    }
    public void setSheets(List<SheetData> sheets) {
        this.sheets = sheets;
    }
    public void setColumns(List<ColumnDefinition> columns) {
        this.columns = columns;
    }
}
