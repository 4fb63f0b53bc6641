package com.formulas.app.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a row formula evaluation: the formula is applied to each listed column
 * (every schema column when the list is empty).
 */
public class RowFormulaRequest extends ColumnFormulaRequest {
    private List<String> columnKeys = new ArrayList<>();

    // Default constructor needed for JSON (de)serialization
    public RowFormulaRequest() {
    }

    public RowFormulaRequest(String formula, String currentSheetId, List<SheetData> sheets,
                             List<ColumnDefinition> columns, String identityKey, List<String> columnKeys) {
        super(formula, currentSheetId, sheets, columns, identityKey);
        this.columnKeys = columnKeys;
    }

    public List<String> getColumnKeys() {
        return columnKeys;
    }
    public void setColumnKeys(List<String> columnKeys) {
        this.columnKeys = columnKeys;
    }
}
