package com.formulas.app.models;

import java.util.List;

/**
 * Body of a named-column formula evaluation. Adds the identity key used to match rows
 * across sheets and an optional override of the legacy row-scan fallback.
 */
public class ColumnFormulaRequest extends CellFormulaRequest {
    private String identityKey;
    // null = use the configured default
    private Boolean legacyIdentityScan;

    // Default constructor needed for JSON (de)serialization
    public ColumnFormulaRequest() {
    }

    public ColumnFormulaRequest(String formula, String currentSheetId, List<SheetData> sheets,
                                List<ColumnDefinition> columns, String identityKey) {
        super(formula, currentSheetId, sheets, columns);
        this.identityKey = identityKey;
    }

    public String getIdentityKey() {
        return identityKey;
    }
    public Boolean getLegacyIdentityScan() {
        return legacyIdentityScan;
    }
    public void setIdentityKey(String identityKey) {
        this.identityKey = identityKey;
    }
    public void setLegacyIdentityScan(Boolean legacyIdentityScan) {
        this.legacyIdentityScan = legacyIdentityScan;
    }
}
