package com.formulas.app.formula;

import com.formulas.app.models.ColumnDefinition;
import com.formulas.app.models.SheetData;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the immutable lookup structures an evaluation runs against. A context is built
 * fresh for every evaluation call from the caller's data and is never mutated afterwards.
 */
public final class FormulaContextBuilder {

    private FormulaContextBuilder() {
    }

    /**
     * Context for A1 cell formulas. {@code columns} gives the visible column order:
     * the first column is "A".
     */
    public static CellEvalContext buildCellContext(String currentSheetId, List<SheetData> sheets,
                                                   List<ColumnDefinition> columns) {
        Map<String, SheetSnapshot> sheetsById = new LinkedHashMap<>();
        Map<String, String> labelToId = new HashMap<>();
        collectSheets(sheets, sheetsById, labelToId);

        Map<String, Integer> keyToIndex = new HashMap<>();
        List<String> keys = new ArrayList<>();
        if (columns != null) {
            for (ColumnDefinition column : columns) {
                keyToIndex.putIfAbsent(column.getKey(), keys.size());
                keys.add(column.getKey());
            }
        }
        return new CellEvalContext(currentSheetId, sheetsById, labelToId, keyToIndex, keys);
    }

    /**
     * Context for named-column formulas without an identity key.
     */
    public static FormulaContext buildFormulaContext(String currentSheetId, List<SheetData> sheets,
                                                     List<ColumnDefinition> columns) {
        return buildFormulaContext(currentSheetId, sheets, columns, null, false);
    }

    public static FormulaContext buildFormulaContext(String currentSheetId, List<SheetData> sheets,
                                                     List<ColumnDefinition> columns, String identityKey) {
        return buildFormulaContext(currentSheetId, sheets, columns, identityKey, false);
    }

    /**
     * Context for named-column formulas.
     *
     * @param identityKey column key whose value identifies a row across sheets, or null
     * @param legacyIdentityScan when no identity key is given, let cross-sheet references scan
     *     every field of the target sheet's rows for the current row's identity
     */
    public static FormulaContext buildFormulaContext(String currentSheetId, List<SheetData> sheets,
                                                     List<ColumnDefinition> columns, String identityKey,
                                                     boolean legacyIdentityScan) {
        Map<String, SheetSnapshot> sheetsById = new LinkedHashMap<>();
        Map<String, String> labelToId = new HashMap<>();
        collectSheets(sheets, sheetsById, labelToId);

        String key = identityKey == null || identityKey.trim().isEmpty() ? null : identityKey.trim();
        Map<String, Map<String, Map<String, Object>>> identityIndex = new HashMap<>();
        if (key != null) {
            for (SheetSnapshot sheet : sheetsById.values()) {
                identityIndex.put(sheet.getId(), indexRows(sheet, key));
            }
        }
        List<ColumnDefinition> columnCopies = new ArrayList<>();
        if (columns != null) {
            for (ColumnDefinition column : columns) {
                columnCopies.add(new ColumnDefinition(column.getKey(), column.getLabel(), column.getType()));
            }
        }
        return new FormulaContext(currentSheetId, sheetsById, labelToId, columnCopies, key, identityIndex,
                legacyIdentityScan);
    }

    private static void collectSheets(List<SheetData> sheets, Map<String, SheetSnapshot> sheetsById,
                                      Map<String, String> labelToId) {
        if (sheets == null) {
            return;
        }
        for (SheetData sheet : sheets) {
            sheetsById.put(sheet.getId(), new SheetSnapshot(sheet.getId(), sheet.getLabel(), sheet.getRows()));
            if (sheet.getLabel() != null && !sheet.getLabel().isEmpty()) {
                labelToId.put(sheet.getLabel(), sheet.getId());
            }
        }
    }

    // First row seen for each identity wins; later duplicates are ignored.
    private static Map<String, Map<String, Object>> indexRows(SheetSnapshot sheet, String identityKey) {
        Map<String, Map<String, Object>> index = new HashMap<>();
        for (Map<String, Object> row : sheet.getRows()) {
            String identity = FormulaContext.normalizeIdentity(row.get(identityKey));
            if (identity != null) {
                index.putIfAbsent(identity, row);
            }
        }
        return index;
    }
}
