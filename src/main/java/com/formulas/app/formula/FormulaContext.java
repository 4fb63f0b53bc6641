package com.formulas.app.formula;

import com.formulas.app.models.ColumnDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup structures for named-column formulas: sheets by id and label, the column schema,
 * and, when an identity key is configured, an index from normalised identity value to row
 * for every sheet. Built by {@link FormulaContextBuilder}.
 */
public final class FormulaContext {

    private final String currentSheetId;
    private final Map<String, SheetSnapshot> sheets;
    private final Map<String, String> sheetLabelToId;
    private final List<ColumnDefinition> columns;
    private final String identityKey;
    private final Map<String, Map<String, Map<String, Object>>> identityIndex;
    private final boolean legacyIdentityScan;

    FormulaContext(String currentSheetId, Map<String, SheetSnapshot> sheets, Map<String, String> sheetLabelToId,
                   List<ColumnDefinition> columns, String identityKey,
                   Map<String, Map<String, Map<String, Object>>> identityIndex, boolean legacyIdentityScan) {
        this.currentSheetId = currentSheetId;
        this.sheets = Collections.unmodifiableMap(sheets);
        this.sheetLabelToId = Collections.unmodifiableMap(sheetLabelToId);
        this.columns = List.copyOf(columns);
        this.identityKey = identityKey;
        this.identityIndex = Collections.unmodifiableMap(identityIndex);
        this.legacyIdentityScan = legacyIdentityScan;
    }

    /**
     * Trimmed, lower-cased string form of an identity value; null for empty values.
     */
    public static String normalizeIdentity(Object value) {
        if (value == null) {
            return null;
        }
        String normalized = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    public String getCurrentSheetId() {
        return currentSheetId;
    }

    public Optional<SheetSnapshot> getSheet(String sheetId) {
        return Optional.ofNullable(sheets.get(sheetId));
    }

    public Optional<String> resolveSheetLabel(String label) {
        return Optional.ofNullable(sheetLabelToId.get(label));
    }

    public List<ColumnDefinition> getColumns() {
        return columns;
    }

    /**
     * Finds a column by label (case-insensitive) or by exact key.
     */
    public Optional<ColumnDefinition> findColumn(String name) {
        for (ColumnDefinition column : columns) {
            if (column.getLabel().equalsIgnoreCase(name) || column.getKey().equals(name)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    /** Configured identity column key, or null. */
    public String getIdentityKey() {
        return identityKey;
    }

    public boolean hasIdentityIndex() {
        return identityKey != null;
    }

    /**
     * Whether cross-sheet references fall back to scanning every field of every row when no
     * identity key is configured.
     */
    public boolean isLegacyIdentityScan() {
        return legacyIdentityScan;
    }

    /**
     * The first row of {@code sheetId} whose normalised identity value equals the normalised
     * {@code identity}.
     */
    public Optional<Map<String, Object>> findRowByIdentity(String sheetId, Object identity) {
        String normalized = normalizeIdentity(identity);
        Map<String, Map<String, Object>> index = identityIndex.get(sheetId);
        if (normalized == null || index == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(index.get(normalized));
    }

    /**
     * Fills in sheet ids for parsed references: unqualified references get the current sheet,
     * qualified ones the id their label maps to (left null when the label is unknown).
     */
    public List<FormulaRef> resolveReferences(List<FormulaRef> references) {
        List<FormulaRef> resolved = new ArrayList<>(references.size());
        for (FormulaRef ref : references) {
            String sheetId = ref.sheetLabel() == null ? currentSheetId : sheetLabelToId.get(ref.sheetLabel());
            resolved.add(ref.withSheetId(sheetId));
        }
        return resolved;
    }
}
