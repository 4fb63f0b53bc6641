package com.formulas.app.models;

/**
 * Represents a single column in the table schema:
 * a stable 'key' used in row records, a display 'label' used in formulas
 * (e.g. {Contract Value}) and a declared 'type'.
 */
public class ColumnDefinition {
    private String key;
    private String label;
    private ColumnType type = ColumnType.TEXT;

    // Default constructor needed for JSON (de)serialization
    public ColumnDefinition() {
    }

    // Convenient constructor for manual instantiation
    public ColumnDefinition(String key, String label) {
        this(key, label, ColumnType.TEXT);
    }

    public ColumnDefinition(String key, String label, ColumnType type) {
        this.key = key;
        this.label = label;
        this.type = type;
    }

    public String getKey() {
        return key;
    }
    public String getLabel() {
        // Columns without a label are addressed by key
        return label == null ? key : label;
    }
    public ColumnType getType() {
        return type;
    }
    public void setKey(String key) {
        this.key = key;
    }
    public void setLabel(String label) {
        this.label = label;
    }
    public void setType(ColumnType type) {
        this.type = type == null ? ColumnType.TEXT : type;
    }
}
