package com.formulas.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the "formula" prefix in application.properties.
 */
@ConfigurationProperties(prefix = "formula")
public class FormulaProperties {

    // Parsed formulas kept per (dialect, text); the cache is cleared when it fills up
    private int parseCacheSize = 1000;

    // Default for requests that don't say whether to scan rows when no identity key is set
    private boolean legacyIdentityScan = false;

    private final Evaluation evaluation = new Evaluation();
    private final Display display = new Display();

    public int getParseCacheSize() {
        return parseCacheSize;
    }
    public void setParseCacheSize(int parseCacheSize) {
        this.parseCacheSize = parseCacheSize;
    }
    public boolean isLegacyIdentityScan() {
        return legacyIdentityScan;
    }
    public void setLegacyIdentityScan(boolean legacyIdentityScan) {
        this.legacyIdentityScan = legacyIdentityScan;
    }
    public Evaluation getEvaluation() {
        return evaluation;
    }
    public Display getDisplay() {
        return display;
    }

    public static class Evaluation {
        // Largest range (rows x columns) a cell formula may cover
        private long maxRangeCells = 100_000;

        public long getMaxRangeCells() {
            return maxRangeCells;
        }
        public void setMaxRangeCells(long maxRangeCells) {
            this.maxRangeCells = maxRangeCells;
        }
    }

    public static class Display {
        private String locale = "en-US";
        private String currency = "USD";

        public String getLocale() {
            return locale;
        }
        public void setLocale(String locale) {
            this.locale = locale;
        }
        public String getCurrency() {
            return currency;
        }
        public void setCurrency(String currency) {
            this.currency = currency;
        }
    }
}
