package com.formulas.app.formula;

import java.util.regex.Pattern;

/**
 * Converts raw cell values to numbers and infers their display format.
 *
 * <p>Rules: numbers pass through; null and blank strings are 0; strings lose currency symbols,
 * thousands separators and a trailing percent sign before parsing; anything else that does not
 * parse is a {@link FormulaErrorKind#CONVERSION} error, never a silent 0.
 */
public final class NumericCoercion {

    private static final Pattern STRIPPED_CHARS = Pattern.compile("[$€£¥,]");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");
    private static final String CURRENCY_SYMBOLS = "$€£¥";

    private NumericCoercion() {
    }

    public static boolean isEmpty(Object raw) {
        return raw == null || (raw instanceof String && ((String) raw).trim().isEmpty());
    }

    /**
     * Format implied by how a raw value is written: a leading currency symbol (optionally after
     * a minus sign) means currency, a trailing {@code %} means percent.
     */
    public static ValueFormat detectFormat(Object raw) {
        if (!(raw instanceof String)) {
            return ValueFormat.PLAIN;
        }
        String s = ((String) raw).trim();
        if (s.startsWith("-") || s.startsWith("+")) {
            s = s.substring(1).trim();
        }
        if (!s.isEmpty() && CURRENCY_SYMBOLS.indexOf(s.charAt(0)) >= 0) {
            return ValueFormat.CURRENCY;
        }
        if (s.endsWith("%")) {
            return ValueFormat.PERCENT;
        }
        return ValueFormat.PLAIN;
    }

    /**
     * Coerces a raw value to a number, carrying the detected format.
     *
     * @param raw the stored value (Number, String, Boolean or null)
     * @param description where the value came from, used in error text, e.g. {@code column "Revenue"}
     */
    public static FormulaResult coerce(Object raw, String description) {
        if (isEmpty(raw)) {
            return FormulaResult.zero();
        }
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            if (!Double.isFinite(value)) {
                return FormulaResult.failure(FormulaErrorKind.CONVERSION,
                        "Value " + raw + " in " + description + " is not a finite number");
            }
            return FormulaResult.of(value);
        }
        if (raw instanceof String) {
            String text = (String) raw;
            String cleaned = STRIPPED_CHARS.matcher(text).replaceAll("").trim();
            if (cleaned.endsWith("%")) {
                cleaned = cleaned.substring(0, cleaned.length() - 1).trim();
            }
            if (!DECIMAL.matcher(cleaned).matches()) {
                return FormulaResult.failure(FormulaErrorKind.CONVERSION,
                        "Cannot convert \"" + text + "\" to number in " + description);
            }
            double value = Double.parseDouble(cleaned);
            if (!Double.isFinite(value)) {
                return FormulaResult.failure(FormulaErrorKind.CONVERSION,
                        "Value \"" + text + "\" in " + description + " is out of range");
            }
            return FormulaResult.of(value, detectFormat(text));
        }
        return FormulaResult.failure(FormulaErrorKind.CONVERSION,
                "Cannot convert " + raw + " (" + raw.getClass().getSimpleName() + ") to number in " + description);
    }
}
