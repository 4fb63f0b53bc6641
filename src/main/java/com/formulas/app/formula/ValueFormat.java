package com.formulas.app.formula;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display format carried alongside a computed number.
 * Ordered by precedence: a currency operand wins over a percent operand,
 * which wins over a plain one.
 */
public enum ValueFormat {
    PLAIN,
    PERCENT,
    CURRENCY;

    /**
     * Combines two operand formats. Associative and commutative.
     */
    public ValueFormat merge(ValueFormat other) {
        if (other == null) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    /**
     * Allows case-insensitive JSON input, e.g. "currency" -> CURRENCY.
     */
    @JsonCreator
    public static ValueFormat fromValue(String value) {
        return ValueFormat.valueOf(value.toUpperCase());
    }
}
