package com.formulas.app.formula;

import java.util.Objects;

/**
 * Outcome of evaluating a formula: either a finite number with its display format,
 * or an error message. Immutable.
 */
public final class FormulaResult {

    private static final FormulaResult ZERO = new FormulaResult(0d, ValueFormat.PLAIN, null, null);

    private final double value;
    private final ValueFormat format;
    private final String error;
    private final FormulaErrorKind errorKind;

    private FormulaResult(double value, ValueFormat format, String error, FormulaErrorKind errorKind) {
        this.value = value;
        this.format = format;
        this.error = error;
        this.errorKind = errorKind;
    }

    public static FormulaResult of(double value) {
        return of(value, ValueFormat.PLAIN);
    }

    public static FormulaResult of(double value, ValueFormat format) {
        return new FormulaResult(value, format == null ? ValueFormat.PLAIN : format, null, null);
    }

    public static FormulaResult zero() {
        return ZERO;
    }

    public static FormulaResult failure(FormulaErrorKind kind, String error) {
        return new FormulaResult(Double.NaN, null, Objects.requireNonNull(error), Objects.requireNonNull(kind));
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * The computed value. Only meaningful when {@link #isOk()}.
     */
    public double getValue() {
        if (!isOk()) {
            throw new IllegalStateException("Failed result has no value: " + error);
        }
        return value;
    }

    public ValueFormat getFormat() {
        return format;
    }

    public String getError() {
        return error;
    }

    public FormulaErrorKind getErrorKind() {
        return errorKind;
    }

    /**
     * Same value, different format. Failures are returned unchanged.
     */
    public FormulaResult withFormat(ValueFormat newFormat) {
        return isOk() ? of(value, newFormat) : this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormulaResult)) {
            return false;
        }
        FormulaResult that = (FormulaResult) o;
        if (isOk() != that.isOk()) {
            return false;
        }
        if (isOk()) {
            return Double.compare(value, that.value) == 0 && format == that.format;
        }
        return error.equals(that.error) && errorKind == that.errorKind;
    }

    @Override
    public int hashCode() {
        return isOk() ? Objects.hash(value, format) : Objects.hash(error, errorKind);
    }

    @Override
    public String toString() {
        return isOk() ? "FormulaResult{value=" + value + ", format=" + format + "}"
                : "FormulaResult{" + errorKind + ": " + error + "}";
    }
}
