package com.formulas.app.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flat list of numeric values collected from a function argument (a range, a whole column,
 * or a single scalar), or the first error met while collecting them.
 */
public final class ValueList {

    private final List<FormulaResult> values;
    private final FormulaResult failure;

    private ValueList(List<FormulaResult> values, FormulaResult failure) {
        this.values = values;
        this.failure = failure;
    }

    /** All entries must be successful results. */
    public static ValueList of(List<FormulaResult> values) {
        return new ValueList(Collections.unmodifiableList(new ArrayList<>(values)), null);
    }

    /** One scalar; a failed scalar makes the whole list a failure. */
    public static ValueList single(FormulaResult result) {
        return result.isOk() ? new ValueList(List.of(result), null) : failure(result);
    }

    public static ValueList failure(FormulaResult failure) {
        if (failure.isOk()) {
            throw new IllegalArgumentException("Not a failure: " + failure);
        }
        return new ValueList(Collections.emptyList(), failure);
    }

    public boolean isOk() {
        return failure == null;
    }

    public List<FormulaResult> getValues() {
        return values;
    }

    public FormulaResult getFailure() {
        return failure;
    }

    /**
     * Sum with merged format; the empty list sums to a plain 0.
     */
    public FormulaResult sum() {
        if (!isOk()) {
            return failure;
        }
        return FormulaFunction.SUM.apply(values);
    }
}
