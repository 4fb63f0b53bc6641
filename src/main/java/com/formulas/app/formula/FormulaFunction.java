package com.formulas.app.formula;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in functions.
 *
 * <p>Aggregates reduce a flattened list of values (ranges and columns expanded) and return a
 * plain 0 for empty input. Scalar functions receive one value per argument and check arity.
 */
public enum FormulaFunction {
    SUM(true, 0, -1),
    AVERAGE(true, 0, -1, "AVG"),
    COUNT(true, 0, -1),
    MIN(true, 0, -1),
    MAX(true, 0, -1),
    ABS(false, 1, 1),
    ROUND(false, 1, 2);

    /** Functions available in named-column formulas. */
    public static final Set<FormulaFunction> AGGREGATES = EnumSet.of(SUM, AVERAGE, COUNT, MIN, MAX);

    /** Functions available in A1 cell formulas. */
    public static final Set<FormulaFunction> ALL = EnumSet.allOf(FormulaFunction.class);

    private static final int MAX_ROUND_DIGITS = 15;

    private final boolean aggregate;
    private final int minArgs;
    private final int maxArgs;
    private final String alias;

    FormulaFunction(boolean aggregate, int minArgs, int maxArgs) {
        this(aggregate, minArgs, maxArgs, null);
    }

    FormulaFunction(boolean aggregate, int minArgs, int maxArgs, String alias) {
        this.aggregate = aggregate;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.alias = alias;
    }

    /**
     * Looks a function up by name, case-insensitively, within the given dialect.
     * Aliases such as {@code AVG} exist in cell formulas only.
     */
    public static Optional<FormulaFunction> lookup(String name, Set<FormulaFunction> supported) {
        String upper = name.toUpperCase(Locale.ROOT);
        boolean aliases = supported.containsAll(ALL);
        for (FormulaFunction fn : supported) {
            if (fn.name().equals(upper) || (aliases && upper.equals(fn.alias))) {
                return Optional.of(fn);
            }
        }
        return Optional.empty();
    }

    public boolean isAggregate() {
        return aggregate;
    }

    /**
     * Returns an arity error for a wrong argument count, or null when the count is acceptable.
     */
    public FormulaResult checkArity(int argCount) {
        if (argCount >= minArgs && (maxArgs < 0 || argCount <= maxArgs)) {
            return null;
        }
        String expected = minArgs == maxArgs ? "exactly " + minArgs : minArgs + " or " + maxArgs;
        return FormulaResult.failure(FormulaErrorKind.ARITY,
                name() + " requires " + expected + " argument" + (maxArgs == 1 ? "" : "s") + ", got " + argCount);
    }

    /**
     * Applies the function. All inputs must be successful results.
     */
    public FormulaResult apply(List<FormulaResult> values) {
        if (aggregate && values.isEmpty()) {
            return FormulaResult.zero();
        }
        ValueFormat format = ValueFormat.PLAIN;
        for (FormulaResult value : values) {
            format = format.merge(value.getFormat());
        }
        switch (this) {
            case SUM:
                return FormulaResult.of(total(values), format);
            case AVERAGE:
                return FormulaResult.of(total(values) / values.size(), format);
            case COUNT:
                return FormulaResult.of(values.size(), ValueFormat.PLAIN);
            case MIN:
                return FormulaResult.of(values.stream().mapToDouble(FormulaResult::getValue).min().getAsDouble(), format);
            case MAX:
                return FormulaResult.of(values.stream().mapToDouble(FormulaResult::getValue).max().getAsDouble(), format);
            case ABS:
                return FormulaResult.of(Math.abs(values.get(0).getValue()), values.get(0).getFormat());
            case ROUND:
                int digits = values.size() == 2 ? (int) values.get(1).getValue() : 0;
                return FormulaResult.of(round(values.get(0).getValue(), digits), values.get(0).getFormat());
            default:
                throw new IllegalStateException("Unhandled function " + this);
        }
    }

    private static double total(List<FormulaResult> values) {
        double sum = 0;
        for (FormulaResult value : values) {
            sum += value.getValue();
        }
        return sum;
    }

    /**
     * Rounds half away from zero at the given number of decimals (negative rounds to tens,
     * hundreds, ...). Uses the shortest decimal representation of the input so that 1.005
     * rounds to 1.01.
     */
    static double round(double value, int digits) {
        if (digits > MAX_ROUND_DIGITS) {
            return value;
        }
        int scale = Math.max(digits, -400);
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
