package com.formulas.app.exceptions;

/**
 * Thrown before evaluation when a cell formula contains a range covering
 * more cells than formula.evaluation.max-range-cells allows.
 */
public class RangeLimitExceededException extends RuntimeException {
    public RangeLimitExceededException(String message) {
        super(message);
    }
}
