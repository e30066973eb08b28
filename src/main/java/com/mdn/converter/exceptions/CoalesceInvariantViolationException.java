package com.mdn.converter.exceptions;

/**
 * Signals a defect in the range coalescer: its declarations did not
 * re-resolve to the exact per-cell assignment they were built from.
 * Never caused by the shape of the input.
 */
public class CoalesceInvariantViolationException extends MdnFormatException {
    public CoalesceInvariantViolationException(String message, String location) {
        super("COALESCE_INVARIANT_VIOLATION", message, location);
    }
}
