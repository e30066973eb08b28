package com.mdn.converter.exceptions;

/**
 * Thrown when sections appear out of the required order
 * (HEADER, SHEET..., FORMULAS, FORMAT, AI_PROMPT), when a required
 * section is missing, or when a single-use section is repeated.
 * The order is reported, never corrected.
 */
public class OrderViolationException extends MdnFormatException {
    public OrderViolationException(String message, int lineNumber) {
        super("ORDER_VIOLATION", message, lineNumber > 0 ? "line " + lineNumber : null);
    }
}
