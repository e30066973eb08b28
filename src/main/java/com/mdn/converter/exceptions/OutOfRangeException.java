package com.mdn.converter.exceptions;

/**
 * Thrown at resolution time when a block, column span or row span
 * has its start after its end (e.g. "B3:A1" or "C:A").
 */
public class OutOfRangeException extends MdnFormatException {
    public OutOfRangeException(String message, String reference) {
        super("OUT_OF_RANGE", message, reference);
    }
}
