package com.mdn.converter.exceptions;

/**
 * Thrown when a cell or range reference string can't be parsed,
 * or names a sheet that the workbook doesn't declare.
 * For example, "Reveneu!A1" or "A0".
 */
public class InvalidReferenceException extends MdnFormatException {
    public InvalidReferenceException(String message, String reference) {
        super("INVALID_REFERENCE", message, reference);
    }
}
