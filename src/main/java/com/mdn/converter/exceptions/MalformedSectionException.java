package com.mdn.converter.exceptions;

/**
 * Thrown when the outer section structure of a document is broken:
 * a section that is never closed, a missing END DOCUMENT marker,
 * a misspelled delimiter, or content outside of any section.
 */
public class MalformedSectionException extends MdnFormatException {
    public MalformedSectionException(String message, int lineNumber) {
        super("MALFORMED_SECTION", message, lineNumber > 0 ? "line " + lineNumber : null);
    }

    public MalformedSectionException(String message) {
        super("MALFORMED_SECTION", message, null);
    }
}
