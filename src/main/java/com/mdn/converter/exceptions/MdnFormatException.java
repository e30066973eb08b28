package com.mdn.converter.exceptions;

/**
 * Base class for every error raised while decoding or encoding an MDN document.
 * Carries a stable error code (e.g. "MALFORMED_SECTION") and, where known,
 * the location that caused it: a line number ("line 12") or a reference ("Revenue!B3:A1").
 */
public abstract class MdnFormatException extends RuntimeException {
    private final String code;
    private final String location;

    protected MdnFormatException(String code, String message, String location) {
        super(location == null ? message : message + " (at " + location + ")");
        this.code = code;
        this.location = location;
    }

    public String getCode() {
        return code;
    }

    public String getLocation() {
        return location;
    }
}
