package com.mdn.converter.models;

/**
 * One finding of the document validator, e.g.
 * { "code": "INERT_DECLARATION", "message": "...", "location": "Empty!A:A" }.
 */
public class ValidationIssue {
    private final String code;
    private final String message;
    private final String location;

    public ValidationIssue(String code, String message, String location) {
        this.code = code;
        this.message = message;
        this.location = location;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return code + ": " + message + (location == null ? "" : " (at " + location + ")");
    }
}
