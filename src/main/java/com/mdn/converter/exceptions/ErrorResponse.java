package com.mdn.converter.exceptions;

/**
 * Simple DTO to structure error responses with a code, message and location.
 * For example:
 * {
 *   "code": "INVALID_REFERENCE",
 *   "message": "Unknown sheet 'Reveneu' (at Reveneu!A1)",
 *   "location": "Reveneu!A1"
 * }
 */
public class ErrorResponse {
    private String code;
    private String message;
    private String location;

    public ErrorResponse(String code, String message, String location) {
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
}
