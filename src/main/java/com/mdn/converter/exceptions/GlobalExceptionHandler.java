package com.mdn.converter.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches conversion exceptions from the controllers or services,
 * returning error JSON with an HTTP 4xx code for bad documents
 * and 5xx for converter defects.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CoalesceInvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleCoalesceDefect(CoalesceInvariantViolationException ex) {
        logger.error("Range coalescer produced an inconsistent result", ex);
        ErrorResponse error = new ErrorResponse(ex.getCode(), ex.getMessage(), ex.getLocation());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(MdnFormatException.class)
    public ResponseEntity<ErrorResponse> handleFormatError(MdnFormatException ex) {
        logger.debug("Rejected document: {}", ex.getMessage());
        ErrorResponse error = new ErrorResponse(ex.getCode(), ex.getMessage(), ex.getLocation());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidWorkbook(IllegalArgumentException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_WORKBOOK", ex.getMessage(), null);
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    /**
     * A workbook JSON body that Jackson could not bind, including sheets rejected by their constructor.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        ErrorResponse error = new ErrorResponse("INVALID_WORKBOOK", cause.getMessage(), null);
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Catch-all for anything not mapped above
        logger.error("Unexpected conversion failure", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage(), null);
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
