package com.mdn.converter.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of validating a document. Errors fail validation; warnings are advisory
 * and are returned alongside a successful decode.
 */
public class ValidationReport {
    private final List<ValidationIssue> errors = new ArrayList<>();
    private final List<ValidationIssue> warnings = new ArrayList<>();

    public void addError(String code, String message, String location) {
        errors.add(new ValidationIssue(code, message, location));
    }

    public void addWarning(String code, String message, String location) {
        warnings.add(new ValidationIssue(code, message, location));
    }

    public List<ValidationIssue> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @JsonProperty("valid")
    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasError(String code) {
        return errors.stream().anyMatch(issue -> issue.getCode().equals(code));
    }

    public boolean hasWarning(String code) {
        return warnings.stream().anyMatch(issue -> issue.getCode().equals(code));
    }
}
