package com.bountypipe.screener.dto;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Errors and warnings collected while checking one record. Errors make the record
 * unusable; warnings are logged and the record is still processed.
 */
@Getter
public class ValidationResult {

    private final String recordId;
    private final List<Violation> errors = new ArrayList<>();
    private final List<Violation> warnings = new ArrayList<>();

    public ValidationResult(String recordId) {
        this.recordId = recordId;
    }

    public void addError(String code, String message) {
        errors.add(new Violation(code, message));
    }

    public void addWarning(String code, String message) {
        warnings.add(new Violation(code, message));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<Violation> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<Violation> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public record Violation(String code, String message) {
    }
}
