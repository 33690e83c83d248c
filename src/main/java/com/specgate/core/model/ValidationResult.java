package com.specgate.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, append-only list of validation errors produced by one check or one
 * run. Order is preserved so reports are deterministic.
 */
public final class ValidationResult {

    private final List<ValidationError> errors = new ArrayList<>();

    public ValidationResult() {}

    public ValidationResult(List<ValidationError> errors) {
        this.errors.addAll(errors);
    }

    public static ValidationResult empty() {
        return new ValidationResult();
    }

    public ValidationResult add(ValidationError error) {
        errors.add(error);
        return this;
    }

    public ValidationResult merge(ValidationResult other) {
        errors.addAll(other.errors);
        return this;
    }

    public List<ValidationError> errors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    public int count(Severity severity) {
        return (int) errors.stream().filter(e -> e.severity() == severity).count();
    }

    public List<ValidationError> errorsOf(ErrorCategory category) {
        return errors.stream().filter(e -> e.category() == category).toList();
    }

    public List<ValidationError> fixableErrors() {
        return errors.stream().filter(ValidationError::isFixable).toList();
    }

    public boolean isValid() {
        return isValid(ValidationMode.NORMAL);
    }

    public boolean isValid(ValidationMode mode) {
        return mode == ValidationMode.STRICT ? errors.isEmpty() : count(Severity.HIGH) == 0;
    }

    @Override
    public String toString() {
        return "ValidationResult{high=" + count(Severity.HIGH) + ", medium=" + count(Severity.MEDIUM)
                + ", low=" + count(Severity.LOW) + "}";
    }
}
