package com.specgate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a {@link ValidationResult} is judged valid.
 */
public enum ValidationMode {
    /** Valid when there are no HIGH errors. */
    NORMAL,
    /** Valid only when there are no errors of any severity. */
    STRICT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ValidationMode fromValue(String value) {
        return value == null ? NORMAL : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
