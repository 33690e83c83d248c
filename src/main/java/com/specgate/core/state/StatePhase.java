package com.specgate.core.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Workflow phase of one instance, persisted in lowercase.
 */
public enum StatePhase {
    PROPOSED,
    CHALLENGED,
    REJECTED,
    IMPLEMENTING,
    COMPLETE,
    ARCHIVED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StatePhase fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
