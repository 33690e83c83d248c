package com.specgate.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Category to severity lookup. Every category always has a severity; overrides
 * replace the default for individual categories only.
 */
public final class SeverityMap {

    private final Map<ErrorCategory, Severity> severities;

    private SeverityMap(Map<ErrorCategory, Severity> severities) {
        this.severities = Collections.unmodifiableMap(new EnumMap<>(severities));
    }

    public static SeverityMap defaults() {
        var map = new EnumMap<ErrorCategory, Severity>(ErrorCategory.class);
        for (ErrorCategory category : ErrorCategory.values()) {
            map.put(category, Severity.HIGH);
        }
        map.put(ErrorCategory.BROKEN_REFERENCE, Severity.MEDIUM);
        return new SeverityMap(map);
    }

    public SeverityMap withOverrides(Map<ErrorCategory, Severity> overrides) {
        var map = new EnumMap<>(severities);
        map.putAll(overrides);
        return new SeverityMap(map);
    }

    public Severity severityOf(ErrorCategory category) {
        return severities.get(category);
    }

    public Map<ErrorCategory, Severity> asMap() {
        return severities;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SeverityMap other && severities.equals(other.severities);
    }

    @Override
    public int hashCode() {
        return severities.hashCode();
    }
}
