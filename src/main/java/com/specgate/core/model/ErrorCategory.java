package com.specgate.core.model;

/**
 * Closed taxonomy of validation errors.
 * <p>
 * Fixability is a constant per category; only the structural categories the
 * {@code AutoFixer} knows how to repair by text insertion are fixable.
 */
public enum ErrorCategory {

    MISSING_HEADING("Missing Heading", Group.STRUCTURAL, true),
    MISSING_WHEN_THEN("Missing WHEN/THEN", Group.STRUCTURAL, true),
    MISSING_SCENARIO("Missing Scenario", Group.STRUCTURAL, true),
    INVALID_REQUIREMENT_FORMAT("Invalid Requirement Format", Group.STRUCTURAL, false),
    EMPTY_CONTENT("Empty Content", Group.STRUCTURAL, false),
    INVALID_STRUCTURE("Invalid Structure", Group.STRUCTURAL, false),
    DUPLICATE_REQUIREMENT("Duplicate Requirement", Group.SEMANTIC, false),
    BROKEN_REFERENCE("Broken Reference", Group.SEMANTIC, false),
    CIRCULAR_DEPENDENCY("Circular Dependency", Group.GRAPH, false),
    INCONSISTENCY("Inconsistency", Group.CROSS_DOCUMENT, false);

    public enum Group { STRUCTURAL, SEMANTIC, GRAPH, CROSS_DOCUMENT }

    private final String displayName;
    private final Group group;
    private final boolean fixable;

    ErrorCategory(String displayName, Group group, boolean fixable) {
        this.displayName = displayName;
        this.group = group;
        this.fixable = fixable;
    }

    public String displayName() { return displayName; }
    public Group group() { return group; }
    public boolean isFixable() { return fixable; }
}
