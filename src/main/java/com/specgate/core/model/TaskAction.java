package com.specgate.core.model;

/**
 * What a task does to its target file.
 */
public enum TaskAction {
    CREATE,
    MODIFY,
    DELETE;

    public static TaskAction parse(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return TaskAction.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
