package com.specgate.core.model;

import java.nio.file.Path;

/**
 * Kind of workflow document, used to pick a validation rule preset.
 */
public enum DocumentKind {
    PROPOSAL,
    TASKS,
    SPEC;

    public static DocumentKind fromPath(Path path) {
        String name = path.getFileName() != null ? path.getFileName().toString().toLowerCase() : "";
        return switch (name) {
            case "proposal.md" -> PROPOSAL;
            case "tasks.md" -> TASKS;
            default -> SPEC;
        };
    }
}
