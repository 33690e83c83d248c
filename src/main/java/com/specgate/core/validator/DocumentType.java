package com.specgate.core.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Document types that carry a header schema. Each resolves to
 * {@code <type>.schema.json} in the schemas directory.
 */
public enum DocumentType {
    PROPOSAL,
    TASKS,
    SPEC,
    CHALLENGE,
    STATE;

    public String schemaFileName() {
        return name().toLowerCase(Locale.ROOT) + ".schema.json";
    }

    /**
     * Declared {@code type} field first (case-insensitive), then the filename convention.
     */
    public static Optional<DocumentType> detect(JsonNode header, Path path) {
        if (header != null && header.hasNonNull("type")) {
            Optional<DocumentType> declared = fromName(header.get("type").asText());
            if (declared.isPresent()) {
                return declared;
            }
        }
        return fromFileName(path);
    }

    public static Optional<DocumentType> fromName(String name) {
        if (name == null) return Optional.empty();
        for (DocumentType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static Optional<DocumentType> fromFileName(Path path) {
        if (path == null || path.getFileName() == null) return Optional.empty();
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "proposal.md" -> Optional.of(PROPOSAL);
            case "tasks.md" -> Optional.of(TASKS);
            case "challenge.md" -> Optional.of(CHALLENGE);
            case "state.yaml", "state.yml" -> Optional.of(STATE);
            default -> name.endsWith(".md") ? Optional.of(SPEC) : Optional.empty();
        };
    }
}
