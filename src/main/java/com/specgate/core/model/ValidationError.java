package com.specgate.core.model;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * A single finding produced by one of the validators.
 *
 * @param message  human-readable description
 * @param file     file the finding belongs to
 * @param line     1-based line number, or {@code null} when not tied to a line
 * @param severity severity taken from the active severity map
 * @param category closed error category
 */
public record ValidationError(
    String message,
    Path file,
    Integer line,
    Severity severity,
    ErrorCategory category
) implements Serializable {

    public static ValidationError of(String message, Path file, Integer line,
                                     Severity severity, ErrorCategory category) {
        return new ValidationError(message, file, line, severity, category);
    }

    public boolean isFixable() {
        return category.isFixable();
    }

    /** Formats as {@code [HIGH] path:line - message}. */
    public String format() {
        String location = line != null ? file + ":" + line : String.valueOf(file);
        return "[" + severity.name() + "] " + location + " - " + message;
    }
}
