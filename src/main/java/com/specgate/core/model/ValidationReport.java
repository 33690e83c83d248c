package com.specgate.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.List;

/**
 * Error report handed to external callers (gating logic, review tooling).
 * Serialized as JSON by the CLI's {@code --json} mode.
 */
public record ValidationReport(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("counts") Counts counts,
    @JsonProperty("errors") List<Entry> errors,
    @JsonProperty("stale_files") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> staleFiles
) {

    public record Counts(
        @JsonProperty("high") int high,
        @JsonProperty("medium") int medium,
        @JsonProperty("low") int low
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(
        @JsonProperty("severity") String severity,
        @JsonProperty("category") String category,
        @JsonProperty("message") String message,
        @JsonProperty("file") String file,
        @JsonProperty("line") Integer line
    ) {}

    /**
     * Builds a report from a result. File paths under {@code baseDir} are reported
     * relative to it.
     */
    public static ValidationReport from(ValidationResult result, ValidationMode mode,
                                        List<String> staleFiles, Path baseDir) {
        List<Entry> entries = result.errors().stream()
                .map(e -> new Entry(
                        e.severity().name(),
                        e.category().displayName(),
                        e.message(),
                        displayPath(e.file(), baseDir),
                        e.line()))
                .toList();
        return new ValidationReport(
                result.isValid(mode),
                new Counts(result.count(Severity.HIGH), result.count(Severity.MEDIUM), result.count(Severity.LOW)),
                entries,
                staleFiles != null ? List.copyOf(staleFiles) : List.of());
    }

    private static String displayPath(Path file, Path baseDir) {
        if (file == null) return null;
        if (baseDir != null && file.isAbsolute() == baseDir.isAbsolute() && file.startsWith(baseDir)) {
            return baseDir.relativize(file).toString().replace('\\', '/');
        }
        return file.toString();
    }
}
