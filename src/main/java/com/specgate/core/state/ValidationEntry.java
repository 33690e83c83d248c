package com.specgate.core.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.specgate.core.model.ValidationMode;

import java.time.Instant;
import java.util.List;

/**
 * One append-only validation history record.
 */
public record ValidationEntry(
    @JsonProperty("step") String step,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("rules_version") String rulesVersion,
    @JsonProperty("mode") ValidationMode mode,
    @JsonProperty("result") ValidationOutcome result,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("warnings") List<String> warnings
) {

    public ValidationEntry {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
