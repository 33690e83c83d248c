package com.specgate.core.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counts recorded for one validation run. {@code verdict} and
 * {@code issuesParsed} are only set for challenge validations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationOutcome(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("high") int high,
    @JsonProperty("medium") int medium,
    @JsonProperty("low") int low,
    @JsonProperty("verdict") String verdict,
    @JsonProperty("issues_parsed") Integer issuesParsed
) {}
