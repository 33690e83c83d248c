package com.specgate.core.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Usage ledger entry for one assistant call made by an external step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmCall(
    @JsonProperty("step") String step,
    @JsonProperty("model") String model,
    @JsonProperty("tokens_in") Long tokensIn,
    @JsonProperty("tokens_out") Long tokensOut,
    @JsonProperty("cost_usd") Double costUsd,
    @JsonProperty("duration_ms") Long durationMs,
    @JsonProperty("timestamp") Instant timestamp
) {}
