package com.specgate.core.state;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulated usage across all recorded calls of one workflow instance.
 */
public class Telemetry {

    @JsonProperty("calls")
    private List<LlmCall> calls = new ArrayList<>();

    @JsonProperty("total_cost_usd")
    private double totalCostUsd;

    @JsonProperty("total_tokens_in")
    private long totalTokensIn;

    @JsonProperty("total_tokens_out")
    private long totalTokensOut;

    @JsonProperty("total_duration_ms")
    private long totalDurationMs;

    void add(LlmCall call) {
        calls.add(call);
        if (call.tokensIn() != null) totalTokensIn += call.tokensIn();
        if (call.tokensOut() != null) totalTokensOut += call.tokensOut();
        if (call.costUsd() != null) totalCostUsd += call.costUsd();
        if (call.durationMs() != null) totalDurationMs += call.durationMs();
    }

    public List<LlmCall> getCalls() { return List.copyOf(calls); }
    public double getTotalCostUsd() { return totalCostUsd; }
    public long getTotalTokensIn() { return totalTokensIn; }
    public long getTotalTokensOut() { return totalTokensOut; }
    public long getTotalDurationMs() { return totalDurationMs; }
}
