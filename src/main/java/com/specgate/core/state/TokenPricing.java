package com.specgate.core.state;

/**
 * Per-million-token prices in USD. Either component may be null when unknown.
 */
public record TokenPricing(Double inputPerMillion, Double outputPerMillion) {

    /** Cost of a call, or null when neither side can be priced. */
    public Double costOf(Long tokensIn, Long tokensOut) {
        Double in = price(tokensIn, inputPerMillion);
        Double out = price(tokensOut, outputPerMillion);
        if (in == null && out == null) return null;
        return (in != null ? in : 0.0) + (out != null ? out : 0.0);
    }

    private static Double price(Long tokens, Double perMillion) {
        if (tokens == null || perMillion == null) return null;
        return (tokens / 1_000_000.0) * perMillion;
    }
}
