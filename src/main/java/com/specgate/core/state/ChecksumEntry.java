package com.specgate.core.state;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * @param hash        {@code sha256:<hex>} of the normalized content
 * @param validatedAt when the checksum was recorded
 */
public record ChecksumEntry(
    @JsonProperty("hash") String hash,
    @JsonProperty("validated_at") Instant validatedAt
) {}
