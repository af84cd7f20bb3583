package com.nfltrends.query.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Point-in-time view of a result cache. {@code ttlSeconds} is null for caches without expiry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheStats(
        @JsonProperty("type") String type,
        @JsonProperty("maxsize") long maxSize,
        @JsonProperty("current_size") int currentSize,
        @JsonProperty("ttl_seconds") Long ttlSeconds,
        @JsonProperty("keys") List<String> keys
) {

    public CacheStats {
        keys = List.copyOf(keys);
    }
}
