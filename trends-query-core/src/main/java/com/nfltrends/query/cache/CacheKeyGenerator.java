package com.nfltrends.query.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.nfltrends.query.filter.NormalizedQuery;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content fingerprint of a normalized query: SHA-256 over its canonical JSON form, with object
 * keys sorted and value lists already sorted by normalization. Equal queries always get the same
 * 64 character hex key regardless of how the request was written.
 */
public class CacheKeyGenerator {

    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public String fingerprint(NormalizedQuery query) {
        String key = hash(canonicalForm(query));
        if (CacheKeys.RESERVED.contains(key)) {
            key = hash("fingerprint:" + key);
        }
        return key;
    }

    String canonicalForm(NormalizedQuery query) {
        Map<String, Object> form = new TreeMap<>();
        form.put("kind", query.kind());
        form.put("filters", query.filter().canonical());
        form.put("sort", query.sort().canonical());
        form.put("limit", query.page().limit());
        form.put("offset", query.page().offset());
        try {
            return CANONICAL_JSON.writeValueAsString(form);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonically encode query " + query, e);
        }
    }

    private static String hash(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
