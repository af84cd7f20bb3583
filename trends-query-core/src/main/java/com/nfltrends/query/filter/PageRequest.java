package com.nfltrends.query.filter;

/**
 * Validated pagination: {@code 1 <= limit <= max} and {@code offset >= 0}.
 */
public record PageRequest(int limit, int offset) {

    public PageRequest {
        if (limit < 1 || offset < 0) {
            throw new IllegalArgumentException("Invalid page: limit=" + limit + ", offset=" + offset);
        }
    }
}
