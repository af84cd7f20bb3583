package com.nfltrends.query.filter;

/**
 * Raised when a filter field, pagination value or sort key falls outside its allowed domain.
 * Always client-caused; validation completes before any compilation or store access.
 */
public class FilterValidationException extends RuntimeException {

    private final String field;
    private final String allowedDomain;

    public FilterValidationException(String field, String message, String allowedDomain) {
        super(message);
        this.field = field;
        this.allowedDomain = allowedDomain;
    }

    public FilterValidationException(String field, String message) {
        this(field, message, null);
    }

    public String getField() {
        return field;
    }

    public String getAllowedDomain() {
        return allowedDomain;
    }
}
