package com.nfltrends.query.schema.domain;

import com.nfltrends.query.filter.FilterValidationException;

/**
 * Allowed values of one filter field. Implementations validate a single decoded JSON value
 * and return its canonical form.
 */
public interface FieldDomain {

    /**
     * @param field the request key being validated, used in error messages
     * @param raw   a single non-null decoded value (never a list)
     * @return the canonical value
     * @throws FilterValidationException if the value is outside the domain
     */
    Object canonicalize(String field, Object raw);

    /**
     * Human readable description of the domain, reported back to callers on failure.
     */
    String describe();

    default FilterValidationException reject(String field, Object raw) {
        return new FilterValidationException(field,
                "Invalid value for '" + field + "': " + raw + ". Allowed: " + describe(), describe());
    }
}
