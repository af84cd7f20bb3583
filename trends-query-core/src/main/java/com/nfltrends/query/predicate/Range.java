package com.nfltrends.query.predicate;

import java.util.Objects;

/**
 * Inclusive range over a naturally ordered column. Either bound may be {@code null} for a
 * one-sided comparison, but not both. Rows whose column is null never match.
 */
public record Range(String field, Comparable<?> lower, Comparable<?> upper) implements Predicate {

    public Range {
        Objects.requireNonNull(field, "field");
        if (lower == null && upper == null) {
            throw new IllegalArgumentException("Range on '" + field + "' needs at least one bound");
        }
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitRange(this);
    }
}
