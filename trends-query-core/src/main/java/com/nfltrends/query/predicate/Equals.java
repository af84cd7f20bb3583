package com.nfltrends.query.predicate;

import java.util.Objects;

/**
 * {@code field == value}. For array-valued columns this matches when any element equals the value.
 */
public record Equals(String field, Object value) implements Predicate {

    public Equals {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitEquals(this);
    }
}
