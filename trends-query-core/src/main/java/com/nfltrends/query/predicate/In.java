package com.nfltrends.query.predicate;

import java.util.List;
import java.util.Objects;

/**
 * Set membership: {@code field IN (values)}. Null rows never match.
 */
public record In(String field, List<Object> values) implements Predicate {

    public In {
        Objects.requireNonNull(field, "field");
        values = List.copyOf(values);
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitIn(this);
    }
}
