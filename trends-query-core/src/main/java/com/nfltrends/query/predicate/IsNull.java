package com.nfltrends.query.predicate;

import java.util.Objects;

/**
 * Matches rows where the column is null or missing.
 */
public record IsNull(String field) implements Predicate {

    public IsNull {
        Objects.requireNonNull(field, "field");
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitIsNull(this);
    }
}
