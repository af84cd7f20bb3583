package com.nfltrends.query.predicate;

import com.nfltrends.query.ordinal.CategoricalOrdinal;

import java.util.Objects;

/**
 * Inclusive range over a text column whose labels are ordered by a {@link CategoricalOrdinal}.
 * Bounds are ordinals of the table; either may be {@code null}. Null rows never match and a
 * lower bound above the upper bound matches nothing (ranges do not wrap).
 */
public record OrdinalRange(String field, CategoricalOrdinal ordinal, Integer lower, Integer upper)
        implements Predicate {

    public OrdinalRange {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(ordinal, "ordinal");
        if (lower == null && upper == null) {
            throw new IllegalArgumentException("Ordinal range on '" + field + "' needs at least one bound");
        }
    }

    /**
     * @return true if a row holding {@code label} satisfies this range
     */
    public boolean includes(String label) {
        if (label == null || !ordinal.contains(label)) {
            return false;
        }
        int value = ordinal.ordinalOf(label);
        return (lower == null || value >= lower) && (upper == null || value <= upper);
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitOrdinalRange(this);
    }
}
