package com.nfltrends.query.filter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inclusive range with optional bounds. For categorical fields the bounds are labels that the
 * resolver translates through the field's ordinal table.
 */
public record ValueRange(Comparable<?> lower, Comparable<?> upper) implements FieldFilter {

    public ValueRange {
        if (lower == null && upper == null) {
            throw new IllegalArgumentException("A range needs at least one bound");
        }
    }

    public static ValueRange atLeast(Comparable<?> lower) {
        return new ValueRange(lower, null);
    }

    public static ValueRange atMost(Comparable<?> upper) {
        return new ValueRange(null, upper);
    }

    @Override
    public Object canonical() {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("lower", lower);
        form.put("upper", upper);
        return form;
    }
}
