package com.nfltrends.query.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Membership over canonical values, optionally OR'd with "column is null" when the caller
 * supplied the {@code "None"} sentinel. Values are sorted and distinct.
 */
public record ValueSet(List<Object> values, boolean includesNull) implements FieldFilter {

    public ValueSet {
        values = List.copyOf(values);
    }

    public static ValueSet of(Collection<?> values, boolean includesNull) {
        TreeSet<Object> sorted = new TreeSet<>(ValueSet::compareNatural);
        sorted.addAll(values);
        return new ValueSet(new ArrayList<>(sorted), includesNull);
    }

    public static ValueSet of(Object... values) {
        return of(List.of(values), false);
    }

    public static ValueSet nullOnly() {
        return new ValueSet(List.of(), true);
    }

    public boolean isEmpty() {
        return values.isEmpty() && !includesNull;
    }

    public ValueSet union(ValueSet other) {
        List<Object> merged = new ArrayList<>(values);
        merged.addAll(other.values);
        return of(merged, includesNull || other.includesNull);
    }

    // values of one field share a single comparable type
    @SuppressWarnings("unchecked")
    private static int compareNatural(Object left, Object right) {
        return ((Comparable<Object>) left).compareTo(right);
    }

    @Override
    public Object canonical() {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("values", values);
        form.put("null", includesNull);
        return form;
    }
}
