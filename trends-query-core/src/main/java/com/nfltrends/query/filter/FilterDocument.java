package com.nfltrends.query.filter;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable, validated filter: logical field name to its decoded variant. Absent fields are
 * simply missing. Iteration is always in field-name order.
 */
public final class FilterDocument {

    private static final FilterDocument EMPTY = new FilterDocument(new TreeMap<>());

    private final SortedMap<String, FieldFilter> fields;

    private FilterDocument(SortedMap<String, FieldFilter> fields) {
        this.fields = Collections.unmodifiableSortedMap(fields);
    }

    public static FilterDocument empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<FieldFilter> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public SortedMap<String, FieldFilter> fields() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public Map<String, Object> canonical() {
        Map<String, Object> form = new TreeMap<>();
        fields.forEach((name, filter) -> form.put(name, filter.canonical()));
        return form;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterDocument)) return false;
        return fields.equals(((FilterDocument) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "FilterDocument" + fields;
    }

    public static final class Builder {

        private final SortedMap<String, FieldFilter> fields = new TreeMap<>();

        private Builder() {
        }

        public Builder put(String field, FieldFilter filter) {
            fields.put(field, filter);
            return this;
        }

        public FilterDocument build() {
            return fields.isEmpty() ? EMPTY : new FilterDocument(new TreeMap<>(fields));
        }
    }
}
