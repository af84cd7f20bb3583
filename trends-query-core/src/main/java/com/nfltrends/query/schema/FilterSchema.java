package com.nfltrends.query.schema;

import com.nfltrends.query.ordinal.CategoricalOrdinal;
import com.nfltrends.query.sort.SortSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Filter catalog of one record kind: the filterable fields, matchup pairs, sortable columns
 * with their categorical orderings, the default sort and the pagination limits.
 */
public final class FilterSchema {

    public static final String LIMIT = "limit";
    public static final String OFFSET = "offset";
    public static final String SORT_BY = "sort_by";

    private final String kind;
    private final Map<String, FieldDefinition> fields;
    private final List<MatchupPair> matchups;
    private final Set<String> sortableColumns;
    private final Map<String, CategoricalOrdinal> sortOrdinals;
    private final SortSpec defaultSort;
    private final int defaultLimit;
    private final int maxLimit;
    private final Set<String> requestKeys;

    private FilterSchema(Builder builder) {
        this.kind = builder.kind;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.matchups = List.copyOf(builder.matchups);
        this.sortableColumns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.sortableColumns));
        this.sortOrdinals = Map.copyOf(builder.sortOrdinals);
        this.defaultSort = builder.defaultSort;
        this.defaultLimit = builder.defaultLimit;
        this.maxLimit = builder.maxLimit;

        Set<String> keys = new LinkedHashSet<>();
        for (FieldDefinition field : fields.values()) {
            keys.addAll(field.requestKeys());
        }
        keys.add(LIMIT);
        keys.add(OFFSET);
        keys.add(SORT_BY);
        this.requestKeys = Collections.unmodifiableSet(keys);
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    public String kind() {
        return kind;
    }

    public List<FieldDefinition> fields() {
        return new ArrayList<>(fields.values());
    }

    public Optional<FieldDefinition> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public List<MatchupPair> matchups() {
        return matchups;
    }

    public Optional<MatchupPair> matchupOf(String field) {
        return matchups.stream().filter(pair -> pair.involves(field)).findFirst();
    }

    public Set<String> sortableColumns() {
        return sortableColumns;
    }

    public CategoricalOrdinal sortOrdinal(String column) {
        return sortOrdinals.get(column);
    }

    public SortSpec defaultSort() {
        return defaultSort;
    }

    public int defaultLimit() {
        return defaultLimit;
    }

    public int maxLimit() {
        return maxLimit;
    }

    public Set<String> requestKeys() {
        return requestKeys;
    }

    @Override
    public String toString() {
        return "FilterSchema[" + kind + "]";
    }

    public static final class Builder {

        private final String kind;
        private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        private final List<MatchupPair> matchups = new ArrayList<>();
        private final List<String> sortableColumns = new ArrayList<>();
        private final Map<String, CategoricalOrdinal> sortOrdinals = new LinkedHashMap<>();
        private SortSpec defaultSort;
        private int defaultLimit = 100;
        private int maxLimit = 1000;

        private Builder(String kind) {
            this.kind = kind;
        }

        public Builder field(FieldDefinition field) {
            if (fields.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate field " + field.name() + " in " + kind);
            }
            return this;
        }

        public Builder matchup(String first, String second) {
            matchups.add(new MatchupPair(first, second));
            return this;
        }

        public Builder sortable(String... columns) {
            Collections.addAll(sortableColumns, columns);
            return this;
        }

        public Builder sortOrdinal(String column, CategoricalOrdinal ordinal) {
            sortOrdinals.put(column, ordinal);
            return this;
        }

        public Builder defaultSort(SortSpec sort) {
            this.defaultSort = sort;
            return this;
        }

        public Builder limits(int defaultLimit, int maxLimit) {
            this.defaultLimit = defaultLimit;
            this.maxLimit = maxLimit;
            return this;
        }

        public FilterSchema build() {
            if (defaultSort == null) {
                throw new IllegalStateException("Schema " + kind + " needs a default sort");
            }
            for (MatchupPair pair : matchups) {
                if (!fields.containsKey(pair.first()) || !fields.containsKey(pair.second())) {
                    throw new IllegalStateException("Matchup " + pair + " refers to unknown fields");
                }
            }
            return new FilterSchema(this);
        }
    }
}
