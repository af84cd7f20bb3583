package com.nfltrends.query.sort;

import com.nfltrends.query.ordinal.CategoricalOrdinal;

import java.util.Objects;

/**
 * One sort column. When {@code ordinal} is set the column is compared by its categorical
 * ordinal (null rows after real values, unmatched rows last) instead of lexically.
 */
public record SortKey(String field, SortDirection direction, CategoricalOrdinal ordinal) {

    public SortKey {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(direction, "direction");
    }

    public static SortKey asc(String field) {
        return new SortKey(field, SortDirection.ASC, null);
    }

    public static SortKey desc(String field) {
        return new SortKey(field, SortDirection.DESC, null);
    }

    public boolean isCategorical() {
        return ordinal != null;
    }

    public SortKey withOrdinal(CategoricalOrdinal table) {
        return new SortKey(field, direction, table);
    }
}
