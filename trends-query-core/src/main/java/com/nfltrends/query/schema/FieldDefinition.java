package com.nfltrends.query.schema;

import com.nfltrends.query.ordinal.CategoricalOrdinal;
import com.nfltrends.query.schema.domain.FieldDomain;
import com.nfltrends.query.schema.domain.IntegerDomain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declares one logical filter field: its request key, the store column it filters, its shape,
 * value domain and optional range keys, null sentinel and ordinal table.
 * <p>
 * Instances are immutable; the {@code with*} methods return modified copies.
 */
public final class FieldDefinition {

    public static final String NULL_SENTINEL = "None";

    private final String name;
    private final String column;
    private final FieldShape shape;
    private final FieldDomain domain;
    private final String lowerKey;
    private final String upperKey;
    private final boolean nullable;
    private final CategoricalOrdinal ordinal;
    private final IntegerDomain gradeDomain;

    private FieldDefinition(String name, String column, FieldShape shape, FieldDomain domain,
                            String lowerKey, String upperKey, boolean nullable,
                            CategoricalOrdinal ordinal, IntegerDomain gradeDomain) {
        this.name = Objects.requireNonNull(name, "name");
        this.column = Objects.requireNonNull(column, "column");
        this.shape = Objects.requireNonNull(shape, "shape");
        this.domain = domain;
        this.lowerKey = lowerKey;
        this.upperKey = upperKey;
        this.nullable = nullable;
        this.ordinal = ordinal;
        this.gradeDomain = gradeDomain;
    }

    public static FieldDefinition values(String name, FieldDomain domain) {
        return new FieldDefinition(name, name, FieldShape.VALUES, domain, null, null, false, null, null);
    }

    public static FieldDefinition flag(String name, FieldDomain domain) {
        return new FieldDefinition(name, name, FieldShape.FLAG, domain, null, null, false, null, null);
    }

    /**
     * Graded labels such as {@code "3.5"} or {@code "7 or less"}: {@code exact} takes labels from
     * {@code labels}, {@code or_less}/{@code or_more} take integers from {@code grades}.
     */
    public static FieldDefinition graded(String name, FieldDomain labels, IntegerDomain grades) {
        return new FieldDefinition(name, name, FieldShape.GRADED, labels, null, null, true, null, grades);
    }

    public static FieldDefinition since(String name, FieldDomain labels, CategoricalOrdinal ordinal) {
        return new FieldDefinition(name, name, FieldShape.SINCE, labels, null, null, false, ordinal, null);
    }

    public static FieldDefinition gamesApplicable(String name, FieldDomain games) {
        return new FieldDefinition(name, name, FieldShape.GAMES_APPLICABLE, games, null, null, false, null, null);
    }

    public FieldDefinition column(String storeColumn) {
        return new FieldDefinition(name, storeColumn, shape, domain, lowerKey, upperKey, nullable, ordinal, gradeDomain);
    }

    /** Adds {@code start_<name>} / {@code end_<name>} range keys. */
    public FieldDefinition withStartEnd() {
        return withRangeKeys("start_" + name, "end_" + name);
    }

    /** Adds {@code min_<name>} / {@code max_<name>} range keys. */
    public FieldDefinition withMinMax() {
        return withRangeKeys("min_" + name, "max_" + name);
    }

    public FieldDefinition withRangeKeys(String lower, String upper) {
        return new FieldDefinition(name, column, shape, domain, lower, upper, nullable, ordinal, gradeDomain);
    }

    /** Accepts the {@code "None"} sentinel, meaning "column is null". */
    public FieldDefinition nullable() {
        return new FieldDefinition(name, column, shape, domain, lowerKey, upperKey, true, ordinal, gradeDomain);
    }

    /** Compares range bounds through the given ordinal table instead of naturally. */
    public FieldDefinition ordinal(CategoricalOrdinal table) {
        return new FieldDefinition(name, column, shape, domain, lowerKey, upperKey, nullable, table, gradeDomain);
    }

    public String name() {
        return name;
    }

    public String column() {
        return column;
    }

    public FieldShape shape() {
        return shape;
    }

    public FieldDomain domain() {
        return domain;
    }

    public boolean hasRange() {
        return lowerKey != null;
    }

    public String lowerKey() {
        return lowerKey;
    }

    public String upperKey() {
        return upperKey;
    }

    public boolean isNullable() {
        return nullable;
    }

    public CategoricalOrdinal ordinal() {
        return ordinal;
    }

    public IntegerDomain gradeDomain() {
        return gradeDomain;
    }

    /**
     * Every request key this field consumes.
     */
    public List<String> requestKeys() {
        List<String> keys = new ArrayList<>();
        keys.add(name);
        if (hasRange()) {
            keys.add(lowerKey);
            keys.add(upperKey);
        }
        return keys;
    }

    @Override
    public String toString() {
        return "FieldDefinition[" + name + " -> " + column + ", " + shape + "]";
    }
}
