package com.nfltrends.query.ordinal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed bijection between an ordered label set and the dense ordinals {@code 1..n}.
 * <p>
 * Two sentinels sit above the real values: {@code n + 1} for a null label and {@code n + 2} for a
 * label outside the table. The same table drives categorical range filters and categorical
 * sorting, so both always agree on order.
 */
public final class CategoricalOrdinal {

    public static final CategoricalOrdinal MONTHS = new CategoricalOrdinal("month", List.of(
            "January", "February", "March", "April", "May", "June",
            "July", "August", "September", "October", "November", "December"));

    public static final CategoricalOrdinal WEEKDAYS = new CategoricalOrdinal("day_of_week", List.of(
            "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday"));

    public static final CategoricalOrdinal SEASONS_SINCE = new CategoricalOrdinal("seasons", sinceSeasonLabels(2006, 2025));

    private final String name;
    private final List<String> labels;
    private final Map<String, Integer> ordinals;

    public CategoricalOrdinal(String name, List<String> labels) {
        this.name = Objects.requireNonNull(name, "name");
        this.labels = List.copyOf(labels);
        Map<String, Integer> byLabel = new LinkedHashMap<>();
        for (int i = 0; i < this.labels.size(); i++) {
            if (byLabel.put(this.labels.get(i), i + 1) != null) {
                throw new IllegalArgumentException("Duplicate label '" + this.labels.get(i) + "' in " + name);
            }
        }
        this.ordinals = Collections.unmodifiableMap(byLabel);
    }

    public String name() {
        return name;
    }

    public List<String> labels() {
        return labels;
    }

    public boolean contains(String label) {
        return label != null && ordinals.containsKey(label);
    }

    /**
     * Ordinal used for sorting: real labels map to {@code 1..n}, null to {@link #nullOrdinal()},
     * anything else to {@link #unmatchedOrdinal()}.
     */
    public int ordinalOf(String label) {
        if (label == null) {
            return nullOrdinal();
        }
        Integer ordinal = ordinals.get(label);
        return ordinal != null ? ordinal : unmatchedOrdinal();
    }

    public Optional<Integer> find(String label) {
        return Optional.ofNullable(label == null ? null : ordinals.get(label));
    }

    public int nullOrdinal() {
        return labels.size() + 1;
    }

    public int unmatchedOrdinal() {
        return labels.size() + 2;
    }

    /**
     * Labels whose ordinal lies in the inclusive range; a null bound is open. Returns an empty
     * list when {@code lower > upper}.
     */
    public List<String> labelsBetween(Integer lower, Integer upper) {
        int from = lower == null ? 1 : Math.max(lower, 1);
        int to = upper == null ? labels.size() : Math.min(upper, labels.size());
        if (from > to) {
            return List.of();
        }
        return labels.subList(from - 1, to);
    }

    private static List<String> sinceSeasonLabels(int firstYear, int lastYear) {
        List<String> seasons = new ArrayList<>();
        for (int year = firstYear; year <= lastYear; year++) {
            seasons.add("since " + year + "-" + (year + 1));
        }
        return seasons;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CategoricalOrdinal)) return false;
        CategoricalOrdinal other = (CategoricalOrdinal) o;
        return name.equals(other.name) && labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, labels);
    }

    @Override
    public String toString() {
        return "CategoricalOrdinal[" + name + "]";
    }
}
