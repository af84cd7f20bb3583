package com.nfltrends.query.schema.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of text labels. Matching ignores case and surrounding whitespace, and the value is
 * returned in the label's canonical casing.
 */
public class LabelDomain implements FieldDomain {

    private final String description;
    private final List<String> labels;
    private final Map<String, String> byFoldedLabel = new LinkedHashMap<>();

    public LabelDomain(String description, List<String> labels) {
        this.description = description;
        this.labels = List.copyOf(labels);
        for (String label : this.labels) {
            byFoldedLabel.put(fold(label), label);
        }
    }

    public static LabelDomain of(String description, List<String> labels) {
        return new LabelDomain(description, labels);
    }

    public List<String> labels() {
        return labels;
    }

    @Override
    public Object canonicalize(String field, Object raw) {
        if (!(raw instanceof String)) {
            throw reject(field, raw);
        }
        String label = byFoldedLabel.get(fold((String) raw));
        if (label == null) {
            throw reject(field, raw);
        }
        return label;
    }

    @Override
    public String describe() {
        return description + " " + labels;
    }

    private static String fold(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
