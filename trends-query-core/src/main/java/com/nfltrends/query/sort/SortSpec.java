package com.nfltrends.query.sort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ordered, non-empty list of sort keys.
 */
public record SortSpec(List<SortKey> keys) {

    public SortSpec {
        keys = List.copyOf(keys);
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("A sort needs at least one key");
        }
    }

    public static SortSpec of(SortKey... keys) {
        return new SortSpec(List.of(keys));
    }

    public boolean hasCategoricalKeys() {
        return keys.stream().anyMatch(SortKey::isCategorical);
    }

    public List<Object> canonical() {
        List<Object> form = new ArrayList<>();
        for (SortKey key : keys) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("field", key.field());
            entry.put("order", key.direction().name().toLowerCase(Locale.ROOT));
            form.add(entry);
        }
        return form;
    }
}
