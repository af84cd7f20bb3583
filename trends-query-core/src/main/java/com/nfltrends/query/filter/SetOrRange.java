package com.nfltrends.query.filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A discrete list and one or more ranges on the same field; a row matches if it satisfies any
 * of them. {@code values} may be null when only ranges were given.
 */
public record SetOrRange(ValueSet values, List<ValueRange> ranges) implements FieldFilter {

    public SetOrRange {
        ranges = List.copyOf(ranges);
        if (values == null && ranges.isEmpty()) {
            throw new IllegalArgumentException("Nothing to combine");
        }
    }

    @Override
    public Object canonical() {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("values", values == null ? null : values.canonical());
        List<Object> rangeForms = new ArrayList<>();
        for (ValueRange range : ranges) {
            rangeForms.add(range.canonical());
        }
        form.put("ranges", rangeForms);
        return form;
    }
}
