package com.nfltrends.query.sort;

import com.nfltrends.query.filter.FilterValidationException;
import com.nfltrends.query.schema.FilterSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Compiles a decoded {@code sort_by} value into a {@link SortSpec}.
 * <p>
 * Accepts a field name, a {@code {field, order}} object, or a list mixing both. Missing
 * {@code order} means ascending. Absent or empty input yields the schema's default sort.
 * Categorical columns carry their ordinal table so stores sort them semantically.
 */
public class SortCompiler {

    private static final String SORT_BY = FilterSchema.SORT_BY;

    public SortSpec compile(FilterSchema schema, Object rawSortBy) {
        if (isEmpty(rawSortBy)) {
            return schema.defaultSort();
        }
        List<?> items = rawSortBy instanceof List ? (List<?>) rawSortBy : List.of(rawSortBy);
        List<SortKey> keys = new ArrayList<>();
        for (Object item : items) {
            keys.add(toKey(schema, item));
        }
        return new SortSpec(keys);
    }

    private SortKey toKey(FilterSchema schema, Object item) {
        String field;
        SortDirection direction = SortDirection.ASC;
        if (item instanceof String) {
            field = ((String) item).trim();
        } else if (item instanceof Map) {
            Map<?, ?> entry = (Map<?, ?>) item;
            for (Object key : entry.keySet()) {
                if (!"field".equals(key) && !"order".equals(key)) {
                    throw new FilterValidationException(SORT_BY, "Unexpected key in sort_by entry: " + key,
                            "{field, order}");
                }
            }
            if (!(entry.get("field") instanceof String)) {
                throw new FilterValidationException(SORT_BY, "Sort field must be specified in the object",
                        "{field, order}");
            }
            field = ((String) entry.get("field")).trim();
            direction = toDirection(entry.get("order"));
        } else {
            throw new FilterValidationException(SORT_BY, "Invalid item in sort_by: " + item,
                    "a field name, an object {field, order} or a list of either");
        }

        if (!schema.sortableColumns().contains(field)) {
            throw new FilterValidationException(SORT_BY, "Invalid sort field: " + field,
                    String.join(", ", schema.sortableColumns()));
        }
        return new SortKey(field, direction, schema.sortOrdinal(field));
    }

    private SortDirection toDirection(Object order) {
        if (order == null) {
            return SortDirection.ASC;
        }
        if ("asc".equals(order)) {
            return SortDirection.ASC;
        }
        if ("desc".equals(order)) {
            return SortDirection.DESC;
        }
        throw new FilterValidationException(SORT_BY, "Invalid sort order: " + order, "asc, desc");
    }

    private static boolean isEmpty(Object raw) {
        return raw == null
                || (raw instanceof String && ((String) raw).isBlank())
                || (raw instanceof Collection && ((Collection<?>) raw).isEmpty())
                || (raw instanceof Map && ((Map<?, ?>) raw).isEmpty());
    }
}
