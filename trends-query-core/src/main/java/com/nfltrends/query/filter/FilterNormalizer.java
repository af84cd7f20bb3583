package com.nfltrends.query.filter;

import com.nfltrends.query.schema.FieldDefinition;
import com.nfltrends.query.schema.FilterSchema;
import com.nfltrends.query.schema.domain.IntegerDomain;
import com.nfltrends.query.sort.SortCompiler;
import com.nfltrends.query.sort.SortSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Validates a decoded request body against a {@link FilterSchema} and produces its
 * {@link NormalizedQuery}.
 * <p>
 * Every element of a list is validated on its own, values are folded to their canonical form,
 * scalars become singleton sets, and unknown keys are rejected. An explicit JSON {@code null}
 * is the same as leaving the key out. Stateless and thread-safe.
 */
public class FilterNormalizer {

    private static final Set<String> GRADED_KEYS = Set.of("exact", "or_less", "or_more");
    private static final Set<String> SINCE_KEYS = Set.of("exact", "since_or_later", "since_or_earlier");
    private static final Set<String> GAMES_APPLICABLE_KEYS = Set.of("games", "match_mode");

    private final SortCompiler sortCompiler;

    public FilterNormalizer(SortCompiler sortCompiler) {
        this.sortCompiler = sortCompiler;
    }

    public FilterNormalizer() {
        this(new SortCompiler());
    }

    public NormalizedQuery normalize(FilterSchema schema, Map<String, ?> raw) {
        Map<String, ?> body = raw == null ? Map.of() : raw;
        rejectUnknownKeys(schema, body);

        FilterDocument filter = normalizeFilter(schema, body);
        PageRequest page = normalizePage(schema, body);
        SortSpec sort = sortCompiler.compile(schema, body.get(FilterSchema.SORT_BY));
        return new NormalizedQuery(schema.kind(), filter, sort, page);
    }

    public FilterDocument normalizeFilter(FilterSchema schema, Map<String, ?> body) {
        FilterDocument.Builder document = FilterDocument.builder();
        for (FieldDefinition field : schema.fields()) {
            FieldFilter filter;
            switch (field.shape()) {
                case VALUES:
                    filter = readValuesWithRange(field, body);
                    break;
                case FLAG:
                    filter = readFlag(field, body.get(field.name()));
                    break;
                case GRADED:
                    filter = readGraded(field, body.get(field.name()));
                    break;
                case SINCE:
                    filter = readSince(field, body.get(field.name()));
                    break;
                case GAMES_APPLICABLE:
                    filter = readGamesApplicable(field, body.get(field.name()));
                    break;
                default:
                    throw new IllegalStateException("Unhandled field shape " + field.shape());
            }
            if (filter != null) {
                document.put(field.name(), filter);
            }
        }
        return document.build();
    }

    public PageRequest normalizePage(FilterSchema schema, Map<String, ?> body) {
        Object rawLimit = body.get(FilterSchema.LIMIT);
        Object rawOffset = body.get(FilterSchema.OFFSET);
        int limit = rawLimit == null
                ? schema.defaultLimit()
                : (Integer) IntegerDomain.between(1, schema.maxLimit()).canonicalize(FilterSchema.LIMIT, rawLimit);
        int offset = rawOffset == null
                ? 0
                : (Integer) IntegerDomain.atLeast(0).canonicalize(FilterSchema.OFFSET, rawOffset);
        return new PageRequest(limit, offset);
    }

    private void rejectUnknownKeys(FilterSchema schema, Map<String, ?> body) {
        for (String key : new TreeSet<>(body.keySet())) {
            if (!schema.requestKeys().contains(key)) {
                throw new FilterValidationException(key, "Unknown filter field: " + key,
                        String.join(", ", schema.requestKeys()));
            }
        }
    }

    // ============ VALUE LISTS AND RANGES ============

    private FieldFilter readValuesWithRange(FieldDefinition field, Map<String, ?> body) {
        ValueSet values = readValues(field, field.name(), body.get(field.name()), field.isNullable());
        ValueRange range = field.hasRange() ? readRange(field, body) : null;
        if (values != null && range != null) {
            return new SetOrRange(values, List.of(range));
        }
        return values != null ? values : range;
    }

    private ValueSet readValues(FieldDefinition field, String key, Object raw, boolean allowSentinel) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Map) {
            throw new FilterValidationException(key, "'" + key + "' must be a single value or a list",
                    field.domain().describe());
        }
        List<?> items = raw instanceof List ? (List<?>) raw : List.of(raw);
        List<Object> values = new ArrayList<>();
        boolean includesNull = false;
        for (Object item : items) {
            if (allowSentinel && isNullSentinel(item)) {
                includesNull = true;
            } else if (item == null || item instanceof List || item instanceof Map) {
                throw new FilterValidationException(key, "Each value of '" + key + "' must be a single value",
                        field.domain().describe());
            } else {
                values.add(field.domain().canonicalize(key, item));
            }
        }
        ValueSet set = ValueSet.of(values, includesNull);
        return set.isEmpty() ? null : set;
    }

    private ValueRange readRange(FieldDefinition field, Map<String, ?> body) {
        Comparable<?> lower = readBound(field, field.lowerKey(), body.get(field.lowerKey()));
        Comparable<?> upper = readBound(field, field.upperKey(), body.get(field.upperKey()));
        if (lower == null && upper == null) {
            return null;
        }
        return new ValueRange(lower, upper);
    }

    private Comparable<?> readBound(FieldDefinition field, String key, Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof List || raw instanceof Map) {
            throw new FilterValidationException(key, "'" + key + "' must be a single value", field.domain().describe());
        }
        return (Comparable<?>) field.domain().canonicalize(key, raw);
    }

    // ============ FLAGS ============

    private FieldFilter readFlag(FieldDefinition field, Object raw) {
        if (raw == null) {
            return null;
        }
        if (field.isNullable() && isNullSentinel(raw)) {
            return ValueSet.nullOnly();
        }
        return new FlagValue((Boolean) field.domain().canonicalize(field.name(), raw));
    }

    // ============ GRADED LABELS ============

    private FieldFilter readGraded(FieldDefinition field, Object raw) {
        if (raw == null) {
            return null;
        }
        if (isNullSentinel(raw)) {
            return ValueSet.nullOnly();
        }
        Map<?, ?> body = requireObject(field, raw, GRADED_KEYS, "'None' or an object {exact, or_less, or_more}");

        ValueSet exact = readValues(field, field.name() + ".exact", body.get("exact"), true);
        List<Object> labels = new ArrayList<>(expandGrades(field, "or_less", body.get("or_less")));
        labels.addAll(expandGrades(field, "or_more", body.get("or_more")));

        ValueSet merged = ValueSet.of(labels, false);
        if (exact != null) {
            merged = merged.union(exact);
        }
        return merged.isEmpty() ? null : merged;
    }

    private List<String> expandGrades(FieldDefinition field, String direction, Object raw) {
        List<String> labels = new ArrayList<>();
        if (raw == null) {
            return labels;
        }
        String key = field.name() + "." + direction;
        List<?> items = raw instanceof List ? (List<?>) raw : List.of(raw);
        String suffix = "or_less".equals(direction) ? " or less" : " or more";
        for (Object item : items) {
            if (item == null) {
                throw new FilterValidationException(key, "Each value of '" + key + "' must be a number",
                        field.gradeDomain().describe());
            }
            int grade = (Integer) field.gradeDomain().canonicalize(key, item);
            labels.add(grade + suffix);
        }
        return labels;
    }

    // ============ SINCE SEASONS ============

    private FieldFilter readSince(FieldDefinition field, Object raw) {
        if (raw == null) {
            return null;
        }
        Map<?, ?> body = requireObject(field, raw, SINCE_KEYS, "an object {exact, since_or_later, since_or_earlier}");

        ValueSet exact = readValues(field, field.name() + ".exact", body.get("exact"), false);
        List<ValueRange> ranges = new ArrayList<>();
        Comparable<?> later = readBound(field, field.name() + ".since_or_later", body.get("since_or_later"));
        if (later != null) {
            ranges.add(ValueRange.atLeast(later));
        }
        Comparable<?> earlier = readBound(field, field.name() + ".since_or_earlier", body.get("since_or_earlier"));
        if (earlier != null) {
            ranges.add(ValueRange.atMost(earlier));
        }

        if (ranges.isEmpty()) {
            return exact;
        }
        return new SetOrRange(exact, ranges);
    }

    // ============ GAMES APPLICABLE ============

    private FieldFilter readGamesApplicable(FieldDefinition field, Object raw) {
        if (raw == null) {
            return null;
        }
        Map<?, ?> body = requireObject(field, raw, GAMES_APPLICABLE_KEYS, "an object {games, match_mode}");

        ValueSet games = readValues(field, field.name() + ".games", body.get("games"), false);
        if (games == null) {
            return null;
        }
        Object rawMode = body.get("match_mode");
        MatchMode mode;
        if (rawMode == null) {
            mode = MatchMode.CONTAINS_ANY;
        } else if (rawMode instanceof String) {
            mode = MatchMode.fromWireName((String) rawMode);
        } else {
            throw new FilterValidationException(field.name() + ".match_mode", "Invalid match_mode: " + rawMode,
                    "contains_any or contains_all");
        }
        List<String> names = new ArrayList<>();
        for (Object game : games.values()) {
            names.add((String) game);
        }
        return new GamesApplicable(names, mode);
    }

    // ============ HELPERS ============

    private static Map<?, ?> requireObject(FieldDefinition field, Object raw, Set<String> allowedKeys, String expected) {
        if (!(raw instanceof Map)) {
            throw new FilterValidationException(field.name(), "'" + field.name() + "' must be " + expected, expected);
        }
        Map<?, ?> body = (Map<?, ?>) raw;
        for (Object key : body.keySet()) {
            if (!allowedKeys.contains(key)) {
                throw new FilterValidationException(field.name() + "." + key,
                        "Unknown key '" + key + "' in '" + field.name() + "'", expected);
            }
        }
        return body;
    }

    private static boolean isNullSentinel(Object value) {
        return value instanceof String && FieldDefinition.NULL_SENTINEL.equalsIgnoreCase(((String) value).trim());
    }
}
