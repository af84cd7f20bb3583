package com.nfltrends.query.compile;

import com.nfltrends.query.filter.FieldFilter;
import com.nfltrends.query.filter.FilterDocument;
import com.nfltrends.query.filter.ValueSet;
import com.nfltrends.query.predicate.And;
import com.nfltrends.query.predicate.Predicate;
import com.nfltrends.query.schema.FieldDefinition;
import com.nfltrends.query.schema.FilterSchema;
import com.nfltrends.query.schema.MatchupPair;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compiles a validated {@link FilterDocument} into one top-level conjunction.
 * <p>
 * Fields are visited in schema order, so the same document always compiles to an equal tree.
 * Absent fields contribute nothing; an empty conjunction matches every record. Matchup pairs
 * are resolved together by {@link MatchupResolver}.
 */
public class PredicateCompiler {

    private final RangeResolver rangeResolver;
    private final MatchupResolver matchupResolver;

    public PredicateCompiler(RangeResolver rangeResolver, MatchupResolver matchupResolver) {
        this.rangeResolver = rangeResolver;
        this.matchupResolver = matchupResolver;
    }

    public PredicateCompiler() {
        this(new RangeResolver(), new MatchupResolver());
    }

    public And compile(FilterSchema schema, FilterDocument document) {
        List<Predicate> conjuncts = new ArrayList<>();
        for (FieldDefinition field : schema.fields()) {
            Optional<MatchupPair> matchup = schema.matchupOf(field.name());
            if (matchup.isPresent()) {
                if (matchup.get().first().equals(field.name())) {
                    compileMatchup(schema, matchup.get(), document).ifPresent(conjuncts::add);
                }
                continue;
            }
            Optional<FieldFilter> filter = document.get(field.name());
            if (filter.isPresent()) {
                conjuncts.add(rangeResolver.resolve(field, filter.get())
                        .orElseThrow(() -> new PredicateCompilationException(
                                "Field " + field.name() + " resolved to no predicate")));
            }
        }
        return new And(conjuncts);
    }

    private Optional<Predicate> compileMatchup(FilterSchema schema, MatchupPair pair, FilterDocument document) {
        FieldDefinition first = schema.field(pair.first()).orElseThrow();
        FieldDefinition second = schema.field(pair.second()).orElseThrow();
        List<Object> firstValues = sideValues(first, document);
        List<Object> secondValues = sideValues(second, document);
        if (firstValues == null && secondValues == null) {
            return Optional.empty();
        }
        Optional<Predicate> resolved = matchupResolver.resolve(first.column(), firstValues, second.column(), secondValues);
        if (resolved.isEmpty()) {
            throw new PredicateCompilationException("Matchup " + pair + " resolved to no predicate");
        }
        return resolved;
    }

    private static List<Object> sideValues(FieldDefinition field, FilterDocument document) {
        Optional<FieldFilter> filter = document.get(field.name());
        if (filter.isEmpty()) {
            return null;
        }
        if (!(filter.get() instanceof ValueSet) || ((ValueSet) filter.get()).includesNull()) {
            throw new PredicateCompilationException("Matchup field " + field.name() + " holds " + filter.get());
        }
        return ((ValueSet) filter.get()).values();
    }
}
