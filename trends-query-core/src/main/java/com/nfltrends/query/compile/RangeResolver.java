package com.nfltrends.query.compile;

import com.nfltrends.query.filter.FieldFilter;
import com.nfltrends.query.filter.FlagValue;
import com.nfltrends.query.filter.GamesApplicable;
import com.nfltrends.query.filter.MatchMode;
import com.nfltrends.query.filter.SetOrRange;
import com.nfltrends.query.filter.ValueRange;
import com.nfltrends.query.filter.ValueSet;
import com.nfltrends.query.ordinal.CategoricalOrdinal;
import com.nfltrends.query.predicate.And;
import com.nfltrends.query.predicate.Equals;
import com.nfltrends.query.predicate.In;
import com.nfltrends.query.predicate.IsNull;
import com.nfltrends.query.predicate.Or;
import com.nfltrends.query.predicate.OrdinalRange;
import com.nfltrends.query.predicate.Predicate;
import com.nfltrends.query.predicate.Range;
import com.nfltrends.query.schema.FieldDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Turns one validated field filter into the OR'd fragments it implies.
 * <ul>
 *   <li>the null sentinel becomes {@link IsNull}</li>
 *   <li>listed values become a membership fragment, OR'd with {@link IsNull} if the sentinel was listed too</li>
 *   <li>range bounds become an inclusive, possibly one-sided range over non-null rows;
 *       categorical bounds go through the field's ordinal table and never wrap</li>
 *   <li>a list and a range on the same field are OR'd</li>
 * </ul>
 */
public class RangeResolver {

    public Optional<Predicate> resolve(FieldDefinition field, FieldFilter filter) {
        String column = field.column();
        if (filter instanceof ValueSet) {
            return resolveValues(column, (ValueSet) filter);
        }
        if (filter instanceof ValueRange) {
            return Optional.of(resolveRange(field, (ValueRange) filter));
        }
        if (filter instanceof FlagValue) {
            return Optional.of(new Equals(column, ((FlagValue) filter).value()));
        }
        if (filter instanceof SetOrRange) {
            return resolveSetOrRange(field, (SetOrRange) filter);
        }
        if (filter instanceof GamesApplicable) {
            return Optional.of(resolveGames(column, (GamesApplicable) filter));
        }
        throw new PredicateCompilationException("No resolution for " + filter.getClass().getSimpleName()
                + " on field " + field.name());
    }

    public Optional<Predicate> resolveValues(String column, ValueSet values) {
        List<Predicate> fragments = new ArrayList<>();
        if (!values.values().isEmpty()) {
            fragments.add(membership(column, values.values()));
        }
        if (values.includesNull()) {
            fragments.add(new IsNull(column));
        }
        return anyOf(fragments);
    }

    public Predicate resolveRange(FieldDefinition field, ValueRange range) {
        CategoricalOrdinal ordinal = field.ordinal();
        if (ordinal == null) {
            return new Range(field.column(), range.lower(), range.upper());
        }
        return new OrdinalRange(field.column(), ordinal,
                ordinalOf(field, ordinal, range.lower()), ordinalOf(field, ordinal, range.upper()));
    }

    /**
     * Equality for a single value, set membership otherwise.
     */
    public static Predicate membership(String column, Collection<?> values) {
        if (values.isEmpty()) {
            throw new PredicateCompilationException("Empty membership on " + column);
        }
        if (values.size() == 1) {
            return new Equals(column, values.iterator().next());
        }
        return new In(column, new ArrayList<>(values));
    }

    private Optional<Predicate> resolveSetOrRange(FieldDefinition field, SetOrRange filter) {
        List<Predicate> fragments = new ArrayList<>();
        if (filter.values() != null) {
            resolveValues(field.column(), filter.values()).ifPresent(fragments::add);
        }
        for (ValueRange range : filter.ranges()) {
            fragments.add(resolveRange(field, range));
        }
        return anyOf(fragments);
    }

    private Predicate resolveGames(String column, GamesApplicable filter) {
        if (filter.mode() == MatchMode.CONTAINS_ANY) {
            return membership(column, filter.games());
        }
        List<Predicate> each = new ArrayList<>();
        for (String game : filter.games()) {
            each.add(new Equals(column, game));
        }
        return each.size() == 1 ? each.get(0) : new And(each);
    }

    private static Integer ordinalOf(FieldDefinition field, CategoricalOrdinal ordinal, Comparable<?> bound) {
        if (bound == null) {
            return null;
        }
        return ordinal.find(bound.toString()).orElseThrow(() -> new PredicateCompilationException(
                "Bound '" + bound + "' of " + field.name() + " is not in " + ordinal));
    }

    private static Optional<Predicate> anyOf(List<Predicate> fragments) {
        if (fragments.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(fragments.size() == 1 ? fragments.get(0) : new Or(fragments));
    }
}
