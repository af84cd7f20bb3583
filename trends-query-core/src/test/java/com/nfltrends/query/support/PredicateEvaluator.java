package com.nfltrends.query.support;

import com.nfltrends.query.predicate.And;
import com.nfltrends.query.predicate.Equals;
import com.nfltrends.query.predicate.In;
import com.nfltrends.query.predicate.IsNull;
import com.nfltrends.query.predicate.Or;
import com.nfltrends.query.predicate.OrdinalRange;
import com.nfltrends.query.predicate.Predicate;
import com.nfltrends.query.predicate.PredicateVisitor;
import com.nfltrends.query.predicate.Range;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

/**
 * Evaluates compiled predicates against map-shaped rows. Array-valued columns match an
 * equality or membership when any element does.
 */
public class PredicateEvaluator implements PredicateVisitor<Boolean> {

    private final Map<String, Object> row;

    private PredicateEvaluator(Map<String, Object> row) {
        this.row = row;
    }

    public static boolean matches(Predicate predicate, Map<String, Object> row) {
        return predicate.accept(new PredicateEvaluator(row));
    }

    @Override
    public Boolean visitEquals(Equals equals) {
        return anyElement(row.get(equals.field()), value -> sameValue(value, equals.value()));
    }

    @Override
    public Boolean visitIn(In in) {
        return anyElement(row.get(in.field()),
                value -> in.values().stream().anyMatch(candidate -> sameValue(value, candidate)));
    }

    @Override
    public Boolean visitRange(Range range) {
        Object value = row.get(range.field());
        if (value == null) {
            return false;
        }
        return (range.lower() == null || compare(value, range.lower()) >= 0)
                && (range.upper() == null || compare(value, range.upper()) <= 0);
    }

    @Override
    public Boolean visitOrdinalRange(OrdinalRange range) {
        Object value = row.get(range.field());
        return value instanceof String && range.includes((String) value);
    }

    @Override
    public Boolean visitIsNull(IsNull isNull) {
        return row.get(isNull.field()) == null;
    }

    @Override
    public Boolean visitAnd(And and) {
        return and.operands().stream().allMatch(operand -> operand.accept(this));
    }

    @Override
    public Boolean visitOr(Or or) {
        return or.operands().stream().anyMatch(operand -> operand.accept(this));
    }

    public static int compare(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
        }
        if (a instanceof String && b instanceof String) {
            return ((String) a).compareTo((String) b);
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return Boolean.compare((Boolean) a, (Boolean) b);
        }
        throw new IllegalArgumentException("Cannot compare " + a + " with " + b);
    }

    private static boolean sameValue(Object a, Object b) {
        if (a == null || b == null) {
            return false;
        }
        if (a.getClass() != b.getClass() && !(a instanceof Number && b instanceof Number)) {
            return false;
        }
        return compare(a, b) == 0;
    }

    private static boolean anyElement(Object value, java.util.function.Predicate<Object> test) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream().anyMatch(test);
        }
        return value != null && test.test(value);
    }
}
