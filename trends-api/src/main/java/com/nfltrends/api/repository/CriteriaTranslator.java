package com.nfltrends.api.repository;

import com.nfltrends.query.predicate.And;
import com.nfltrends.query.predicate.Equals;
import com.nfltrends.query.predicate.In;
import com.nfltrends.query.predicate.IsNull;
import com.nfltrends.query.predicate.Or;
import com.nfltrends.query.predicate.OrdinalRange;
import com.nfltrends.query.predicate.Predicate;
import com.nfltrends.query.predicate.PredicateVisitor;
import com.nfltrends.query.predicate.Range;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Translates compiled predicates into MongoDB criteria.
 * <p>
 * Ranges exclude null fields explicitly. Ordinal ranges become a membership over the labels the
 * range covers, so reversed bounds match nothing. Decimal values are stored as doubles.
 */
@Component
public class CriteriaTranslator implements PredicateVisitor<Criteria> {

    public Query toQuery(Predicate predicate) {
        Query query = new Query();
        toCriteria(predicate).ifPresent(query::addCriteria);
        return query;
    }

    /**
     * @return empty for a predicate that matches every document
     */
    public Optional<Criteria> toCriteria(Predicate predicate) {
        if (predicate instanceof And && ((And) predicate).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(predicate.accept(this));
    }

    @Override
    public Criteria visitEquals(Equals equals) {
        return Criteria.where(mongoField(equals.field())).is(toMongoValue(equals.value()));
    }

    @Override
    public Criteria visitIn(In in) {
        List<Object> values = new ArrayList<>();
        for (Object value : in.values()) {
            values.add(toMongoValue(value));
        }
        return Criteria.where(mongoField(in.field())).in(values);
    }

    @Override
    public Criteria visitRange(Range range) {
        Criteria criteria = Criteria.where(mongoField(range.field())).ne(null);
        if (range.lower() != null) {
            criteria = criteria.gte(toMongoValue(range.lower()));
        }
        if (range.upper() != null) {
            criteria = criteria.lte(toMongoValue(range.upper()));
        }
        return criteria;
    }

    @Override
    public Criteria visitOrdinalRange(OrdinalRange range) {
        List<String> labels = range.ordinal().labelsBetween(range.lower(), range.upper());
        return Criteria.where(mongoField(range.field())).in(new ArrayList<Object>(labels));
    }

    @Override
    public Criteria visitIsNull(IsNull isNull) {
        return Criteria.where(mongoField(isNull.field())).is(null);
    }

    @Override
    public Criteria visitAnd(And and) {
        return new Criteria().andOperator(translateAll(and.operands()));
    }

    @Override
    public Criteria visitOr(Or or) {
        return new Criteria().orOperator(translateAll(or.operands()));
    }

    static String mongoField(String column) {
        return "id".equals(column) ? "_id" : column;
    }

    static Object toMongoValue(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).doubleValue();
        }
        return value;
    }

    private List<Criteria> translateAll(List<Predicate> operands) {
        List<Criteria> criteria = new ArrayList<>();
        for (Predicate operand : operands) {
            criteria.add(operand.accept(this));
        }
        return criteria;
    }
}
