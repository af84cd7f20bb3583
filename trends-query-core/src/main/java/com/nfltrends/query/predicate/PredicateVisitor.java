package com.nfltrends.query.predicate;

/**
 * Visitor over the closed set of predicate node types. Store adapters implement this to
 * translate a compiled predicate into their native query language.
 */
public interface PredicateVisitor<R> {

    R visitEquals(Equals equals);

    R visitIn(In in);

    R visitRange(Range range);

    R visitOrdinalRange(OrdinalRange range);

    R visitIsNull(IsNull isNull);

    R visitAnd(And and);

    R visitOr(Or or);
}
