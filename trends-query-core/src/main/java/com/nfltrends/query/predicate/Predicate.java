package com.nfltrends.query.predicate;

/**
 * A compiled, store-independent condition over one or more record columns.
 * <p>
 * Implementations are immutable records with structural equality, so compiling the same
 * filter twice yields equal trees.
 */
public interface Predicate {

    <R> R accept(PredicateVisitor<R> visitor);
}
