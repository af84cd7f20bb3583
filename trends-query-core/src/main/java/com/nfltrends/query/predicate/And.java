package com.nfltrends.query.predicate;

import java.util.List;

/**
 * Conjunction. An empty conjunction matches every row.
 */
public record And(List<Predicate> operands) implements Predicate {

    public And {
        operands = List.copyOf(operands);
    }

    public static And of(Predicate... operands) {
        return new And(List.of(operands));
    }

    public boolean isEmpty() {
        return operands.isEmpty();
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
