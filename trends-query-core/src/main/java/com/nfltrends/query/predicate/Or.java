package com.nfltrends.query.predicate;

import java.util.List;

/**
 * Disjunction over at least one operand.
 */
public record Or(List<Predicate> operands) implements Predicate {

    public Or {
        operands = List.copyOf(operands);
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("Disjunction needs at least one operand");
        }
    }

    public static Or of(Predicate... operands) {
        return new Or(List.of(operands));
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
