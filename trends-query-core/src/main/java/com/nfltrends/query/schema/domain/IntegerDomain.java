package com.nfltrends.query.schema.domain;

import java.math.BigInteger;

/**
 * Whole numbers within inclusive bounds, optionally restricted to a grid
 * {@code min, min + step, ...}. Booleans and fractional numbers are rejected.
 */
public class IntegerDomain implements FieldDomain {

    private final int min;
    private final int max;
    private final int step;

    public IntegerDomain(int min, int max, int step) {
        if (step < 1) {
            throw new IllegalArgumentException("step must be positive");
        }
        this.min = min;
        this.max = max;
        this.step = step;
    }

    public static IntegerDomain between(int min, int max) {
        return new IntegerDomain(min, max, 1);
    }

    public static IntegerDomain atLeast(int min) {
        return new IntegerDomain(min, Integer.MAX_VALUE, 1);
    }

    @Override
    public Object canonicalize(String field, Object raw) {
        if (!(raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof BigInteger)) {
            throw reject(field, raw);
        }
        long value;
        try {
            value = raw instanceof BigInteger ? ((BigInteger) raw).longValueExact() : ((Number) raw).longValue();
        } catch (ArithmeticException e) {
            throw reject(field, raw);
        }
        if (value < min || value > max || (value - min) % step != 0) {
            throw reject(field, raw);
        }
        return (int) value;
    }

    @Override
    public String describe() {
        String bounds = max == Integer.MAX_VALUE ? "integer >= " + min : "integer between " + min + " and " + max;
        return step == 1 ? bounds : bounds + " in steps of " + step;
    }
}
