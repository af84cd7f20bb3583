package com.nfltrends.query.schema.domain;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Numbers within inclusive bounds. With a step the value must sit exactly on the grid
 * anchored at zero (e.g. half points); nothing is rounded. Values are returned as
 * {@link BigDecimal}: stepped values with one decimal place, free values with trailing zeros
 * stripped so that {@code 75} and {@code 75.0} canonicalize identically.
 */
public class DecimalDomain implements FieldDomain {

    private final BigDecimal min;
    private final BigDecimal max;
    private final BigDecimal step;

    public DecimalDomain(BigDecimal min, BigDecimal max, BigDecimal step) {
        this.min = min;
        this.max = max;
        this.step = step;
    }

    public static DecimalDomain halfPoints(String min, String max) {
        return new DecimalDomain(new BigDecimal(min), new BigDecimal(max), new BigDecimal("0.5"));
    }

    public static DecimalDomain between(String min, String max) {
        return new DecimalDomain(new BigDecimal(min), new BigDecimal(max), null);
    }

    @Override
    public Object canonicalize(String field, Object raw) {
        BigDecimal value = toDecimal(raw);
        if (value == null || value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            throw reject(field, raw);
        }
        if (step != null) {
            if (value.remainder(step).signum() != 0) {
                throw reject(field, raw);
            }
            return value.setScale(1);
        }
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    @Override
    public String describe() {
        String bounds = "number between " + min + " and " + max;
        return step == null ? bounds : bounds + " in steps of " + step;
    }

    private static BigDecimal toDecimal(Object raw) {
        if (raw instanceof BigDecimal) {
            return (BigDecimal) raw;
        }
        if (raw instanceof BigInteger) {
            return new BigDecimal((BigInteger) raw);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            return BigDecimal.valueOf(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return new BigDecimal(raw.toString());
        }
        return null;
    }
}
