package com.nfltrends.query.filter;

/**
 * One validated filter field. Each shape a request field can take (list, range, flag, grouped
 * list-or-range, applicable games) has its own variant, decoded once by {@link FilterNormalizer}.
 */
public interface FieldFilter {

    /**
     * Order-stable, JSON-serializable form used for fingerprinting.
     */
    Object canonical();
}
