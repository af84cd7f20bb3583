package com.nfltrends.query.compile;

/**
 * Internal invariant violation while compiling a validated filter. Never caused by client input.
 */
public class PredicateCompilationException extends IllegalStateException {

    public PredicateCompilationException(String message) {
        super(message);
    }
}
