package com.nfltrends.query.compile;

import com.nfltrends.query.filter.FilterNormalizer;
import com.nfltrends.query.filter.NormalizedQuery;
import com.nfltrends.query.schema.FilterSchema;

import java.util.Map;

/**
 * Validates and compiles a request body in one step. Validation completes before anything is
 * compiled, so invalid input never reaches a store or a cache.
 */
public class QueryCompiler {

    private final FilterNormalizer normalizer;
    private final PredicateCompiler predicateCompiler;

    public QueryCompiler(FilterNormalizer normalizer, PredicateCompiler predicateCompiler) {
        this.normalizer = normalizer;
        this.predicateCompiler = predicateCompiler;
    }

    public QueryCompiler() {
        this(new FilterNormalizer(), new PredicateCompiler());
    }

    public CompiledQuery compile(FilterSchema schema, Map<String, ?> body) {
        return compile(schema, normalizer.normalize(schema, body));
    }

    public CompiledQuery compile(FilterSchema schema, NormalizedQuery query) {
        if (!schema.kind().equals(query.kind())) {
            throw new IllegalArgumentException("Query of kind " + query.kind() + " compiled against " + schema);
        }
        return new CompiledQuery(query, predicateCompiler.compile(schema, query.filter()));
    }

    public NormalizedQuery normalize(FilterSchema schema, Map<String, ?> body) {
        return normalizer.normalize(schema, body);
    }
}
