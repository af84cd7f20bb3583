package com.nfltrends.query.schema.domain;

import com.nfltrends.query.filter.FilterValidationException;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Free-form strings that must match a pattern. A matching value is trimmed, canonicalized and
 * then checked by an optional consistency rule that returns a violation message when the value
 * is well-formed but inconsistent.
 */
public class PatternDomain implements FieldDomain {

    private final String description;
    private final Pattern pattern;
    private final UnaryOperator<String> canonicalizer;
    private final Function<String, Optional<String>> rule;

    public PatternDomain(String description, Pattern pattern, UnaryOperator<String> canonicalizer,
                         Function<String, Optional<String>> rule) {
        this.description = description;
        this.pattern = pattern;
        this.canonicalizer = canonicalizer;
        this.rule = rule;
    }

    public static PatternDomain matching(String description, String regex) {
        return new PatternDomain(description, Pattern.compile(regex), UnaryOperator.identity(), value -> Optional.empty());
    }

    public PatternDomain upperCased() {
        return canonicalizedBy(value -> value.toUpperCase(Locale.ROOT));
    }

    public PatternDomain canonicalizedBy(UnaryOperator<String> operator) {
        return new PatternDomain(description, pattern, operator, rule);
    }

    public PatternDomain withRule(Function<String, Optional<String>> extraRule) {
        return new PatternDomain(description, pattern, canonicalizer, extraRule);
    }

    @Override
    public Object canonicalize(String field, Object raw) {
        if (!(raw instanceof String)) {
            throw reject(field, raw);
        }
        String value = ((String) raw).trim();
        if (!pattern.matcher(value).matches()) {
            throw reject(field, raw);
        }
        value = canonicalizer.apply(value);
        Optional<String> violation = rule.apply(value);
        if (violation.isPresent()) {
            throw new FilterValidationException(field,
                    "Invalid value for '" + field + "': " + violation.get(), describe());
        }
        return value;
    }

    @Override
    public String describe() {
        return description;
    }
}
