package com.nfltrends.query.schema.domain;

/**
 * JSON booleans. The lenient variant also accepts the strings {@code "true"} and
 * {@code "false"} in any case.
 */
public class BooleanDomain implements FieldDomain {

    public static final BooleanDomain STRICT = new BooleanDomain(false);
    public static final BooleanDomain LENIENT = new BooleanDomain(true);

    private final boolean acceptStrings;

    private BooleanDomain(boolean acceptStrings) {
        this.acceptStrings = acceptStrings;
    }

    @Override
    public Object canonicalize(String field, Object raw) {
        if (raw instanceof Boolean) {
            return raw;
        }
        if (acceptStrings && raw instanceof String) {
            String value = ((String) raw).trim();
            if ("true".equalsIgnoreCase(value)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(value)) {
                return Boolean.FALSE;
            }
        }
        throw reject(field, raw);
    }

    @Override
    public String describe() {
        return acceptStrings ? "true or false" : "boolean";
    }
}
