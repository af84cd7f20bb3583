package com.nfltrends.query.filter;

public record FlagValue(boolean value) implements FieldFilter {

    @Override
    public Object canonical() {
        return value;
    }
}
