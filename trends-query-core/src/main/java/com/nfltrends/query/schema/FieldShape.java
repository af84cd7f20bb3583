package com.nfltrends.query.schema;

/**
 * How a logical filter field arrives in a request.
 */
public enum FieldShape {

    /** A scalar or a list, optionally with a pair of range keys. */
    VALUES,

    /** A single boolean (or, with a null sentinel, the string {@code "None"}). */
    FLAG,

    /** {@code "None"} or {@code {exact, or_less, or_more}} over graded labels. */
    GRADED,

    /** {@code {exact, since_or_later, since_or_earlier}} over an ordered label table. */
    SINCE,

    /** {@code {games, match_mode}} over an array column. */
    GAMES_APPLICABLE
}
