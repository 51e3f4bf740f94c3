package com.largomodo.kormarc.parser;

/**
 * How forgiving the parser is about field lines that do not follow the grammar.
 */
public enum ParseMode {
    /**
     * Skip lines without content and read delimiter-less data field content as an
     * implicit subfield {@code a}. Suited to scraped input.
     */
    LENIENT,
    /**
     * Reject both of the above with a {@link FieldParseException}.
     */
    STRICT
}
