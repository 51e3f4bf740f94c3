package com.largomodo.kormarc.parser;

/**
 * Thrown when a field line cannot be turned into a control or data field.
 */
public class FieldParseException extends RecordParseException {

    private final String tag;

    public FieldParseException(String message, String tag) {
        super(message);
        this.tag = tag;
    }

    public FieldParseException(String message, String tag, Throwable cause) {
        super(message, cause);
        this.tag = tag;
    }

    /**
     * @return the tag token exactly as it appeared on the offending line
     */
    public String getTag() {
        return tag;
    }
}
