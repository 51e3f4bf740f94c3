package com.largomodo.kormarc.parser;

/**
 * Thrown when the first line of a record is not a valid leader.
 * Carries the literal length found so callers can tell a length mismatch from a bad value.
 */
public class LeaderParseException extends RecordParseException {

    private final int foundLength;

    public LeaderParseException(String message, int foundLength, Throwable cause) {
        super(message, cause);
        this.foundLength = foundLength;
    }

    public int getFoundLength() {
        return foundLength;
    }
}
