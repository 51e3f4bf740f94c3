package com.largomodo.kormarc.model;

/**
 * Thrown when a leader position holds a value outside its enumerated alphabet,
 * or when a leader string does not have exactly 24 positions.
 */
public class LeaderValidationException extends RecordValidationException {

    public LeaderValidationException(String message) {
        super(message);
    }

    public LeaderValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
