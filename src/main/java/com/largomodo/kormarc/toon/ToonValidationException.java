package com.largomodo.kormarc.toon;

/**
 * Thrown when a TOON identifier or one of its generation inputs is malformed.
 */
public class ToonValidationException extends IllegalArgumentException {

    public ToonValidationException(String message) {
        super(message);
    }

    public ToonValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
