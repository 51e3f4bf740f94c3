package com.largomodo.kormarc.model;

/**
 * Thrown when a record component is constructed with a value outside its allowed range.
 * <p>
 * Unchecked: construction-time rejection is a programming or data error that should
 * surface immediately rather than be coerced.
 */
public class RecordValidationException extends IllegalArgumentException {

    public RecordValidationException(String message) {
        super(message);
    }

    public RecordValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
