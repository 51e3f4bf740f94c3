package com.largomodo.kormarc.format;

import java.io.IOException;

/**
 * Thrown when a serialized record cannot be mapped back into the record model,
 * or a record cannot be rendered in the requested format.
 */
public class RecordConversionException extends IOException {

    public RecordConversionException(String message) {
        super(message);
    }

    public RecordConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
