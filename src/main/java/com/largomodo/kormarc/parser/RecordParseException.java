package com.largomodo.kormarc.parser;

import java.io.IOException;

/**
 * Thrown when record text cannot be parsed.
 * <p>
 * Always fatal to the single parse call; callers processing many records catch it
 * and skip the whole record.
 */
public class RecordParseException extends IOException {

    public RecordParseException(String message) {
        super(message);
    }

    public RecordParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
