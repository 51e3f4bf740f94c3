package com.largomodo.kormarc.model;

import java.util.Objects;

/**
 * A single coded datum inside a data field.
 *
 * @param code one-character subfield code (e.g. {@code a}, {@code b}, {@code c})
 * @param data subfield content, possibly empty
 */
public record Subfield(char code, String data) {

    public Subfield {
        Objects.requireNonNull(data, "data must not be null");
    }

    /**
     * String-typed factory used by reconstruction paths, where the code arrives as text.
     *
     * @throws RecordValidationException if the code is not exactly one character
     */
    public static Subfield of(String code, String data) {
        if (code == null || code.length() != 1) {
            throw new RecordValidationException("Subfield code must be exactly 1 character, got: '" + code + "'");
        }
        return new Subfield(code.charAt(0), data);
    }
}
