package com.largomodo.kormarc.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Control field (tags 001-009): coded data that is not divided into subfields.
 *
 * @param tag  three-digit tag in the control range
 * @param data field content, kept verbatim
 */
public record ControlField(String tag, String data) {

    private static final Pattern TAG = Pattern.compile(KormarcConstants.CONTROL_TAG_PATTERN);

    public ControlField {
        Objects.requireNonNull(data, "data must not be null");
        if (tag == null || !TAG.matcher(tag).matches()) {
            throw new RecordValidationException("Control field tag must match 001-009, got: '" + tag + "'");
        }
    }
}
