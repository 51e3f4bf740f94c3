package com.largomodo.kormarc.validation;

import java.util.Objects;

/**
 * Advisory finding. Warnings never fail a record.
 *
 * @param fieldTag   tag the finding refers to, or {@code null}
 * @param message    human-readable description
 * @param suggestion remediation hint, or {@code null}
 */
public record ValidationWarning(String fieldTag, String message, String suggestion) {

    public ValidationWarning {
        Objects.requireNonNull(message, "message must not be null");
    }
}
