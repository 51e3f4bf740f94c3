package com.largomodo.kormarc.validation;

import java.util.Objects;

/**
 * Rule violation that fails the validator reporting it.
 *
 * @param severity   severity of the finding
 * @param fieldTag   tag the finding refers to, or {@code null} for record-level findings
 * @param message    human-readable description
 * @param suggestion remediation hint, or {@code null}
 */
public record ValidationError(Severity severity, String fieldTag, String message, String suggestion) {

    public ValidationError {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ValidationError error(String fieldTag, String message, String suggestion) {
        return new ValidationError(Severity.ERROR, fieldTag, message, suggestion);
    }
}
