package com.largomodo.kormarc.validation;

/**
 * Severity of a validation finding.
 */
public enum Severity {
    ERROR,
    WARNING
}
