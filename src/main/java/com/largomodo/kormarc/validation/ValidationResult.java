package com.largomodo.kormarc.validation;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one validator run against one record.
 * <p>
 * Errors and warnings keep the order in which rules were evaluated. Both lists are
 * immutable copies.
 *
 * @param tier          validator tier (1 structural, 2 semantic, 3 institution policy, 0 pre-build input checks)
 * @param validatorName name of the validator that produced the result
 * @param passed        true when no errors were reported
 * @param errors        rule violations
 * @param warnings      advisory findings
 */
public record ValidationResult(int tier, String validatorName, boolean passed,
                               List<ValidationError> errors, List<ValidationWarning> warnings) {

    public ValidationResult {
        Objects.requireNonNull(validatorName, "validatorName must not be null");
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Result whose {@code passed} flag is derived from the error list.
     */
    public static ValidationResult of(int tier, String validatorName,
                                      List<ValidationError> errors, List<ValidationWarning> warnings) {
        return new ValidationResult(tier, validatorName, errors.isEmpty(), errors, warnings);
    }
}
