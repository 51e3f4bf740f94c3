package com.largomodo.kormarc.validation;

import com.largomodo.kormarc.model.KormarcRecord;

/**
 * One tier of the record validation pipeline.
 * <p>
 * Implementations are pure: they never modify the record, never throw for a rule
 * violation, and return the same findings in the same order when run twice on the same
 * record. Rule violations are reported as data inside the {@link ValidationResult}.
 */
public interface RecordValidator {

    /**
     * @return tier number; batch runs select validators by this value
     */
    int tier();

    /**
     * @return name reported in {@link ValidationResult#validatorName()}
     */
    String name();

    /**
     * Validates one record.
     *
     * @param record record to check
     * @return findings of this tier
     */
    ValidationResult validate(KormarcRecord record);
}
