package com.largomodo.kormarc.validation;

import com.largomodo.kormarc.model.ControlField;
import com.largomodo.kormarc.model.KormarcConstants;
import com.largomodo.kormarc.model.KormarcRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Tier 1: record structure.
 * <p>
 * The leader is already checked when it is constructed, so this tier covers the
 * control fields: 001 must exist and 005, when present, must be a
 * {@code yyyyMMddHHmmss.f} timestamp.
 */
public class StructureValidator implements RecordValidator {

    public static final int TIER = 1;

    private static final Pattern LATEST_TRANSACTION = Pattern.compile("^\\d{14}\\.\\d$");

    @Override
    public int tier() {
        return TIER;
    }

    @Override
    public String name() {
        return "StructureValidator";
    }

    @Override
    public ValidationResult validate(KormarcRecord record) {
        List<ValidationError> errors = new ArrayList<>();

        if (!record.hasControlField(KormarcConstants.TAG_CONTROL_NUMBER)) {
            errors.add(ValidationError.error(KormarcConstants.TAG_CONTROL_NUMBER,
                    "Field 001 (control number) is required",
                    "Add a 001 control number field"));
        }

        Optional<ControlField> latest = record.controlField(KormarcConstants.TAG_LATEST_TRANSACTION);
        if (latest.isPresent() && !LATEST_TRANSACTION.matcher(latest.get().data()).matches()) {
            errors.add(ValidationError.error(KormarcConstants.TAG_LATEST_TRANSACTION,
                    "Field 005 must use the yyyyMMddHHmmss.f format",
                    "Current value: " + latest.get().data() + ", example: 20260111120000.0"));
        }

        return ValidationResult.of(TIER, name(), errors, List.of());
    }
}
