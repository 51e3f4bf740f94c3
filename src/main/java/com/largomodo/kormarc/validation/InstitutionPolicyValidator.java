package com.largomodo.kormarc.validation;

import com.largomodo.kormarc.model.DataField;
import com.largomodo.kormarc.model.KormarcRecord;
import com.largomodo.kormarc.model.Subfield;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tier 3: institution cataloging policy.
 * <p>
 * The policy's required field (040 by default) must exist; without it no further check
 * is possible. Each required subfield missing from it is an error. An institution code
 * outside the policy's allow-list is only a warning, so records catalogued by other
 * agencies still pass.
 */
public class InstitutionPolicyValidator implements RecordValidator {

    public static final int TIER = 3;

    private final InstitutionPolicy policy;

    public InstitutionPolicyValidator() {
        this(InstitutionPolicy.defaultPolicy());
    }

    public InstitutionPolicyValidator(InstitutionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public InstitutionPolicy getPolicy() {
        return policy;
    }

    @Override
    public int tier() {
        return TIER;
    }

    @Override
    public String name() {
        return "InstitutionPolicyValidator";
    }

    @Override
    public ValidationResult validate(KormarcRecord record) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        String tag = policy.requiredTag();

        Optional<DataField> source = record.dataField(tag);
        if (source.isEmpty()) {
            errors.add(ValidationError.error(tag,
                    "Field " + tag + " (cataloging source) is required",
                    "Add a " + tag + " field"));
            return ValidationResult.of(TIER, name(), errors, warnings);
        }

        DataField field = source.get();
        for (char code : policy.requiredSubfields()) {
            if (!field.hasSubfield(code)) {
                errors.add(ValidationError.error(tag,
                        "Field " + tag + " requires subfield $" + code,
                        "Add subfield $" + code + " to field " + tag));
            }
        }

        Optional<Subfield> institution = field.subfield(policy.institutionSubfield());
        if (institution.isPresent() && !policy.isKnownInstitution(institution.get().data())) {
            warnings.add(new ValidationWarning(tag,
                    "Unknown institution code: " + institution.get().data(),
                    "Use one of the known institution codes: " + String.join(", ", policy.institutionCodes())));
        }

        return ValidationResult.of(TIER, name(), errors, warnings);
    }
}
