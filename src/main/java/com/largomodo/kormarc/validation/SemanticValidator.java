package com.largomodo.kormarc.validation;

import com.largomodo.kormarc.model.DataField;
import com.largomodo.kormarc.model.KormarcConstants;
import com.largomodo.kormarc.model.KormarcRecord;
import com.largomodo.kormarc.model.TypeOfRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tier 2: required fields and field relationships.
 * <p>
 * Rules, in evaluation order:
 * <ol>
 *   <li>001, 245 and 260 must be present (error per missing tag)</li>
 *   <li>a language-material record without 100 gets a warning</li>
 *   <li>the first 260 must carry subfield {@code c} (error)</li>
 *   <li>a record with 100 must also have 245 (error, reported against 100)</li>
 * </ol>
 * The cataloging source (040) is left to {@link InstitutionPolicyValidator}.
 */
public class SemanticValidator implements RecordValidator {

    public static final int TIER = 2;

    private static final String TAG_MAIN_ENTRY = "100";
    private static final String TAG_TITLE = "245";
    private static final String TAG_PUBLICATION = "260";

    private static final Map<String, String> REQUIRED_FIELDS = new LinkedHashMap<>();

    static {
        REQUIRED_FIELDS.put(KormarcConstants.TAG_CONTROL_NUMBER, "control number");
        REQUIRED_FIELDS.put(TAG_TITLE, "title statement");
        REQUIRED_FIELDS.put(TAG_PUBLICATION, "publication");
    }

    @Override
    public int tier() {
        return TIER;
    }

    @Override
    public String name() {
        return "SemanticValidator";
    }

    @Override
    public ValidationResult validate(KormarcRecord record) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        checkRequiredFields(record, errors);
        checkRecommendedFields(record, warnings);
        checkRelationships(record, errors);

        return ValidationResult.of(TIER, name(), errors, warnings);
    }

    private void checkRequiredFields(KormarcRecord record, List<ValidationError> errors) {
        for (Map.Entry<String, String> required : REQUIRED_FIELDS.entrySet()) {
            String tag = required.getKey();
            boolean present = tag.startsWith("00") ? record.hasControlField(tag) : record.hasDataField(tag);
            if (!present) {
                errors.add(ValidationError.error(tag,
                        "Missing required field: " + required.getValue() + " (" + tag + ")",
                        "Add a " + tag + " field"));
            }
        }
    }

    private void checkRecommendedFields(KormarcRecord record, List<ValidationWarning> warnings) {
        if (record.leader().typeOfRecord() == TypeOfRecord.LANGUAGE_MATERIAL
                && !record.hasDataField(TAG_MAIN_ENTRY)) {
            warnings.add(new ValidationWarning(TAG_MAIN_ENTRY,
                    "Missing recommended field: book records should carry a main entry (100)",
                    "Consider adding a 100 field"));
        }
    }

    private void checkRelationships(KormarcRecord record, List<ValidationError> errors) {
        Optional<DataField> publication = record.dataField(TAG_PUBLICATION);
        if (publication.isPresent() && !publication.get().hasSubfield('c')) {
            errors.add(ValidationError.error(TAG_PUBLICATION,
                    "Field 260 (publication) requires a date of publication ($c)",
                    "Add subfield $c to field 260"));
        }

        if (record.hasDataField(TAG_MAIN_ENTRY) && !record.hasDataField(TAG_TITLE)) {
            errors.add(ValidationError.error(TAG_MAIN_ENTRY,
                    "Field 100 (main entry) requires a title statement (245)",
                    "Add a 245 field"));
        }
    }
}
