package com.largomodo.kormarc.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Data field (tags 010-999): two indicators followed by an ordered list of subfields.
 * <p>
 * A blank indicator is the literal space character. Subfield order is significant and
 * preserved; the list is copied defensively and cannot be modified.
 *
 * @param tag        three-digit tag in the data range
 * @param indicator1 first indicator
 * @param indicator2 second indicator
 * @param subfields  ordered subfields
 */
public record DataField(String tag, char indicator1, char indicator2, List<Subfield> subfields) {

    private static final Pattern TAG = Pattern.compile(KormarcConstants.DATA_TAG_PATTERN);

    public DataField {
        if (tag == null || !TAG.matcher(tag).matches()) {
            throw new RecordValidationException("Data field tag must match 010-999, got: '" + tag + "'");
        }
        Objects.requireNonNull(subfields, "subfields must not be null");
        subfields = List.copyOf(subfields);
    }

    /**
     * First subfield carrying the given code, if any.
     */
    public Optional<Subfield> subfield(char code) {
        return subfields.stream().filter(s -> s.code() == code).findFirst();
    }

    public boolean hasSubfield(char code) {
        return subfields.stream().anyMatch(s -> s.code() == code);
    }
}
