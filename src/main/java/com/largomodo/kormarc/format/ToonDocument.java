package com.largomodo.kormarc.format;

import com.largomodo.kormarc.model.DataField;
import com.largomodo.kormarc.model.KormarcRecord;
import com.largomodo.kormarc.model.Subfield;
import com.largomodo.kormarc.toon.ToonId;
import com.largomodo.kormarc.util.IsbnUtil;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Stored form of a record: the record under its TOON identifier, with the values
 * storage indexes on pulled out.
 *
 * @param toonId     canonical TOON identifier
 * @param timestamp  creation instant encoded in the identifier
 * @param type       identifier type prefix
 * @param isbn       normalized ISBN, or empty when the record carries none
 * @param rawKormarc record in line grammar
 * @param parsed     the record itself
 */
public record ToonDocument(String toonId, Instant timestamp, String type, String isbn,
                           String rawKormarc, KormarcRecord parsed) {

    private static final Set<String> ISBN_TAGS = Set.of("020", "024");

    public ToonDocument {
        Objects.requireNonNull(toonId, "toonId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(isbn, "isbn must not be null");
        Objects.requireNonNull(rawKormarc, "rawKormarc must not be null");
        Objects.requireNonNull(parsed, "parsed must not be null");
    }

    public static ToonDocument of(ToonId id, KormarcRecord record) {
        return new ToonDocument(id.value(), id.createdAt(), id.type(), extractIsbn(record),
                new RecordTextWriter().write(record), record);
    }

    /**
     * First subfield {@code a} of a 020 or 024 field that is all digits once hyphens and
     * spaces are removed.
     *
     * @return normalized ISBN, or an empty string
     */
    public static String extractIsbn(KormarcRecord record) {
        for (DataField field : record.dataFields()) {
            if (!ISBN_TAGS.contains(field.tag())) {
                continue;
            }
            for (Subfield subfield : field.subfields()) {
                if (subfield.code() == 'a') {
                    String isbn = IsbnUtil.normalize(subfield.data());
                    if (IsbnUtil.isDigits(isbn)) {
                        return isbn;
                    }
                }
            }
        }
        return "";
    }
}
