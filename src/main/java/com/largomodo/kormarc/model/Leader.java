package com.largomodo.kormarc.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable KORMARC leader: the 24-position fixed field describing record structure.
 * <p>
 * Layout (0-based positions):
 * <ul>
 *   <li>00-04 record length (zero-padded)</li>
 *   <li>05 record status, 06 type of record, 07 bibliographic level</li>
 *   <li>08 control type, 09 character encoding</li>
 *   <li>10 indicator count, 11 subfield code count</li>
 *   <li>12-16 base address of data (zero-padded)</li>
 *   <li>17 encoding level, 18 descriptive cataloging form, 19 multipart level</li>
 *   <li>20-23 entry map</li>
 * </ul>
 * {@link #toString()} always yields exactly 24 characters and
 * {@code Leader.fromString(leader.toString()).equals(leader)} holds for every instance.
 */
public record Leader(
        int recordLength,
        RecordStatus recordStatus,
        TypeOfRecord typeOfRecord,
        BibliographicLevel bibliographicLevel,
        char controlType,
        char characterEncoding,
        int indicatorCount,
        int subfieldCodeCount,
        int baseAddress,
        char encodingLevel,
        char descriptiveCataloging,
        char multipartLevel,
        String entryMap
) {

    private static final int MAX_FIVE_DIGITS = 99_999;

    public Leader {
        Objects.requireNonNull(recordStatus, "recordStatus must not be null");
        Objects.requireNonNull(typeOfRecord, "typeOfRecord must not be null");
        Objects.requireNonNull(bibliographicLevel, "bibliographicLevel must not be null");
        Objects.requireNonNull(entryMap, "entryMap must not be null");
        requireRange("record_length", recordLength, MAX_FIVE_DIGITS);
        requireRange("base_address", baseAddress, MAX_FIVE_DIGITS);
        requireRange("indicator_count", indicatorCount, 9);
        requireRange("subfield_code_count", subfieldCodeCount, 9);
        if (entryMap.length() != 4) {
            throw new LeaderValidationException(
                    "entry_map must be exactly 4 characters, got '" + entryMap + "'");
        }
    }

    /**
     * Leader with the defaults a newly catalogued monograph carries: blank control type,
     * encoding level, descriptive cataloging and multipart level, 2 indicators,
     * 2 subfield code positions and entry map {@code 4500}.
     */
    public static Leader of(int recordLength, RecordStatus status, TypeOfRecord type,
                            BibliographicLevel level, char characterEncoding, int baseAddress) {
        return new Leader(recordLength, status, type, level, ' ', characterEncoding,
                2, 2, baseAddress, ' ', ' ', ' ', "4500");
    }

    /**
     * Parse a leader from its 24-character positional form.
     *
     * @param leader positional leader string
     * @return leader instance
     * @throws LeaderValidationException if the string is not exactly 24 characters long
     *                                   or a position holds an invalid value
     */
    public static Leader fromString(String leader) {
        if (leader == null) {
            throw new LeaderValidationException("Leader must not be null");
        }
        if (leader.length() != KormarcConstants.LEADER_LENGTH) {
            throw new LeaderValidationException(
                    "Leader must be exactly " + KormarcConstants.LEADER_LENGTH + " characters, got "
                            + leader.length() + " characters");
        }
        return new Leader(
                digits(leader, 0, 5, "record_length"),
                RecordStatus.fromCode(leader.charAt(5)),
                TypeOfRecord.fromCode(leader.charAt(6)),
                BibliographicLevel.fromCode(leader.charAt(7)),
                leader.charAt(8),
                leader.charAt(9),
                digits(leader, 10, 11, "indicator_count"),
                digits(leader, 11, 12, "subfield_code_count"),
                digits(leader, 12, 17, "base_address"),
                leader.charAt(17),
                leader.charAt(18),
                leader.charAt(19),
                leader.substring(20, 24)
        );
    }

    /**
     * @return the 24-character positional form
     */
    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%05d", recordLength)
                + recordStatus.code()
                + typeOfRecord.code()
                + bibliographicLevel.code()
                + controlType
                + characterEncoding
                + indicatorCount
                + subfieldCodeCount
                + String.format(Locale.ROOT, "%05d", baseAddress)
                + encodingLevel
                + descriptiveCataloging
                + multipartLevel
                + entryMap;
    }

    private static void requireRange(String name, int value, int max) {
        if (value < 0 || value > max) {
            throw new LeaderValidationException(name + " must be between 0 and " + max + ", got: " + value);
        }
    }

    private static int digits(String leader, int start, int end, String name) {
        String value = leader.substring(start, end);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                throw new LeaderValidationException(
                        "Invalid " + name + " '" + value + "' at positions " + start + "-" + (end - 1)
                                + ": digits required");
            }
        }
        return Integer.parseInt(value);
    }
}
