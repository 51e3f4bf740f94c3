package com.largomodo.kormarc.model;

/**
 * Leader position 06: type of record.
 */
public enum TypeOfRecord {
    LANGUAGE_MATERIAL('a'),
    NOTATED_MUSIC('c'),
    MANUSCRIPT_NOTATED_MUSIC('d'),
    CARTOGRAPHIC_MATERIAL('e'),
    MANUSCRIPT_CARTOGRAPHIC_MATERIAL('f'),
    PROJECTED_MEDIUM('g'),
    NONMUSICAL_SOUND_RECORDING('i'),
    MUSICAL_SOUND_RECORDING('j'),
    TWO_DIMENSIONAL_GRAPHIC('k'),
    COMPUTER_FILE('m'),
    KIT('o'),
    MIXED_MATERIALS('p'),
    THREE_DIMENSIONAL_ARTIFACT('r'),
    MANUSCRIPT_LANGUAGE_MATERIAL('t');

    private final char code;

    TypeOfRecord(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static TypeOfRecord fromCode(char code) {
        for (TypeOfRecord type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new LeaderValidationException(
                "Invalid type_of_record '" + code + "'. Must be one of [a, c, d, e, f, g, i, j, k, m, o, p, r, t]");
    }
}
