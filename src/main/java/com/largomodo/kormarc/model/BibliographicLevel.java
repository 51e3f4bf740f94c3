package com.largomodo.kormarc.model;

/**
 * Leader position 07: bibliographic level.
 */
public enum BibliographicLevel {
    MONOGRAPHIC_COMPONENT_PART('a'),
    SERIAL_COMPONENT_PART('b'),
    COLLECTION('c'),
    SUBUNIT('d'),
    INTEGRATING_RESOURCE('i'),
    MONOGRAPH('m'),
    SERIAL('s');

    private final char code;

    BibliographicLevel(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static BibliographicLevel fromCode(char code) {
        for (BibliographicLevel level : values()) {
            if (level.code == code) {
                return level;
            }
        }
        throw new LeaderValidationException(
                "Invalid bibliographic_level '" + code + "'. Must be one of [a, b, c, d, i, m, s]");
    }
}
