package com.largomodo.kormarc.model;

/**
 * Leader position 05: record status.
 */
public enum RecordStatus {
    INCREASE_IN_ENCODING_LEVEL('a'),
    CORRECTED('c'),
    DELETED('d'),
    NEW('n'),
    INCREASE_FROM_PREPUBLICATION('p');

    private final char code;

    RecordStatus(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static RecordStatus fromCode(char code) {
        for (RecordStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new LeaderValidationException(
                "Invalid record_status '" + code + "'. Must be one of [a, c, d, n, p]");
    }
}
