package com.largomodo.kormarc.model;

/**
 * Shared constants for KORMARC record structure.
 * Centralizes magic numbers and tag patterns used by the model, parser and validators.
 */
public class KormarcConstants {

    /**
     * Leader is always 24 positions.
     */
    public static final int LEADER_LENGTH = 24;

    public static final String CONTROL_TAG_PATTERN = "^00[1-9]$";
    public static final String DATA_TAG_PATTERN = "^(0[1-9][0-9]|[1-9][0-9]{2})$";

    public static final char BLANK_INDICATOR = ' ';
    public static final char DEFAULT_SUBFIELD_DELIMITER = '|';
    public static final char IMPLICIT_SUBFIELD_CODE = 'a';

    public static final String TAG_CONTROL_NUMBER = "001";
    public static final String TAG_LATEST_TRANSACTION = "005";
    public static final String TAG_FIXED_LENGTH_DATA = "008";
    public static final String TAG_CATALOGING_SOURCE = "040";

    private KormarcConstants() {
    }
}
