package com.largomodo.kormarc.builder;

import java.util.Optional;

/**
 * Main classes of the Korean Decimal Classification (first digit of a KDC number).
 * The label is the Korean subject heading written to field 650.
 */
public enum KdcMainClass {
    GENERALITIES('0', "총류"),
    PHILOSOPHY('1', "철학"),
    RELIGION('2', "종교"),
    SOCIAL_SCIENCES('3', "사회과학"),
    NATURAL_SCIENCES('4', "자연과학"),
    TECHNOLOGY('5', "기술과학"),
    ARTS('6', "예술"),
    LANGUAGE('7', "언어"),
    LITERATURE('8', "문학"),
    HISTORY('9', "역사");

    private final char digit;
    private final String label;

    KdcMainClass(char digit, String label) {
        this.digit = digit;
        this.label = label;
    }

    /**
     * Main class of a KDC number, taken from its first character.
     */
    public static Optional<KdcMainClass> fromKdc(String kdc) {
        if (kdc == null || kdc.isEmpty()) {
            return Optional.empty();
        }
        char first = kdc.charAt(0);
        for (KdcMainClass mainClass : values()) {
            if (mainClass.digit == first) {
                return Optional.of(mainClass);
            }
        }
        return Optional.empty();
    }

    public char getDigit() {
        return digit;
    }

    public String getLabel() {
        return label;
    }
}
