package com.largomodo.kormarc.util;

import java.util.regex.Pattern;

/**
 * ISBN normalization and check digit verification.
 * <p>
 * Pure functions with no state. Safe for concurrent use.
 */
public class IsbnUtil {

    private static final Pattern ISBN10 = Pattern.compile("^\\d{9}[\\dXx]$");
    private static final Pattern ISBN13 = Pattern.compile("^\\d{13}$");

    private IsbnUtil() {
    }

    /**
     * Remove hyphens and spaces: {@code "978-89-6848-160-7"} becomes {@code "9788968481607"}.
     */
    public static String normalize(String isbn) {
        if (isbn == null) {
            return "";
        }
        return isbn.replace("-", "").replace(" ", "");
    }

    /**
     * @return true if the value is non-empty and consists of ASCII digits only
     */
    public static boolean isDigits(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * ISBN-10: nine digits plus a check character (digit or X), weights 10 down to 1,
     * sum divisible by 11.
     */
    public static boolean isValidIsbn10(String isbn) {
        if (isbn == null || !ISBN10.matcher(isbn).matches()) {
            return false;
        }
        int total = 0;
        for (int i = 0; i < 9; i++) {
            total += (isbn.charAt(i) - '0') * (10 - i);
        }
        int checksum = (11 - (total % 11)) % 11;
        char check = Character.toUpperCase(isbn.charAt(9));
        return checksum == 10 ? check == 'X' : check == (char) ('0' + checksum);
    }

    /**
     * ISBN-13: thirteen digits, alternating weights 1 and 3, sum divisible by 10.
     */
    public static boolean isValidIsbn13(String isbn) {
        if (isbn == null || !ISBN13.matcher(isbn).matches()) {
            return false;
        }
        int total = 0;
        for (int i = 0; i < 12; i++) {
            total += (isbn.charAt(i) - '0') * (i % 2 == 0 ? 1 : 3);
        }
        int checksum = (10 - (total % 10)) % 10;
        return checksum == isbn.charAt(12) - '0';
    }

    /**
     * Normalize and validate as ISBN-10 or ISBN-13 by length.
     */
    public static boolean isValid(String isbn) {
        String normalized = normalize(isbn);
        return switch (normalized.length()) {
            case 10 -> isValidIsbn10(normalized);
            case 13 -> isValidIsbn13(normalized);
            default -> false;
        };
    }
}
