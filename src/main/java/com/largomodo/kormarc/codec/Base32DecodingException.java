package com.largomodo.kormarc.codec;

/**
 * Thrown when Base32 input contains a character outside the alphabet.
 */
public class Base32DecodingException extends IllegalArgumentException {

    private final char invalidCharacter;

    public Base32DecodingException(char invalidCharacter) {
        super("Invalid Base32 character: '" + invalidCharacter + "'");
        this.invalidCharacter = invalidCharacter;
    }

    public char getInvalidCharacter() {
        return invalidCharacter;
    }
}
