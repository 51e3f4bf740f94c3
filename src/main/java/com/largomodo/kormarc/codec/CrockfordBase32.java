package com.largomodo.kormarc.codec;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Crockford Base32 codec.
 * <p>
 * Alphabet {@code 0123456789ABCDEFGHJKMNPQRSTVWXYZ}: digits plus letters without
 * I, L, O and U. Each symbol carries 5 bits, most significant bit first. The alphabet is
 * in ascending ASCII order, so encoded strings of equal length sort like their bytes.
 * <p>
 * Encoding left-shifts and zero-pads the final partial group. Decoding is
 * case-insensitive, maps the look-alikes {@code i}/{@code l} to {@code 1} and
 * {@code o} to {@code 0}, ignores hyphens, and drops trailing bits that do not fill a
 * byte. Callers that know the expected byte length truncate the result themselves.
 * <p>
 * Pure static utility; safe for concurrent use.
 */
public final class CrockfordBase32 {

    public static final String ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ";

    private static final int[] DECODE = new int[128];

    static {
        Arrays.fill(DECODE, -1);
        for (int i = 0; i < ALPHABET.length(); i++) {
            char c = ALPHABET.charAt(i);
            DECODE[c] = i;
            DECODE[Character.toLowerCase(c)] = i;
        }
        DECODE['I'] = 1;
        DECODE['i'] = 1;
        DECODE['L'] = 1;
        DECODE['l'] = 1;
        DECODE['O'] = 0;
        DECODE['o'] = 0;
    }

    private CrockfordBase32() {
    }

    /**
     * Encode bytes to Base32 symbols.
     *
     * @param data bytes to encode
     * @return {@code ceil(8 * data.length / 5)} symbols
     */
    public static String encode(byte[] data) {
        StringBuilder out = new StringBuilder((data.length * 8 + 4) / 5);
        int buffer = 0;
        int bitsLeft = 0;

        for (byte b : data) {
            buffer = (buffer << 8) | (b & 0xFF);
            bitsLeft += 8;
            while (bitsLeft >= 5) {
                bitsLeft -= 5;
                out.append(ALPHABET.charAt((buffer >> bitsLeft) & 0x1F));
            }
            // Only the low bitsLeft bits are still needed
            buffer &= (1 << bitsLeft) - 1;
        }

        if (bitsLeft > 0) {
            out.append(ALPHABET.charAt((buffer << (5 - bitsLeft)) & 0x1F));
        }
        return out.toString();
    }

    /**
     * Decode Base32 symbols to bytes.
     *
     * @param encoded symbols, any case, hyphens allowed as separators
     * @return decoded bytes; trailing bits short of a full byte are discarded
     * @throws Base32DecodingException if a character is outside the alphabet
     */
    public static byte[] decode(String encoded) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(encoded.length() * 5 / 8);
        int buffer = 0;
        int bitsLeft = 0;

        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            if (c == '-') {
                continue;
            }
            int value = c < DECODE.length ? DECODE[c] : -1;
            if (value < 0) {
                throw new Base32DecodingException(c);
            }
            buffer = (buffer << 5) | value;
            bitsLeft += 5;
            if (bitsLeft >= 8) {
                bitsLeft -= 8;
                out.write((buffer >> bitsLeft) & 0xFF);
            }
            buffer &= (1 << bitsLeft) - 1;
        }
        return out.toByteArray();
    }
}
