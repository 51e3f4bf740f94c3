package com.largomodo.kormarc.codec;

import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CrockfordBase32Test {

    private static byte[] bytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    @Test
    void testKnownVectors() {
        assertEquals("04HMASW9NC", CrockfordBase32.encode(bytes(0x01, 0x23, 0x45, 0x67, 0x89, 0xAB)));
        assertEquals("00000000", CrockfordBase32.encode(new byte[5]));
        assertEquals("ZZZZZZZZ", CrockfordBase32.encode(bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF)));
        assertEquals("CR", CrockfordBase32.encode("f".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("CSQPYRK1E8", CrockfordBase32.encode("foobar".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("91JPRV3F", CrockfordBase32.encode("Hello".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void testEmptyInput() {
        assertEquals("", CrockfordBase32.encode(new byte[0]));
        assertArrayEquals(new byte[0], CrockfordBase32.decode(""));
    }

    @Test
    void testDecodeKnownVectors() {
        assertArrayEquals("foobar".getBytes(StandardCharsets.US_ASCII), CrockfordBase32.decode("CSQPYRK1E8"));
        assertArrayEquals("Hello".getBytes(StandardCharsets.US_ASCII), CrockfordBase32.decode("91JPRV3F"));
    }

    @Test
    void testDecodeIsCaseInsensitive() {
        assertArrayEquals(CrockfordBase32.decode("CSQPYRK1E8"), CrockfordBase32.decode("csqpyrk1e8"));
    }

    @Test
    void testDecodeMapsLookAlikes() {
        assertArrayEquals(CrockfordBase32.decode("01"), CrockfordBase32.decode("OI"));
        assertArrayEquals(CrockfordBase32.decode("01"), CrockfordBase32.decode("ol"));
        assertArrayEquals(CrockfordBase32.decode("0111"), CrockfordBase32.decode("OIiL"));
    }

    @Test
    void testDecodeIgnoresHyphens() {
        assertArrayEquals(CrockfordBase32.decode("91JPRV3F"), CrockfordBase32.decode("91JP-RV3F"));
    }

    @Test
    void testDecodeRejectsCharactersOutsideAlphabet() {
        Base32DecodingException u = assertThrows(Base32DecodingException.class, () -> CrockfordBase32.decode("ABCU"));
        assertEquals('U', u.getInvalidCharacter());

        assertThrows(Base32DecodingException.class, () -> CrockfordBase32.decode("AB*C"));
        assertThrows(Base32DecodingException.class, () -> CrockfordBase32.decode("가나"));
    }

    @Test
    void testDecodeDropsIncompleteTrailingBits() {
        // 10 symbols = 50 bits = 6 full bytes, 2 bits dropped
        assertEquals(6, CrockfordBase32.decode("04HMASW9NC").length);
        assertArrayEquals(bytes(0x01, 0x23, 0x45, 0x67, 0x89, 0xAB), CrockfordBase32.decode("04HMASW9NC"));
    }

    @Test
    void testEncodedLength() {
        for (int n = 0; n <= 20; n++) {
            assertEquals((n * 8 + 4) / 5, CrockfordBase32.encode(new byte[n]).length());
        }
    }

    @Property
    void decodeInvertsEncode(@ForAll("groupAligned") byte[] data) {
        assertArrayEquals(data, CrockfordBase32.decode(CrockfordBase32.encode(data)));
    }

    @Property
    void encodingPreservesByteOrder(@ForAll("sixteenBytes") byte[] a, @ForAll("sixteenBytes") byte[] b) {
        int byteOrder = Integer.signum(Arrays.compareUnsigned(a, b));
        int textOrder = Integer.signum(CrockfordBase32.encode(a).compareTo(CrockfordBase32.encode(b)));
        assertEquals(byteOrder, textOrder);
    }

    @Provide
    Arbitrary<byte[]> groupAligned() {
        return Arbitraries.integers().between(0, 6)
                .flatMap(groups -> Arbitraries.bytes().array(byte[].class).ofSize(groups * 5));
    }

    @Provide
    Arbitrary<byte[]> sixteenBytes() {
        return Arbitraries.bytes().array(byte[].class).ofSize(16);
    }
}
