package com.largomodo.kormarc.model;

import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class LeaderTest {

    private static final String BOOK_LEADER = "00714cam  2200205 a 4500";

    @Test
    void testFromStringReadsEveryPosition() {
        Leader leader = Leader.fromString(BOOK_LEADER);

        assertEquals(714, leader.recordLength());
        assertEquals(RecordStatus.CORRECTED, leader.recordStatus());
        assertEquals(TypeOfRecord.LANGUAGE_MATERIAL, leader.typeOfRecord());
        assertEquals(BibliographicLevel.MONOGRAPH, leader.bibliographicLevel());
        assertEquals(' ', leader.controlType());
        assertEquals(' ', leader.characterEncoding());
        assertEquals(2, leader.indicatorCount());
        assertEquals(2, leader.subfieldCodeCount());
        assertEquals(205, leader.baseAddress());
        assertEquals(' ', leader.encodingLevel());
        assertEquals('a', leader.descriptiveCataloging());
        assertEquals(' ', leader.multipartLevel());
        assertEquals("4500", leader.entryMap());
    }

    @Test
    void testToStringIsPositional() {
        assertEquals(BOOK_LEADER, Leader.fromString(BOOK_LEADER).toString());
        assertEquals(24, Leader.fromString(BOOK_LEADER).toString().length());
    }

    @Test
    void testOfUsesMonographDefaults() {
        Leader leader = Leader.of(714, RecordStatus.NEW, TypeOfRecord.LANGUAGE_MATERIAL,
                BibliographicLevel.MONOGRAPH, 'a', 205);

        assertEquals("00714nam a2200205   4500", leader.toString());
    }

    @Test
    void testShortLeaderIsLengthMismatch() {
        LeaderValidationException e = assertThrows(LeaderValidationException.class,
                () -> Leader.fromString(BOOK_LEADER.substring(0, 23)));
        assertTrue(e.getMessage().contains("got 23 characters"), e.getMessage());
    }

    @Test
    void testLongLeaderRejected() {
        assertThrows(LeaderValidationException.class, () -> Leader.fromString(BOOK_LEADER + " "));
    }

    @Test
    void testInvalidEnumeratedPositions() {
        LeaderValidationException status = assertThrows(LeaderValidationException.class,
                () -> Leader.fromString("00714xam  2200205 a 4500"));
        assertTrue(status.getMessage().contains("record_status"));

        LeaderValidationException type = assertThrows(LeaderValidationException.class,
                () -> Leader.fromString("00714czm  2200205 a 4500"));
        assertTrue(type.getMessage().contains("type_of_record"));

        LeaderValidationException level = assertThrows(LeaderValidationException.class,
                () -> Leader.fromString("00714caz  2200205 a 4500"));
        assertTrue(level.getMessage().contains("bibliographic_level"));
    }

    @Test
    void testNonDigitNumericPositions() {
        assertThrows(LeaderValidationException.class, () -> Leader.fromString("0071Xcam  2200205 a 4500"));
        assertThrows(LeaderValidationException.class, () -> Leader.fromString("00714cam  X200205 a 4500"));
        assertThrows(LeaderValidationException.class, () -> Leader.fromString("00714cam  22002O5 a 4500"));
    }

    @Test
    void testNonAsciiDigitsRejected() {
        // Arabic-Indic digits satisfy Character.isDigit but are not positional digits
        assertThrows(LeaderValidationException.class, () -> Leader.fromString("٠٠714cam  2200205 a 4500"));
    }

    @Test
    void testConstructorRanges() {
        assertThrows(LeaderValidationException.class, () -> Leader.of(100_000, RecordStatus.NEW,
                TypeOfRecord.LANGUAGE_MATERIAL, BibliographicLevel.MONOGRAPH, 'a', 0));
        assertThrows(LeaderValidationException.class, () -> Leader.of(-1, RecordStatus.NEW,
                TypeOfRecord.LANGUAGE_MATERIAL, BibliographicLevel.MONOGRAPH, 'a', 0));
        assertThrows(LeaderValidationException.class, () -> new Leader(0, RecordStatus.NEW,
                TypeOfRecord.LANGUAGE_MATERIAL, BibliographicLevel.MONOGRAPH, ' ', 'a',
                2, 2, 0, ' ', ' ', ' ', "450"));
    }

    @Test
    void testToStringIgnoresDefaultLocaleDigits() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));

            assertEquals("00714cam  2200205 a 4500", Leader.fromString("00714cam  2200205 a 4500").toString());
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void testNullLeaderRejected() {
        assertThrows(LeaderValidationException.class, () -> Leader.fromString(null));
    }

    @Property
    void positionalFormRoundTrips(@ForAll("leaders") Leader leader) {
        String positional = leader.toString();

        assertEquals(24, positional.length());
        assertEquals(leader, Leader.fromString(positional));
    }

    @Provide
    Arbitrary<Leader> leaders() {
        Arbitrary<Character> anyChar = Arbitraries.chars().with(' ', 'a', 'b', 'c', 'm', 'z', '1', '7');
        Arbitrary<Integer> fiveDigits = Arbitraries.integers().between(0, 99_999);
        Arbitrary<Integer> oneDigit = Arbitraries.integers().between(0, 9);

        Arbitrary<Leader> head = Combinators.combine(
                fiveDigits,
                Arbitraries.of(RecordStatus.class),
                Arbitraries.of(TypeOfRecord.class),
                Arbitraries.of(BibliographicLevel.class),
                anyChar,
                anyChar,
                oneDigit,
                oneDigit
        ).as((length, status, type, level, control, encoding, indicators, codes) ->
                new Leader(length, status, type, level, control, encoding, indicators, codes,
                        0, ' ', ' ', ' ', "4500"));

        return Combinators.combine(
                head,
                fiveDigits,
                anyChar,
                anyChar,
                anyChar,
                Arbitraries.strings().withChars("0123456789 ").ofLength(4)
        ).as((base, address, encodingLevel, cataloging, multipart, entryMap) ->
                new Leader(base.recordLength(), base.recordStatus(), base.typeOfRecord(),
                        base.bibliographicLevel(), base.controlType(), base.characterEncoding(),
                        base.indicatorCount(), base.subfieldCodeCount(), address,
                        encodingLevel, cataloging, multipart, entryMap));
    }
}
