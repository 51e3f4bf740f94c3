package com.largomodo.kormarc.format;

import com.largomodo.kormarc.KormarcSamples;
import com.largomodo.kormarc.model.DataField;
import com.largomodo.kormarc.model.KormarcRecord;
import com.largomodo.kormarc.model.Leader;
import com.largomodo.kormarc.model.Subfield;
import com.largomodo.kormarc.parser.KormarcParser;
import com.largomodo.kormarc.parser.ParseMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordTextWriterTest {

    private final KormarcParser parser = new KormarcParser();
    private final RecordTextWriter writer = new RecordTextWriter();

    @Test
    void testWritesLineGrammar() throws Exception {
        String text = writer.write(parser.parse(KormarcSamples.SIMPLE_RECORD));

        assertEquals("00714cam  2200205 a 4500\n"
                + "001 1234567890\n"
                + "245 10|aTitle|bSubtitle\n"
                + "260   |aCity|bPublisher|c2020\n", text);
    }

    @ParameterizedTest
    @ValueSource(strings = {"SIMPLE", "BOOK", "MINIMAL", "CONTROL_ONLY", "SERIAL", "SPECIAL", "CATALOGED"})
    void testParsedRecordsReadBackEqual(String sample) throws Exception {
        String source = switch (sample) {
            case "SIMPLE" -> KormarcSamples.SIMPLE_RECORD;
            case "BOOK" -> KormarcSamples.VALID_BOOK_RECORD;
            case "MINIMAL" -> KormarcSamples.MINIMAL_RECORD;
            case "CONTROL_ONLY" -> KormarcSamples.CONTROL_ONLY_RECORD;
            case "SERIAL" -> KormarcSamples.SERIAL_RECORD;
            case "SPECIAL" -> KormarcSamples.SPECIAL_CHARS_RECORD;
            default -> KormarcSamples.CATALOGED_RECORD;
        };
        KormarcRecord record = parser.parse(source);

        assertEquals(record, parser.parse(writer.write(record)));
    }

    @Test
    void testFieldWithoutSubfieldsStaysDataField() throws Exception {
        KormarcRecord record = new KormarcRecord(Leader.fromString("00714cam  2200205 a 4500"), List.of(),
                List.of(new DataField("500", '1', '0', List.of())));

        String text = writer.write(record);

        assertEquals("00714cam  2200205 a 4500\n500 10|\n", text);
        assertEquals(record, new KormarcParser('|', ParseMode.STRICT).parse(text));
    }

    @Test
    void testCustomDelimiter() throws Exception {
        KormarcRecord record = new KormarcRecord(Leader.fromString("00714cam  2200205 a 4500"), List.of(),
                List.of(new DataField("245", '0', '0', List.of(new Subfield('a', "A|B")))));

        String text = new RecordTextWriter('$').write(record);

        assertEquals("00714cam  2200205 a 4500\n245 00$aA|B\n", text);
        assertEquals(record, new KormarcParser('$', ParseMode.LENIENT).parse(text));
    }

    @Test
    void testWhitespaceDelimiterRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RecordTextWriter('\t'));
    }
}
