package com.largomodo.kormarc.validation;

import com.largomodo.kormarc.KormarcSamples;
import com.largomodo.kormarc.model.ControlField;
import com.largomodo.kormarc.model.DataField;
import com.largomodo.kormarc.model.KormarcRecord;
import com.largomodo.kormarc.model.Leader;
import com.largomodo.kormarc.model.Subfield;
import com.largomodo.kormarc.parser.KormarcParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SemanticValidatorTest {

    private static final Leader BOOK = Leader.fromString("00714cam  2200205 a 4500");
    private static final Leader MUSIC = Leader.fromString("00714ccm  2200205 a 4500");

    private final SemanticValidator validator = new SemanticValidator();
    private final KormarcParser parser = new KormarcParser();

    private static DataField field(String tag, Subfield... subfields) {
        return new DataField(tag, ' ', ' ', List.of(subfields));
    }

    @Test
    void testTierAndName() {
        assertEquals(2, validator.tier());
        assertEquals("SemanticValidator", validator.name());
    }

    @Test
    void testSimpleRecordPassesWithMainEntryWarning() throws Exception {
        ValidationResult result = validator.validate(parser.parse(KormarcSamples.SIMPLE_RECORD));

        assertTrue(result.passed());
        assertTrue(result.errors().isEmpty());
        assertEquals(1, result.warnings().size());
        assertEquals("100", result.warnings().get(0).fieldTag());
    }

    @Test
    void testBookRecordPassesWithoutWarnings() throws Exception {
        ValidationResult result = validator.validate(parser.parse(KormarcSamples.VALID_BOOK_RECORD));

        assertTrue(result.passed());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void testMissingRequiredFieldsInOrder() throws Exception {
        ValidationResult result = validator.validate(parser.parse(KormarcSamples.CONTROL_ONLY_RECORD));

        assertFalse(result.passed());
        List<String> tags = result.errors().stream().map(ValidationError::fieldTag).toList();
        assertEquals(List.of("245", "260"), tags);
        assertEquals("Missing required field: title statement (245)", result.errors().get(0).message());
    }

    @Test
    void testEveryRequiredFieldMissing() {
        ValidationResult result = validator.validate(new KormarcRecord(BOOK, List.of(), List.of()));

        List<String> tags = result.errors().stream().map(ValidationError::fieldTag).toList();
        assertEquals(List.of("001", "245", "260"), tags);
    }

    @Test
    void testPublicationWithoutDate() throws Exception {
        ValidationResult result = validator.validate(parser.parse(KormarcSamples.SERIAL_RECORD));

        assertFalse(result.passed());
        assertEquals(1, result.errors().size());
        assertEquals("260", result.errors().get(0).fieldTag());
        assertTrue(result.errors().get(0).message().contains("$c"));
    }

    @Test
    void testMainEntryRequiresTitle() {
        KormarcRecord record = new KormarcRecord(BOOK, List.of(new ControlField("001", "1")),
                List.of(field("100", new Subfield('a', "Author")),
                        field("260", new Subfield('c', "2020"))));

        ValidationResult result = validator.validate(record);

        List<String> tags = result.errors().stream().map(ValidationError::fieldTag).toList();
        assertEquals(List.of("245", "100"), tags);
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void testMainEntryWarningOnlyForLanguageMaterial() {
        KormarcRecord record = new KormarcRecord(MUSIC, List.of(new ControlField("001", "1")),
                List.of(field("245", new Subfield('a', "Score")),
                        field("260", new Subfield('c', "2020"))));

        ValidationResult result = validator.validate(record);

        assertTrue(result.passed());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void testValidationIsIdempotent() throws Exception {
        KormarcRecord record = parser.parse(KormarcSamples.SERIAL_RECORD);

        ValidationResult first = validator.validate(record);
        ValidationResult second = validator.validate(record);

        assertEquals(first, second);
        assertEquals(first.errors(), second.errors());
        assertEquals(first.warnings(), second.warnings());
    }
}
