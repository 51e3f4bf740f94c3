package com.largomodo.kormarc.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidationReportWriterTest {

    private final ValidationReportWriter writer = new ValidationReportWriter();

    @Test
    void testResultShape() {
        ValidationResult result = ValidationResult.of(3, "InstitutionPolicyValidator",
                List.of(ValidationError.error("040", "Field 040 requires subfield $c", null)),
                List.of(new ValidationWarning(null, "advisory", "hint")));

        ObjectNode node = writer.toJsonNode(result);

        assertEquals(3, node.get("tier").asInt());
        assertEquals("InstitutionPolicyValidator", node.get("validator_name").asText());
        assertFalse(node.get("passed").asBoolean());
        JsonNode error = node.get("errors").get(0);
        assertEquals("ERROR", error.get("severity").asText());
        assertEquals("040", error.get("field_tag").asText());
        assertTrue(error.get("suggestion").isNull());
        JsonNode warning = node.get("warnings").get(0);
        assertTrue(warning.get("field_tag").isNull());
        assertEquals("hint", warning.get("suggestion").asText());
    }

    @Test
    void testBatchDocument() throws Exception {
        Map<String, List<ValidationResult>> results = new LinkedHashMap<>();
        results.put("kormarc_book_01", List.of(ValidationResult.of(1, "StructureValidator", List.of(), List.of())));
        String json = writer.write(new BatchResult(results, 1));

        JsonNode root = new ObjectMapper().readTree(json);

        assertEquals(1, root.get("report").get("total_records").asInt());
        assertEquals(100.0, root.get("report").get("pass_rate").asDouble());
        assertEquals(1, root.get("report").get("skipped_records").asInt());
        assertEquals(0, root.get("report").get("errors_by_tier").get("3").asInt());
        assertTrue(root.get("records").get("kormarc_book_01").get(0).get("passed").asBoolean());
    }
}
