package com.largomodo.kormarc.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * JSON rendering of validation results for reporting consumers.
 * <p>
 * Result shape: {@code {tier, validator_name, passed, errors: [{severity, field_tag,
 * message, suggestion}], warnings: [{field_tag, message, suggestion}]}}, absent tags and
 * suggestions written as {@code null}.
 */
public class ValidationReportWriter {

    private final ObjectMapper mapper = new ObjectMapper();

    public ObjectNode toJsonNode(ValidationResult result) {
        ObjectNode node = mapper.createObjectNode()
                .put("tier", result.tier())
                .put("validator_name", result.validatorName())
                .put("passed", result.passed());

        ArrayNode errors = node.putArray("errors");
        for (ValidationError error : result.errors()) {
            errors.addObject()
                    .put("severity", error.severity().name())
                    .put("field_tag", error.fieldTag())
                    .put("message", error.message())
                    .put("suggestion", error.suggestion());
        }

        ArrayNode warnings = node.putArray("warnings");
        for (ValidationWarning warning : result.warnings()) {
            warnings.addObject()
                    .put("field_tag", warning.fieldTag())
                    .put("message", warning.message())
                    .put("suggestion", warning.suggestion());
        }
        return node;
    }

    public ObjectNode toJsonNode(BatchReport report) {
        ObjectNode node = mapper.createObjectNode()
                .put("total_records", report.totalRecords())
                .put("passed_records", report.passedRecords())
                .put("failed_records", report.failedRecords())
                .put("pass_rate", report.passRate())
                .put("skipped_records", report.skippedRecords());
        ObjectNode errors = node.putObject("errors_by_tier");
        report.errorsByTier().forEach((tier, count) -> errors.put(String.valueOf(tier), count));
        ObjectNode warnings = node.putObject("warnings_by_tier");
        report.warningsByTier().forEach((tier, count) -> warnings.put(String.valueOf(tier), count));
        return node;
    }

    /**
     * Full batch output: the aggregate report plus every record's results keyed by TOON identifier.
     */
    public String write(BatchResult batch) {
        ObjectNode root = mapper.createObjectNode();
        root.set("report", toJsonNode(batch.report()));
        ObjectNode records = root.putObject("records");
        for (Map.Entry<String, List<ValidationResult>> entry : batch.results().entrySet()) {
            ArrayNode results = records.putArray(entry.getKey());
            entry.getValue().forEach(result -> results.add(toJsonNode(result)));
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize validation report", e);
        }
    }
}
