package com.largomodo.kormarc.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.largomodo.kormarc.model.BibliographicLevel;
import com.largomodo.kormarc.model.ControlField;
import com.largomodo.kormarc.model.DataField;
import com.largomodo.kormarc.model.KormarcConstants;
import com.largomodo.kormarc.model.KormarcRecord;
import com.largomodo.kormarc.model.Leader;
import com.largomodo.kormarc.model.RecordStatus;
import com.largomodo.kormarc.model.Subfield;
import com.largomodo.kormarc.model.TypeOfRecord;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured JSON form of records and TOON documents.
 * <p>
 * Record shape:
 * <pre>
 * {
 *   "leader": {"record_length": 714, "record_status": "c", ...},
 *   "control_fields": [{"tag": "001", "data": "..."}],
 *   "data_fields": [{"tag": "245", "indicator1": "1", "indicator2": "0",
 *                    "subfields": [{"code": "a", "data": "..."}]}]
 * }
 * </pre>
 * Reading accepts exactly what {@link #toJsonNode(KormarcRecord)} writes, plus two
 * older shapes found in stored data: the leader as its 24-character string, and a
 * data field carrying a two-character {@code indicators} member instead of
 * {@code indicator1}/{@code indicator2}. Leader members other than record length,
 * status, type, bibliographic level, character encoding and base address fall back
 * to their defaults when absent.
 * <p>
 * Thread-safe: the underlying {@link ObjectMapper} is only used for reading and
 * writing trees.
 */
public class RecordJsonCodec {

    private final ObjectMapper mapper = new ObjectMapper();

    public ObjectNode toJsonNode(KormarcRecord record) {
        ObjectNode root = mapper.createObjectNode();
        root.set("leader", leaderNode(record.leader()));

        ArrayNode controlFields = root.putArray("control_fields");
        for (ControlField field : record.controlFields()) {
            controlFields.addObject()
                    .put("tag", field.tag())
                    .put("data", field.data());
        }

        ArrayNode dataFields = root.putArray("data_fields");
        for (DataField field : record.dataFields()) {
            ObjectNode node = dataFields.addObject()
                    .put("tag", field.tag())
                    .put("indicator1", String.valueOf(field.indicator1()))
                    .put("indicator2", String.valueOf(field.indicator2()));
            ArrayNode subfields = node.putArray("subfields");
            for (Subfield subfield : field.subfields()) {
                subfields.addObject()
                        .put("code", String.valueOf(subfield.code()))
                        .put("data", subfield.data());
            }
        }
        return root;
    }

    public String toJson(KormarcRecord record) {
        return write(toJsonNode(record));
    }

    public ObjectNode toJsonNode(ToonDocument document) {
        ObjectNode root = mapper.createObjectNode()
                .put("toon_id", document.toonId())
                .put("timestamp", document.timestamp().toString())
                .put("type", document.type())
                .put("isbn", document.isbn())
                .put("raw_kormarc", document.rawKormarc());
        root.set("parsed", toJsonNode(document.parsed()));
        return root;
    }

    public String toJson(ToonDocument document) {
        return write(toJsonNode(document));
    }

    /**
     * Reconstruct a record from its structured JSON text.
     *
     * @throws RecordConversionException if the text is not JSON or does not describe a valid record
     */
    public KormarcRecord fromJson(String json) throws RecordConversionException {
        return fromJsonNode(readTree(json));
    }

    public KormarcRecord fromJsonNode(JsonNode root) throws RecordConversionException {
        if (root == null || !root.isObject()) {
            throw new RecordConversionException("Record JSON must be an object");
        }
        try {
            Leader leader = readLeader(member(root, "leader"));

            List<ControlField> controlFields = new ArrayList<>();
            for (JsonNode node : array(root, "control_fields")) {
                controlFields.add(new ControlField(text(node, "tag"), text(node, "data")));
            }

            List<DataField> dataFields = new ArrayList<>();
            for (JsonNode node : array(root, "data_fields")) {
                dataFields.add(readDataField(node));
            }
            return new KormarcRecord(leader, controlFields, dataFields);
        } catch (IllegalArgumentException e) {
            throw new RecordConversionException("Invalid record: " + e.getMessage(), e);
        }
    }

    /**
     * Read a TOON document written by {@link #toJsonNode(ToonDocument)}.
     *
     * @throws RecordConversionException if a member is missing or malformed
     */
    public ToonDocument documentFromJson(String json) throws RecordConversionException {
        JsonNode root = readTree(json);
        if (!root.isObject()) {
            throw new RecordConversionException("TOON document JSON must be an object");
        }
        Instant timestamp;
        try {
            timestamp = OffsetDateTime.parse(text(root, "timestamp")).toInstant();
        } catch (DateTimeParseException e) {
            throw new RecordConversionException("Invalid timestamp: " + e.getMessage(), e);
        }
        return new ToonDocument(
                text(root, "toon_id"),
                timestamp,
                text(root, "type"),
                root.path("isbn").asText(""),
                text(root, "raw_kormarc"),
                fromJsonNode(member(root, "parsed")));
    }

    /**
     * The {@code parsed} member of a TOON document, as JSON text.
     */
    public String parsedMember(String documentJson) throws RecordConversionException {
        return write(member(readTree(documentJson), "parsed"));
    }

    private ObjectNode leaderNode(Leader leader) {
        return mapper.createObjectNode()
                .put("record_length", leader.recordLength())
                .put("record_status", String.valueOf(leader.recordStatus().code()))
                .put("type_of_record", String.valueOf(leader.typeOfRecord().code()))
                .put("bibliographic_level", String.valueOf(leader.bibliographicLevel().code()))
                .put("control_type", String.valueOf(leader.controlType()))
                .put("character_encoding", String.valueOf(leader.characterEncoding()))
                .put("indicator_count", leader.indicatorCount())
                .put("subfield_code_count", leader.subfieldCodeCount())
                .put("base_address", leader.baseAddress())
                .put("encoding_level", String.valueOf(leader.encodingLevel()))
                .put("descriptive_cataloging", String.valueOf(leader.descriptiveCataloging()))
                .put("multipart_level", String.valueOf(leader.multipartLevel()))
                .put("entry_map", leader.entryMap());
    }

    private Leader readLeader(JsonNode node) throws RecordConversionException {
        if (node.isTextual()) {
            return Leader.fromString(node.asText());
        }
        if (!node.isObject()) {
            throw new RecordConversionException("Member 'leader' must be an object or a string");
        }
        return new Leader(
                integer(node, "record_length", null),
                RecordStatus.fromCode(character(node, "record_status", null)),
                TypeOfRecord.fromCode(character(node, "type_of_record", null)),
                BibliographicLevel.fromCode(character(node, "bibliographic_level", null)),
                character(node, "control_type", ' '),
                character(node, "character_encoding", null),
                integer(node, "indicator_count", 2),
                integer(node, "subfield_code_count", 2),
                integer(node, "base_address", null),
                character(node, "encoding_level", ' '),
                character(node, "descriptive_cataloging", ' '),
                character(node, "multipart_level", ' '),
                node.hasNonNull("entry_map") ? text(node, "entry_map") : "4500");
    }

    private DataField readDataField(JsonNode node) throws RecordConversionException {
        char indicator1;
        char indicator2;
        if (!node.has("indicator1") && node.hasNonNull("indicators")) {
            String indicators = text(node, "indicators");
            indicator1 = indicators.length() > 0 ? indicators.charAt(0) : KormarcConstants.BLANK_INDICATOR;
            indicator2 = indicators.length() > 1 ? indicators.charAt(1) : KormarcConstants.BLANK_INDICATOR;
        } else {
            indicator1 = character(node, "indicator1", KormarcConstants.BLANK_INDICATOR);
            indicator2 = character(node, "indicator2", KormarcConstants.BLANK_INDICATOR);
        }

        List<Subfield> subfields = new ArrayList<>();
        for (JsonNode subfield : array(node, "subfields")) {
            subfields.add(Subfield.of(text(subfield, "code"), text(subfield, "data")));
        }
        return new DataField(text(node, "tag"), indicator1, indicator2, subfields);
    }

    private JsonNode readTree(String json) throws RecordConversionException {
        if (json == null) {
            throw new RecordConversionException("JSON text must not be null");
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RecordConversionException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String write(JsonNode node) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // Trees built from strings and numbers always serialize
            throw new IllegalStateException("Failed to serialize JSON tree", e);
        }
    }

    private static JsonNode member(JsonNode node, String name) throws RecordConversionException {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            throw new RecordConversionException("Missing member '" + name + "'");
        }
        return value;
    }

    private static Iterable<JsonNode> array(JsonNode node, String name) throws RecordConversionException {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new RecordConversionException("Member '" + name + "' must be an array");
        }
        return value;
    }

    private static String text(JsonNode node, String name) throws RecordConversionException {
        JsonNode value = member(node, name);
        if (!value.isTextual()) {
            throw new RecordConversionException("Member '" + name + "' must be a string");
        }
        return value.asText();
    }

    private static char character(JsonNode node, String name, Character fallback) throws RecordConversionException {
        if (fallback != null && !node.hasNonNull(name)) {
            return fallback;
        }
        String value = text(node, name);
        if (value.length() != 1) {
            throw new RecordConversionException(
                    "Member '" + name + "' must be exactly 1 character, got '" + value + "'");
        }
        return value.charAt(0);
    }

    private static int integer(JsonNode node, String name, Integer fallback) throws RecordConversionException {
        if (fallback != null && !node.hasNonNull(name)) {
            return fallback;
        }
        JsonNode value = member(node, name);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new RecordConversionException("Member '" + name + "' must be an integer");
        }
        return value.intValue();
    }
}
