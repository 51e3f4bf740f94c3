package com.largomodo.kormarc.parser;

import com.largomodo.kormarc.model.ControlField;
import com.largomodo.kormarc.model.DataField;
import com.largomodo.kormarc.model.KormarcConstants;
import com.largomodo.kormarc.model.KormarcRecord;
import com.largomodo.kormarc.model.Leader;
import com.largomodo.kormarc.model.Subfield;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parser for the line-oriented KORMARC text form.
 * <p>
 * Grammar:
 * <pre>
 * 00714cam  2200205 a 4500          leader (first non-empty line, 24 characters)
 * 001 1234567890                    control field: tag &lt;= 9, content kept verbatim
 * 245 10|aTitle|bSubtitle           data field: indicators, then delimited subfields
 * 260 |aCity|bPublisher|c2020       missing indicators default to blank
 * </pre>
 * Tags may omit zero padding ({@code 1} is {@code 001}). Each line is trimmed before it
 * is split into a tag token and the remaining content at the first run of Unicode
 * whitespace, so an ideographic space (U+3000) separates like an ASCII one. Lines end at
 * CR, LF, CRLF, vertical tab, form feed, NEL, U+2028, U+2029 and the separators
 * U+001C to U+001E. The whole document is read in
 * one linear pass; there is no directory to resolve.
 * <p>
 * Instances are immutable and safe for concurrent use.
 */
public class KormarcParser {

    private static final Logger log = LoggerFactory.getLogger(KormarcParser.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    // Includes the MARC group, record and unit separators
    private static final Pattern LINE_BREAK = Pattern.compile(
            "\\r\\n|[\\n\\r\\u000B\\u000C\\u001C\\u001D\\u001E\\u0085\\u2028\\u2029]");
    private static final String INDICATOR_CHARS = "0123456789 ";

    private final char delimiter;
    private final ParseMode mode;

    public KormarcParser() {
        this(KormarcConstants.DEFAULT_SUBFIELD_DELIMITER, ParseMode.LENIENT);
    }

    /**
     * @param delimiter subfield delimiter, must not be whitespace
     * @param mode      handling of lines that do not follow the grammar
     */
    public KormarcParser(char delimiter, ParseMode mode) {
        if (Character.isWhitespace(delimiter)) {
            throw new IllegalArgumentException("Subfield delimiter must not be whitespace");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        this.delimiter = delimiter;
        this.mode = mode;
    }

    public char getDelimiter() {
        return delimiter;
    }

    public ParseMode getMode() {
        return mode;
    }

    /**
     * Parse a record from UTF-8 encoded bytes.
     *
     * @throws RecordParseException if the bytes are not valid UTF-8 or the text is malformed
     */
    public KormarcRecord parse(byte[] data) throws RecordParseException {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new RecordParseException("Failed to decode data as UTF-8: " + e.getMessage(), e);
        }
        return parse(text);
    }

    /**
     * Read and parse a UTF-8 record file.
     *
     * @throws IOException if the file cannot be read or its content is malformed
     */
    public KormarcRecord parseFile(Path path) throws IOException {
        return parse(Files.readAllBytes(path));
    }

    /**
     * Parse a record from text.
     *
     * @param text record text; the first non-empty line is the leader
     * @return parsed record
     * @throws LeaderParseException if the leader line is invalid
     * @throws FieldParseException  if a field line cannot be constructed
     * @throws RecordParseException if the document is empty
     */
    public KormarcRecord parse(String text) throws RecordParseException {
        if (text == null) {
            throw new RecordParseException("Empty record: no data to parse");
        }
        List<String> lines = LINE_BREAK.splitAsStream(text)
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();

        if (lines.isEmpty()) {
            throw new RecordParseException("Empty record: no data to parse");
        }

        Leader leader = parseLeader(lines.get(0));

        List<ControlField> controlFields = new ArrayList<>();
        List<DataField> dataFields = new ArrayList<>();

        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            String[] parts = WHITESPACE.split(line, 2);
            String tag = parts[0];

            if (parts.length < 2) {
                if (mode == ParseMode.STRICT) {
                    throw new FieldParseException("Field " + tag + " has no content (line " + (i + 1) + ")", tag);
                }
                log.debug("Skipping line {} without content: '{}'", i + 1, line);
                continue;
            }
            String content = parts[1];

            try {
                if (isControlTag(tag)) {
                    controlFields.add(new ControlField(padTag(tag), content));
                } else {
                    dataFields.add(parseDataField(padTag(tag), content));
                }
            } catch (FieldParseException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new FieldParseException("Failed to parse field " + tag + ": " + e.getMessage(), tag, e);
            }
        }

        return new KormarcRecord(leader, controlFields, dataFields);
    }

    private Leader parseLeader(String line) throws LeaderParseException {
        try {
            return Leader.fromString(line);
        } catch (RuntimeException e) {
            throw new LeaderParseException("Failed to parse leader: " + e.getMessage(), line.length(), e);
        }
    }

    /**
     * Split data field content into indicators and subfields.
     * <p>
     * Characters before the first delimiter that are digits or blanks become indicators
     * (at most two, blank-filled). Each delimited chunk is trimmed; its first character is
     * the subfield code, the rest is data. Empty chunks are dropped.
     */
    private DataField parseDataField(String tag, String content) throws FieldParseException {
        int delimiterPos = content.indexOf(delimiter);
        if (delimiterPos < 0) {
            if (mode == ParseMode.STRICT) {
                throw new FieldParseException("Field " + tag + " has no subfield delimiter '" + delimiter + "'", tag);
            }
            List<Subfield> implicit = new ArrayList<>();
            String data = content.strip();
            if (!data.isEmpty()) {
                implicit.add(new Subfield(KormarcConstants.IMPLICIT_SUBFIELD_CODE, data));
            }
            return new DataField(tag, KormarcConstants.BLANK_INDICATOR, KormarcConstants.BLANK_INDICATOR, implicit);
        }

        StringBuilder indicators = new StringBuilder(2);
        for (int i = 0; i < delimiterPos && indicators.length() < 2; i++) {
            char c = content.charAt(i);
            if (INDICATOR_CHARS.indexOf(c) < 0) {
                break;
            }
            indicators.append(c);
        }
        while (indicators.length() < 2) {
            indicators.append(KormarcConstants.BLANK_INDICATOR);
        }

        List<Subfield> subfields = new ArrayList<>();
        String[] chunks = content.substring(delimiterPos).split(Pattern.quote(String.valueOf(delimiter)), -1);
        for (String chunk : chunks) {
            String part = chunk.strip();
            if (!part.isEmpty()) {
                subfields.add(new Subfield(part.charAt(0), part.substring(1)));
            }
        }
        return new DataField(tag, indicators.charAt(0), indicators.charAt(1), subfields);
    }

    private static boolean isControlTag(String tag) {
        if (!isAsciiDigits(tag)) {
            return false;
        }
        // Long numeric tokens cannot be control tags; avoid int overflow on parse
        return tag.length() <= 9 && Integer.parseInt(tag) <= 9;
    }

    private static boolean isAsciiDigits(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static String padTag(String tag) {
        if (tag.length() >= 3) {
            return tag;
        }
        return "0".repeat(3 - tag.length()) + tag;
    }
}
