package com.largomodo.kormarc.format;

import com.largomodo.kormarc.model.ControlField;
import com.largomodo.kormarc.model.DataField;
import com.largomodo.kormarc.model.KormarcConstants;
import com.largomodo.kormarc.model.KormarcRecord;
import com.largomodo.kormarc.model.Subfield;

/**
 * Writes a record in the line grammar read by
 * {@link com.largomodo.kormarc.parser.KormarcParser}.
 * <pre>
 * 00714cam  2200205 a 4500
 * 001 1234567890
 * 245 10|aTitle|bSubtitle
 * </pre>
 * Every record produced by the parser reads back equal. A data field without subfields
 * is written with a bare delimiter so that it still reads back as a data field.
 * <p>
 * The grammar cannot express a blank first indicator followed by a non-blank second
 * one: the parser would read the second indicator as the first.
 */
public class RecordTextWriter {

    private final char delimiter;

    public RecordTextWriter() {
        this(KormarcConstants.DEFAULT_SUBFIELD_DELIMITER);
    }

    public RecordTextWriter(char delimiter) {
        if (Character.isWhitespace(delimiter)) {
            throw new IllegalArgumentException("Subfield delimiter must not be whitespace");
        }
        this.delimiter = delimiter;
    }

    public String write(KormarcRecord record) {
        StringBuilder out = new StringBuilder();
        out.append(record.leader()).append('\n');

        for (ControlField field : record.controlFields()) {
            out.append(field.tag()).append(' ').append(field.data()).append('\n');
        }

        for (DataField field : record.dataFields()) {
            out.append(field.tag()).append(' ')
                    .append(field.indicator1())
                    .append(field.indicator2());
            if (field.subfields().isEmpty()) {
                out.append(delimiter);
            }
            for (Subfield subfield : field.subfields()) {
                out.append(delimiter).append(subfield.code()).append(subfield.data());
            }
            out.append('\n');
        }
        return out.toString();
    }
}
