package com.largomodo.kormarc.format;

import com.largomodo.kormarc.model.ControlField;
import com.largomodo.kormarc.model.DataField;
import com.largomodo.kormarc.model.KormarcRecord;
import com.largomodo.kormarc.model.Subfield;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Locale;

/**
 * Renders a record as MARCXML in the MARC21 slim schema.
 * <p>
 * Element content and attribute values are escaped by the StAX writer. Characters that
 * XML 1.0 cannot represent at all (C0 controls other than tab, line feed and carriage
 * return, unpaired surrogates, U+FFFE and U+FFFF) fail the conversion.
 */
public class MarcXmlWriter {

    public static final String NAMESPACE = "http://www.loc.gov/MARC21/slim";

    private final XMLOutputFactory factory = XMLOutputFactory.newFactory();

    public String write(KormarcRecord record) throws RecordConversionException {
        StringWriter out = new StringWriter();
        write(record, out);
        return out.toString();
    }

    /**
     * Write a complete XML document containing one {@code <record>} element.
     *
     * @throws RecordConversionException if the XML writer fails
     */
    public void write(KormarcRecord record, Writer out) throws RecordConversionException {
        try {
            XMLStreamWriter xml = factory.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("record");
            xml.writeDefaultNamespace(NAMESPACE);

            xml.writeStartElement("leader");
            xml.writeCharacters(xmlText("leader", record.leader().toString()));
            xml.writeEndElement();

            for (ControlField field : record.controlFields()) {
                xml.writeStartElement("controlfield");
                xml.writeAttribute("tag", field.tag());
                xml.writeCharacters(xmlText(field.tag(), field.data()));
                xml.writeEndElement();
            }

            for (DataField field : record.dataFields()) {
                xml.writeStartElement("datafield");
                xml.writeAttribute("tag", field.tag());
                xml.writeAttribute("ind1", xmlText(field.tag(), String.valueOf(field.indicator1())));
                xml.writeAttribute("ind2", xmlText(field.tag(), String.valueOf(field.indicator2())));
                for (Subfield subfield : field.subfields()) {
                    xml.writeStartElement("subfield");
                    xml.writeAttribute("code", xmlText(field.tag(), String.valueOf(subfield.code())));
                    xml.writeCharacters(xmlText(field.tag(), subfield.data()));
                    xml.writeEndElement();
                }
                xml.writeEndElement();
            }

            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new RecordConversionException("Failed to write MARCXML: " + e.getMessage(), e);
        }
    }

    private static String xmlText(String tag, String value) throws RecordConversionException {
        for (int i = 0; i < value.length(); ) {
            int cp = value.codePointAt(i);
            boolean allowed = cp == 0x9 || cp == 0xA || cp == 0xD
                    || (cp >= 0x20 && cp <= 0xD7FF)
                    || (cp >= 0xE000 && cp <= 0xFFFD)
                    || cp >= 0x10000;
            if (!allowed) {
                throw new RecordConversionException(String.format(Locale.ROOT,
                        "Field %s contains U+%04X, which XML 1.0 cannot represent", tag, cp));
            }
            i += Character.charCount(cp);
        }
        return value;
    }
}
