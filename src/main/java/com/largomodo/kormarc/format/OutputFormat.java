package com.largomodo.kormarc.format;

import java.util.Locale;

/**
 * Renderings the converter can write for a record.
 */
public enum OutputFormat {
    JSON,   // TOON document with structured record
    XML,    // MARCXML (MARC21 slim)
    TEXT;   // line grammar accepted by the parser

    public static OutputFormat fromCliArgument(String arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Format argument cannot be null. Supported: JSON, XML, TEXT");
        }
        try {
            return valueOf(arg.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid format: " + arg + ". Supported: JSON, XML, TEXT");
        }
    }

    public String getFileExtension() {
        return switch (this) {
            case JSON -> "json";
            case XML -> "xml";
            case TEXT -> "txt";
        };
    }
}
