package com.largomodo.kormarc.builder;

import com.largomodo.kormarc.model.BibliographicLevel;
import com.largomodo.kormarc.toon.RecordTypeClassifier;

import java.util.Locale;

/**
 * Kind of publication a {@link BookInfo} describes. Decides the leader's
 * bibliographic level, the 008 form code and the TOON type prefix.
 */
public enum BookCategory {
    BOOK(BibliographicLevel.MONOGRAPH, 'a', RecordTypeClassifier.BOOK),
    SERIAL(BibliographicLevel.SERIAL, 's', RecordTypeClassifier.SERIAL),
    ACADEMIC(BibliographicLevel.MONOGRAPHIC_COMPONENT_PART, 'a', RecordTypeClassifier.ACADEMIC),
    COMIC(BibliographicLevel.COLLECTION, 'a', RecordTypeClassifier.COMIC);

    private final BibliographicLevel bibliographicLevel;
    private final char formCode;
    private final String toonPrefix;

    BookCategory(BibliographicLevel bibliographicLevel, char formCode, String toonPrefix) {
        this.bibliographicLevel = bibliographicLevel;
        this.formCode = formCode;
        this.toonPrefix = toonPrefix;
    }

    public static BookCategory fromCliArgument(String arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Category argument cannot be null. Supported: BOOK, SERIAL, ACADEMIC, COMIC");
        }
        try {
            return valueOf(arg.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid category: " + arg + ". Supported: BOOK, SERIAL, ACADEMIC, COMIC");
        }
    }

    public BibliographicLevel getBibliographicLevel() {
        return bibliographicLevel;
    }

    public char getFormCode() {
        return formCode;
    }

    public String getToonPrefix() {
        return toonPrefix;
    }
}
