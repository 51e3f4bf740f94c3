package com.largomodo.kormarc.toon;

import com.largomodo.kormarc.model.KormarcConstants;
import com.largomodo.kormarc.model.KormarcRecord;

/**
 * Chooses the TOON type prefix for a record from its leader.
 * <p>
 * A record without fixed-length data (008) cannot be classified reliably and is
 * reported as {@link #UNKNOWN}.
 */
public final class RecordTypeClassifier {

    public static final String BOOK = "kormarc_book";
    public static final String SERIAL = "kormarc_serial";
    public static final String ACADEMIC = "kormarc_academic";
    public static final String COMIC = "kormarc_comic";
    public static final String UNKNOWN = "kormarc_unknown";

    private RecordTypeClassifier() {
    }

    public static String classify(KormarcRecord record) {
        if (!record.hasControlField(KormarcConstants.TAG_FIXED_LENGTH_DATA)) {
            return UNKNOWN;
        }
        return switch (record.leader().bibliographicLevel()) {
            case MONOGRAPH -> BOOK;
            case SERIAL -> SERIAL;
            case MONOGRAPHIC_COMPONENT_PART -> ACADEMIC;
            case COLLECTION, SUBUNIT -> COMIC;
            default -> UNKNOWN;
        };
    }
}
