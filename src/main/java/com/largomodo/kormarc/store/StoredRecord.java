package com.largomodo.kormarc.store;

import java.util.Objects;

/**
 * One row of stored record data: the identifier and the structured JSON form of the
 * record, as the storage layer keeps it. The JSON is not guaranteed to describe a
 * valid record.
 *
 * @param toonId     TOON identifier
 * @param parsedData structured JSON text of the record
 */
public record StoredRecord(String toonId, String parsedData) {

    public StoredRecord {
        Objects.requireNonNull(toonId, "toonId must not be null");
        Objects.requireNonNull(parsedData, "parsedData must not be null");
    }
}
