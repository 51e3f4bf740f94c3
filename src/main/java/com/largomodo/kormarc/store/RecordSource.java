package com.largomodo.kormarc.store;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * Read boundary of the storage layer, as consumed by batch validation.
 */
public interface RecordSource {

    /**
     * Stream every stored record. Callers close the stream.
     *
     * @throws IOException if the store cannot be opened
     */
    Stream<StoredRecord> records() throws IOException;
}
