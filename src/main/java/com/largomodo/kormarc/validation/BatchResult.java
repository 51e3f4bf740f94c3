package com.largomodo.kormarc.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-record results of a batch validation run, keyed by TOON identifier in the order
 * the records were read.
 *
 * @param results        validation results per record, in tier order
 * @param skippedRecords stored rows that could not be reconstructed into a record
 */
public record BatchResult(Map<String, List<ValidationResult>> results, int skippedRecords) {

    public BatchResult {
        Map<String, List<ValidationResult>> copy = new LinkedHashMap<>();
        results.forEach((toonId, recordResults) -> copy.put(toonId, List.copyOf(recordResults)));
        results = Collections.unmodifiableMap(copy);
    }

    public BatchReport report() {
        return BatchReport.from(results, skippedRecords);
    }
}
