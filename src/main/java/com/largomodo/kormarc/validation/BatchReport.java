package com.largomodo.kormarc.validation;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate figures of a batch validation run.
 * <p>
 * A record passes only when every tier it ran through passed; warnings alone never
 * fail a record. Error counts include only results that failed, warning counts
 * include every result. Tiers 1 to 3 are always present in the per-tier maps.
 *
 * @param totalRecords   records that were reconstructed and validated
 * @param passedRecords  records that passed every selected tier
 * @param failedRecords  records that failed at least one tier
 * @param passRate       percentage of passed records, two decimals, 0 for an empty run
 * @param errorsByTier   error count per tier, ascending tier order
 * @param warningsByTier warning count per tier, ascending tier order
 * @param skippedRecords stored rows that could not be reconstructed into a record
 */
public record BatchReport(int totalRecords, int passedRecords, int failedRecords, double passRate,
                          Map<Integer, Integer> errorsByTier, Map<Integer, Integer> warningsByTier,
                          int skippedRecords) {

    public BatchReport {
        errorsByTier = Collections.unmodifiableMap(new TreeMap<>(errorsByTier));
        warningsByTier = Collections.unmodifiableMap(new TreeMap<>(warningsByTier));
    }

    public static BatchReport from(Map<String, List<ValidationResult>> results, int skippedRecords) {
        int passed = 0;
        int failed = 0;
        Map<Integer, Integer> errors = new TreeMap<>(Map.of(1, 0, 2, 0, 3, 0));
        Map<Integer, Integer> warnings = new TreeMap<>(Map.of(1, 0, 2, 0, 3, 0));

        for (List<ValidationResult> recordResults : results.values()) {
            boolean recordPassed = true;
            for (ValidationResult result : recordResults) {
                if (!result.passed()) {
                    recordPassed = false;
                    errors.merge(result.tier(), result.errors().size(), Integer::sum);
                }
                warnings.merge(result.tier(), result.warnings().size(), Integer::sum);
            }
            if (recordPassed) {
                passed++;
            } else {
                failed++;
            }
        }

        int total = results.size();
        double passRate = total == 0 ? 0.0 : Math.round(passed * 10_000.0 / total) / 100.0;
        return new BatchReport(total, passed, failed, passRate, errors, warnings, skippedRecords);
    }
}
