package com.largomodo.kormarc.validation;

import com.largomodo.kormarc.format.RecordConversionException;
import com.largomodo.kormarc.format.RecordJsonCodec;
import com.largomodo.kormarc.model.KormarcRecord;
import com.largomodo.kormarc.store.RecordSource;
import com.largomodo.kormarc.store.StoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs a selection of validator tiers over every record of a {@link RecordSource}.
 * <p>
 * Stored rows that cannot be reconstructed into a record are skipped and counted, never
 * failing the run. Results keep the order records were read in, and within a record the
 * order of the validator list.
 * <p>
 * With more than one thread, records are validated on a fixed pool with a bounded
 * queue; when the queue is full the reading thread validates the record itself.
 */
public class BatchValidator {

    private static final Logger log = LoggerFactory.getLogger(BatchValidator.class);

    private final List<RecordValidator> validators;
    private final RecordJsonCodec codec;
    private final int threads;

    public BatchValidator() {
        this(defaultValidators(InstitutionPolicy.defaultPolicy()), new RecordJsonCodec(), 1);
    }

    /**
     * @param validators validators in the order they run per record
     * @param codec      reconstructs records from their stored JSON
     * @param threads    worker threads; 1 validates on the calling thread
     */
    public BatchValidator(List<RecordValidator> validators, RecordJsonCodec codec, int threads) {
        if (validators == null || codec == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        this.validators = List.copyOf(validators);
        this.codec = codec;
        this.threads = threads;
    }

    /**
     * Tiers 1 to 3 with the given institution policy.
     */
    public static List<RecordValidator> defaultValidators(InstitutionPolicy policy) {
        return List.of(new StructureValidator(), new SemanticValidator(), new InstitutionPolicyValidator(policy));
    }

    public BatchResult validateAll(RecordSource source) throws IOException {
        return validateAll(source, null, 0);
    }

    /**
     * Validate stored records.
     *
     * @param source records to read
     * @param tiers  tiers to run; {@code null} or empty runs every tier
     * @param limit  maximum number of stored rows to read; 0 or less reads all
     * @return per-record results and the number of skipped rows
     * @throws IOException if the source cannot be read
     */
    public BatchResult validateAll(RecordSource source, Set<Integer> tiers, int limit) throws IOException {
        List<RecordValidator> selected = select(tiers);
        Map<String, List<ValidationResult>> results = new LinkedHashMap<>();
        int skipped = 0;

        try (Stream<StoredRecord> records = source.records()) {
            Stream<StoredRecord> rows = limit > 0 ? records.limit(limit) : records;

            if (threads == 1) {
                for (StoredRecord stored : (Iterable<StoredRecord>) rows::iterator) {
                    Optional<List<ValidationResult>> outcome = validateStored(stored, selected);
                    if (outcome.isPresent()) {
                        results.put(stored.toonId(), outcome.get());
                    } else {
                        skipped++;
                    }
                }
            } else {
                for (Pending pending : submitAll(rows, selected)) {
                    Optional<List<ValidationResult>> outcome = await(pending.outcome());
                    if (outcome.isPresent()) {
                        results.put(pending.toonId(), outcome.get());
                    } else {
                        skipped++;
                    }
                }
            }
        }

        log.info("Batch validation complete: {} validated, {} skipped", results.size(), skipped);
        return new BatchResult(results, skipped);
    }

    /**
     * Run the selected tiers on one record.
     */
    public List<ValidationResult> validate(KormarcRecord record, Set<Integer> tiers) {
        List<ValidationResult> results = new ArrayList<>();
        for (RecordValidator validator : select(tiers)) {
            results.add(validator.validate(record));
        }
        return results;
    }

    private List<Pending> submitAll(Stream<StoredRecord> rows, List<RecordValidator> selected) {
        ExecutorService executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(2 * threads),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        List<Pending> pending = new ArrayList<>();
        try {
            rows.forEach(stored -> pending.add(
                    new Pending(stored.toonId(), executor.submit(() -> validateStored(stored, selected)))));
        } finally {
            executor.shutdown();
        }
        return pending;
    }

    private Optional<List<ValidationResult>> await(Future<Optional<List<ValidationResult>>> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Batch validation interrupted");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Validator failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private Optional<List<ValidationResult>> validateStored(StoredRecord stored, List<RecordValidator> selected) {
        MDC.put("record", stored.toonId());
        try {
            KormarcRecord record = codec.fromJson(stored.parsedData());
            List<ValidationResult> results = new ArrayList<>(selected.size());
            for (RecordValidator validator : selected) {
                results.add(validator.validate(record));
            }
            return Optional.of(results);
        } catch (RecordConversionException e) {
            log.debug("Skipping {}: {}", stored.toonId(), e.getMessage());
            return Optional.empty();
        } finally {
            MDC.remove("record");
        }
    }

    private List<RecordValidator> select(Set<Integer> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            return validators;
        }
        return validators.stream().filter(v -> tiers.contains(v.tier())).toList();
    }

    private record Pending(String toonId, Future<Optional<List<ValidationResult>>> outcome) {
    }
}
