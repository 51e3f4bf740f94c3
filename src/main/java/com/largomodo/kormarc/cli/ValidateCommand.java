package com.largomodo.kormarc.cli;

import com.largomodo.kormarc.KormarcCli;
import com.largomodo.kormarc.format.RecordJsonCodec;
import com.largomodo.kormarc.store.DirectoryRecordStore;
import com.largomodo.kormarc.validation.BatchReport;
import com.largomodo.kormarc.validation.BatchResult;
import com.largomodo.kormarc.validation.BatchValidator;
import com.largomodo.kormarc.validation.InstitutionPolicy;
import com.largomodo.kormarc.validation.ValidationReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Batch-validates a directory record store and logs the summary report.
 * <p>
 * Exits with {@value KormarcCli#EXIT_VALIDATION_FAILED} when at least one record fails.
 */
@Command(
        name = "validate",
        mixinStandardHelpOptions = true,
        description = "Runs the validation tiers over every TOON document in a record store directory."
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @ParentCommand
    KormarcCli parent;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "STORE", description = "Directory of <toon_id>.json documents.")
    File storeDir;

    @Option(names = "--tiers", split = ",", paramLabel = "TIER",
            description = "Tiers to run: 1 structure, 2 semantics, 3 institution policy. Default: all.")
    List<Integer> tiers;

    @Option(names = "--limit", defaultValue = "0", description = "Validate at most N stored records (0: all).")
    int limit;

    @Option(names = "--policy", paramLabel = "FILE",
            description = "Institution policy properties file. Default: bundled Nowon district policy.")
    File policyFile;

    @Option(names = "--report", paramLabel = "FILE", description = "Write per-record results as JSON.")
    File reportFile;

    @Option(names = "--threads", description = "Worker threads. Default: number of CPU cores.")
    int threads = Runtime.getRuntime().availableProcessors();

    @Override
    public Integer call() throws Exception {
        if (parent != null) {
            parent.configureLogging();
        }

        if (!storeDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Record store must be a directory: " + storeDir.getAbsolutePath());
        }
        Set<Integer> selectedTiers = new LinkedHashSet<>();
        if (tiers != null) {
            for (Integer tier : tiers) {
                if (tier < 1 || tier > 3) {
                    throw new ParameterException(spec.commandLine(), "Invalid tier: " + tier + " (expected 1, 2 or 3)");
                }
                selectedTiers.add(tier);
            }
        }
        if (threads < 1) {
            throw new ParameterException(spec.commandLine(), "--threads must be at least 1");
        }

        BatchValidator validator = new BatchValidator(
                BatchValidator.defaultValidators(loadPolicy()), new RecordJsonCodec(), threads);
        BatchResult result = validator.validateAll(new DirectoryRecordStore(storeDir.toPath()), selectedTiers, limit);
        BatchReport report = result.report();

        logReport(report);
        if (reportFile != null) {
            Files.writeString(reportFile.toPath(), new ValidationReportWriter().write(result), StandardCharsets.UTF_8);
            log.info("Report written: {}", reportFile);
        }

        return report.failedRecords() > 0 ? KormarcCli.EXIT_VALIDATION_FAILED : 0;
    }

    private InstitutionPolicy loadPolicy() throws IOException {
        if (policyFile == null) {
            return InstitutionPolicy.defaultPolicy();
        }
        if (!policyFile.isFile()) {
            throw new ParameterException(spec.commandLine(), "Policy file does not exist: " + policyFile.getAbsolutePath());
        }
        try {
            return InstitutionPolicy.load(policyFile.toPath());
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "Invalid policy file: " + e.getMessage());
        }
    }

    private static void logReport(BatchReport report) {
        log.info("Records: {} total, {} passed, {} failed, {} skipped",
                report.totalRecords(), report.passedRecords(), report.failedRecords(), report.skippedRecords());
        log.info("Pass rate: {}%", report.passRate());
        for (Map.Entry<Integer, Integer> entry : report.errorsByTier().entrySet()) {
            log.info("Tier {}: {} errors, {} warnings", entry.getKey(), entry.getValue(),
                    report.warningsByTier().getOrDefault(entry.getKey(), 0));
        }
    }
}
