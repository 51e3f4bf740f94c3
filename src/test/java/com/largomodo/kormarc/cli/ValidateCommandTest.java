package com.largomodo.kormarc.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.largomodo.kormarc.KormarcCli;
import com.largomodo.kormarc.KormarcSamples;
import com.largomodo.kormarc.format.ToonDocument;
import com.largomodo.kormarc.parser.KormarcParser;
import com.largomodo.kormarc.store.DirectoryRecordStore;
import com.largomodo.kormarc.toon.ToonGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private Path store;
    private String simpleId;
    private String catalogedId;

    @BeforeEach
    void setUp() throws Exception {
        store = tempDir.resolve("store");
        DirectoryRecordStore records = new DirectoryRecordStore(store);
        ToonGenerator generator = new ToonGenerator();
        KormarcParser parser = new KormarcParser();

        simpleId = generator.generate("kormarc_book", 1700000000000L);
        catalogedId = generator.generate("kormarc_book", 1700000001000L);
        records.save(ToonDocument.of(generator.parse(simpleId), parser.parse(KormarcSamples.SIMPLE_RECORD)));
        records.save(ToonDocument.of(generator.parse(catalogedId), parser.parse(KormarcSamples.CATALOGED_RECORD)));
    }

    private static CommandLine quietCommandLine() {
        CommandLine cmd = KormarcCli.createCommandLine();
        cmd.setOut(new PrintWriter(new StringWriter()));
        cmd.setErr(new PrintWriter(new StringWriter()));
        return cmd;
    }

    @Test
    void testOptionParsing() {
        ValidateCommand command = new ValidateCommand();
        new CommandLine(command).parseArgs(store.toString(), "--tiers", "1,3", "--limit", "5",
                "--threads", "2", "--report", "report.json");

        assertEquals(List.of(1, 3), command.tiers);
        assertEquals(5, command.limit);
        assertEquals(2, command.threads);
        assertEquals(new File("report.json"), command.reportFile);
        assertNull(command.policyFile);
    }

    @Test
    void testDefaults() {
        ValidateCommand command = new ValidateCommand();
        new CommandLine(command).parseArgs(store.toString());

        assertNull(command.tiers, "All tiers run when --tiers is absent");
        assertEquals(0, command.limit);
        assertEquals(Runtime.getRuntime().availableProcessors(), command.threads);
    }

    @Test
    void testAllTiersReportsFailure() {
        assertEquals(KormarcCli.EXIT_VALIDATION_FAILED, quietCommandLine().execute("validate", store.toString()));
    }

    @Test
    void testStructureAndSemanticsOnlyPass() {
        assertEquals(0, quietCommandLine().execute("validate", store.toString(), "--tiers", "1,2"));
    }

    @Test
    void testLimitReadsOldestRecordsFirst() throws Exception {
        Path report = tempDir.resolve("report.json");

        assertEquals(KormarcCli.EXIT_VALIDATION_FAILED, quietCommandLine().execute("validate", store.toString(),
                "--limit", "1", "--report", report.toString()));

        JsonNode root = new ObjectMapper().readTree(Files.readString(report, StandardCharsets.UTF_8));
        assertEquals(1, root.path("report").path("total_records").asInt());
        assertTrue(root.path("records").has(simpleId));
    }

    @Test
    void testMalformedPolicyFile() throws Exception {
        Path policy = tempDir.resolve("policy.properties");
        Files.writeString(policy, "required.tag=040\n", StandardCharsets.UTF_8);

        assertEquals(2, quietCommandLine().execute("validate", store.toString(), "--policy", policy.toString()));
    }

    @Test
    void testInvalidTier() {
        assertEquals(2, quietCommandLine().execute("validate", store.toString(), "--tiers", "4"));
        assertEquals(2, quietCommandLine().execute("validate", store.toString(), "--tiers", "0"));
    }

    @Test
    void testInvalidThreads() {
        assertEquals(2, quietCommandLine().execute("validate", store.toString(), "--threads", "0"));
    }

    @Test
    void testStoreMustBeDirectory() {
        assertEquals(2, quietCommandLine().execute("validate", tempDir.resolve("absent").toString()));
    }

    @Test
    void testMissingPolicyFile() {
        assertEquals(2, quietCommandLine().execute("validate", store.toString(),
                "--policy", tempDir.resolve("absent.properties").toString()));
    }

    @Test
    void testCustomPolicy() throws Exception {
        Path policy = tempDir.resolve("policy.properties");
        Files.writeString(policy, "required.tag=260\nrequired.subfields=a,b\ninstitution.subfield=b\n",
                StandardCharsets.UTF_8);

        assertEquals(0, quietCommandLine().execute("validate", store.toString(), "--policy", policy.toString()));
    }

    @Test
    void testReportFile() throws Exception {
        Path report = tempDir.resolve("report.json");

        int exitCode = quietCommandLine().execute("validate", store.toString(), "--report", report.toString(),
                "--threads", "1");

        assertEquals(KormarcCli.EXIT_VALIDATION_FAILED, exitCode);
        JsonNode root = new ObjectMapper().readTree(Files.readString(report, StandardCharsets.UTF_8));
        assertEquals(2, root.path("report").path("total_records").asInt());
        assertEquals(1, root.path("report").path("passed_records").asInt());
        assertEquals(1, root.path("report").path("failed_records").asInt());
        assertEquals(3, root.path("records").path(simpleId).size());
        assertTrue(root.path("records").has(catalogedId));
    }

    @Test
    void testCorruptDocumentIsSkipped() throws Exception {
        Files.writeString(store.resolve("kormarc_book_broken.json"), "{not json", StandardCharsets.UTF_8);
        Path report = tempDir.resolve("report.json");

        assertEquals(0, quietCommandLine().execute("validate", store.toString(), "--tiers", "1",
                "--report", report.toString()));

        JsonNode root = new ObjectMapper().readTree(Files.readString(report, StandardCharsets.UTF_8));
        assertEquals(1, root.path("report").path("skipped_records").asInt());
        assertEquals(2, root.path("report").path("total_records").asInt());
    }
}
