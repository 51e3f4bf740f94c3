package com.largomodo.kormarc.cli;

import com.largomodo.kormarc.KormarcCli;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class ToonCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = KormarcCli.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private String[] outputLines() {
        return out.toString().strip().split("\\R");
    }

    @Test
    void testGenerateWithTimestamp() {
        assertEquals(0, run("toon", "generate", "kormarc_book", "--timestamp", "1700000000000"));

        String id = out.toString().strip();
        assertTrue(id.startsWith("kormarc_book_065WZSB8"), id);
        assertEquals("kormarc_book_".length() + 26, id.length());
    }

    @Test
    void testGenerateCount() {
        assertEquals(0, run("toon", "generate", "kormarc_serial", "--count", "3"));

        String[] ids = outputLines();
        assertEquals(3, ids.length);
        for (String id : ids) {
            assertTrue(id.startsWith("kormarc_serial_"), id);
        }
        assertNotEquals(ids[0], ids[1]);
        assertNotEquals(ids[1], ids[2]);
    }

    @Test
    void testGenerateNormalizesPrefix() {
        assertEquals(0, run("toon", "generate", "KORMARC_Book", "--timestamp", "1700000000000"));

        assertTrue(out.toString().startsWith("kormarc_book_"));
    }

    @Test
    void testGenerateRejectsInvalidPrefix() {
        assertEquals(2, run("toon", "generate", "kormarc-book"));
        assertEquals(2, run("toon", "generate", "_book"));
        assertTrue(out.toString().isEmpty());
    }

    @Test
    void testGenerateRejectsInvalidCount() {
        assertEquals(2, run("toon", "generate", "kormarc_book", "--count", "0"));
    }

    @Test
    void testInspect() {
        assertEquals(0, run("toon", "inspect", "kormarc_book_065WZSB8000020G30G2GC1R814"));

        String output = out.toString();
        assertTrue(output.contains("type:         kormarc_book"), output);
        assertTrue(output.contains("subtype:      book"), output);
        assertTrue(output.contains("ulid:         065WZSB8000020G30G2GC1R814"), output);
        assertTrue(output.contains("timestamp_ms: 1700000000000"), output);
        assertTrue(output.contains("created_at:   2023-11-14T22:13:20Z"), output);
    }

    @Test
    void testInspectRejectsMalformedId() {
        assertEquals(2, run("toon", "inspect", "kormarc_book_TOOSHORT"));
        assertEquals(2, run("toon", "inspect", "no-separator"));
    }

    @Test
    void testMissingSubcommand() {
        assertEquals(2, run("toon"));
    }
}
