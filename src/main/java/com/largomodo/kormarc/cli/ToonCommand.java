package com.largomodo.kormarc.cli;

import com.largomodo.kormarc.KormarcCli;
import com.largomodo.kormarc.toon.ToonGenerator;
import com.largomodo.kormarc.toon.ToonId;
import com.largomodo.kormarc.toon.ToonValidationException;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Generates and inspects TOON identifiers.
 */
@Command(
        name = "toon",
        mixinStandardHelpOptions = true,
        description = "Generates and inspects TOON identifiers.",
        subcommands = {ToonCommand.Generate.class, ToonCommand.Inspect.class}
)
public class ToonCommand implements Callable<Integer> {

    @ParentCommand
    KormarcCli parent;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand: generate or inspect");
    }

    @Command(name = "generate", mixinStandardHelpOptions = true,
            description = "Prints new identifiers, one per line.")
    static class Generate implements Callable<Integer> {

        @ParentCommand
        ToonCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "PREFIX", description = "Type prefix, e.g. kormarc_book.")
        String prefix;

        @Option(names = "--timestamp", paramLabel = "MS", description = "Unix milliseconds. Default: now.")
        Long timestamp;

        @Option(names = "--count", defaultValue = "1", description = "Number of identifiers. Default: ${DEFAULT-VALUE}")
        int count;

        @Override
        public Integer call() {
            configureLogging(parent);
            if (count < 1) {
                throw new ParameterException(spec.commandLine(), "--count must be at least 1");
            }
            ToonGenerator generator = new ToonGenerator();
            PrintWriter out = spec.commandLine().getOut();
            try {
                for (int i = 0; i < count; i++) {
                    out.println(timestamp == null ? generator.generate(prefix) : generator.generate(prefix, timestamp));
                }
            } catch (ToonValidationException e) {
                throw new ParameterException(spec.commandLine(), e.getMessage());
            }
            out.flush();
            return 0;
        }
    }

    @Command(name = "inspect", mixinStandardHelpOptions = true,
            description = "Prints the parts of an identifier.")
    static class Inspect implements Callable<Integer> {

        @ParentCommand
        ToonCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "ID", description = "TOON identifier.")
        String toonId;

        @Override
        public Integer call() {
            configureLogging(parent);
            ToonId id;
            try {
                id = new ToonGenerator().parse(toonId);
            } catch (ToonValidationException e) {
                throw new ParameterException(spec.commandLine(), e.getMessage());
            }
            PrintWriter out = spec.commandLine().getOut();
            out.println("id:           " + id.value());
            out.println("type:         " + id.type());
            out.println("subtype:      " + id.subtype());
            out.println("ulid:         " + id.ulid());
            out.println("timestamp_ms: " + id.timestampMs());
            out.println("created_at:   " + id.createdAt());
            out.flush();
            return 0;
        }
    }

    private static void configureLogging(ToonCommand toon) {
        if (toon != null && toon.parent != null) {
            toon.parent.configureLogging();
        }
    }
}
