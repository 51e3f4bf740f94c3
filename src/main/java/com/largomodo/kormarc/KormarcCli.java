package com.largomodo.kormarc;

import com.largomodo.kormarc.cli.BuildCommand;
import com.largomodo.kormarc.cli.ConvertCommand;
import com.largomodo.kormarc.cli.ToonCommand;
import com.largomodo.kormarc.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.util.concurrent.Callable;

/**
 * CLI entry point for the KORMARC toolkit.
 * <p>
 * Uses Picocli framework for argument parsing with automatic help generation.
 * The root command only carries shared options; the work is done by subcommands:
 * <ul>
 *   <li>{@code convert}: parse record files into TOON documents, MARCXML or line text</li>
 *   <li>{@code validate}: run the validation tiers over a record store</li>
 *   <li>{@code toon}: generate and inspect TOON identifiers</li>
 *   <li>{@code build}: assemble a record from book information</li>
 * </ul>
 */
@Command(
        name = "kormarc",
        mixinStandardHelpOptions = true,
        resourceBundle = "kormarc.kormarc",
        version = "${bundle:application.version}",
        header = "Parses, identifies and validates KORMARC bibliographic records.",
        description = {
                "Reads catalog records in the line-oriented KORMARC notation, assigns time-ordered TOON" +
                        " identifiers and checks records against structural, semantic and institution rules.",
        },
        subcommands = {
                ConvertCommand.class,
                ValidateCommand.class,
                ToonCommand.class,
                BuildCommand.class
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, malformed records, etc.)",
                "2:Invalid command line arguments",
                "3:At least one record or input failed validation"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "MARCXML: ${bundle:application.url}"
        }
)
public class KormarcCli implements Callable<Integer> {

    public static final int EXIT_VALIDATION_FAILED = 3;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    boolean verbose;

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new KormarcCli());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        return cmd;
    }

    /**
     * Apply shared options. Subcommands call this before doing any work.
     */
    public void configureLogging() {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }
    }

    @Override
    public Integer call() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
