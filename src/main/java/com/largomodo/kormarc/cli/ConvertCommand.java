package com.largomodo.kormarc.cli;

import com.largomodo.kormarc.KormarcCli;
import com.largomodo.kormarc.format.OutputFormat;
import com.largomodo.kormarc.parser.KormarcParser;
import com.largomodo.kormarc.parser.ParseMode;
import com.largomodo.kormarc.toon.ToonGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Converts record files into TOON documents (or MARCXML / line text).
 * <p>
 * Accepts a single positional input path (file or directory) and determines processing
 * mode via runtime inspection. A single file fails fast; a directory is converted in
 * batch mode where one bad record never stops the batch.
 * <p>
 * Smart defaults:
 * - File input without -o: outputs to current working directory
 * - Directory input without -o: outputs to <input>/output subdirectory
 * - Explicit -o flag: overrides all defaults
 */
@Command(
        name = "convert",
        mixinStandardHelpOptions = true,
        description = {
                "Parses KORMARC text records, assigns each a TOON identifier and writes <toon_id>.<ext>.",
                "A directory is scanned recursively for .txt and .mrk files and converted in batch mode."
        }
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @ParentCommand
    KormarcCli parent;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "INPUT",
            description = "A record file, or a directory of record files (.txt, .mrk).")
    File inputPath;

    @Option(names = {"-o", "--output-dir"},
            description = {
                    "The destination directory.",
                    "Defaults to '.' for a file and to <INPUT>/output for a directory."
            })
    File outputDir;

    @Option(names = "--format", defaultValue = "JSON",
            description = {
                    "Output format.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    OutputFormat format;

    @Option(names = "--strict", description = "Reject lines without content and data fields without subfield delimiter.")
    boolean strict;

    @Option(names = "--delimiter", defaultValue = "|", description = "Subfield delimiter. Default: ${DEFAULT-VALUE}")
    char delimiter;

    static boolean isRecordFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".txt") || name.endsWith(".mrk");
    }

    /**
     * Execute batch conversion with concurrent execution and fail-soft error handling.
     * <p>
     * Fixed thread pool sized to CPU cores. Bounded queue (2 * coreCount) limits memory
     * on large record collections; CallerRunsPolicy throttles submission when it is full.
     */
    private static void runBatch(Path inputRoot, Path outputRoot, RecordConverter converter) {
        int coreCount = Runtime.getRuntime().availableProcessors();
        ExecutorService executor = new ThreadPoolExecutor(
                coreCount,
                coreCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(2 * coreCount),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        final AtomicInteger successCount = new AtomicInteger(0);
        final AtomicInteger failCount = new AtomicInteger(0);

        ConversionObserver observer = new ConversionObserver() {
            @Override
            public void onSuccess(Path input, String toonId) {
                successCount.incrementAndGet();
            }

            @Override
            public void onFailure(Path input, Exception e) {
                failCount.incrementAndGet();
                log.error("FAILED: {} - {}", inputRoot.relativize(input), e.getMessage());
            }
        };

        try (Stream<Path> stream = Files.walk(inputRoot)) {
            stream.filter(path -> !path.startsWith(outputRoot))
                    .filter(path -> {
                        try {
                            return Files.isRegularFile(path);
                        } catch (UncheckedIOException e) {
                            log.warn("WARNING: Cannot access {} - skipping", inputRoot.relativize(path));
                            return false;
                        }
                    })
                    .filter(ConvertCommand::isRecordFile)
                    .forEach(recordPath -> executor.submit(() -> {
                        try {
                            MDC.put("record", recordPath.getFileName().toString());
                            observer.onStart(recordPath);
                            String toonId = converter.convert(recordPath, outputRoot);
                            observer.onSuccess(recordPath, toonId);
                        } catch (Exception e) {
                            // Worker must survive: the batch continues with the next record
                            observer.onFailure(recordPath, e);
                        } finally {
                            MDC.clear();
                        }
                        return null;
                    }));
        } catch (UncheckedIOException e) {
            log.error("WARNING: Directory traversal interrupted - {}", e.getCause().getMessage());
            log.error("Batch incomplete: {} successful, {} failed, some directories skipped",
                    successCount.get(), failCount.get());
            return;
        } catch (IOException e) {
            log.error("ERROR: Cannot traverse input directory: {}", e.getMessage());
            return;
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.MINUTES)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        log.info("Batch complete: {} successful, {} failed", successCount.get(), failCount.get());
    }

    @Override
    public Integer call() throws Exception {
        if (parent != null) {
            parent.configureLogging();
        }

        if (!inputPath.exists()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path does not exist: " + inputPath.getAbsolutePath());
        }
        if (!inputPath.canRead()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path is not readable (check permissions): " + inputPath.getAbsolutePath());
        }
        if (Character.isWhitespace(delimiter)) {
            throw new ParameterException(spec.commandLine(), "Subfield delimiter must not be whitespace");
        }

        if (outputDir == null) {
            outputDir = inputPath.isFile() ? new File(".") : new File(inputPath, "output");
        }
        if (outputDir.exists() && !outputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
        }
        Files.createDirectories(outputDir.toPath());

        KormarcParser parser = new KormarcParser(delimiter, strict ? ParseMode.STRICT : ParseMode.LENIENT);
        RecordConverter converter = new RecordConverter(parser, new ToonGenerator(), format);

        if (inputPath.isFile()) {
            String toonId = converter.convert(inputPath.toPath(), outputDir.toPath());
            spec.commandLine().getOut().println(toonId);
            spec.commandLine().getOut().flush();
            log.info("Conversion complete: {}", inputPath.getName());
        } else {
            runBatch(inputPath.toPath().toAbsolutePath(), outputDir.toPath().toAbsolutePath(), converter);
        }
        return 0;
    }
}
