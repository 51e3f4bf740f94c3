package com.largomodo.kormarc.cli;

import com.largomodo.kormarc.KormarcCli;
import com.largomodo.kormarc.builder.BookCategory;
import com.largomodo.kormarc.builder.BookInfo;
import com.largomodo.kormarc.builder.BookInfoValidator;
import com.largomodo.kormarc.builder.KormarcBuilder;
import com.largomodo.kormarc.format.RecordJsonCodec;
import com.largomodo.kormarc.format.ToonDocument;
import com.largomodo.kormarc.store.DirectoryRecordStore;
import com.largomodo.kormarc.validation.ValidationError;
import com.largomodo.kormarc.validation.ValidationResult;
import com.largomodo.kormarc.validation.ValidationWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Assembles a record from book information and prints its TOON document.
 * <p>
 * The input is checked first; any error stops the build with exit code
 * {@value KormarcCli#EXIT_VALIDATION_FAILED}, warnings are only logged.
 */
@Command(
        name = "build",
        mixinStandardHelpOptions = true,
        description = "Builds a KORMARC record from book information and prints its TOON document as JSON."
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @ParentCommand
    KormarcCli parent;

    @Spec
    CommandSpec spec;

    @Option(names = "--isbn", required = true, description = "ISBN-10 or ISBN-13.")
    String isbn;

    @Option(names = "--title", required = true, description = "Title proper.")
    String title;

    @Option(names = "--author", description = "Main author.")
    String author;

    @Option(names = "--publisher", description = "Publisher.")
    String publisher;

    @Option(names = "--year", paramLabel = "YYYY[MM]", description = "Publication year.")
    String pubYear;

    @Option(names = "--pages", description = "Page count.")
    Integer pages;

    @Option(names = "--kdc", description = "Korean Decimal Classification number.")
    String kdc;

    @Option(names = "--category", defaultValue = "BOOK",
            description = "Valid values: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    BookCategory category;

    @Option(names = "--price", description = "Price in won.")
    Integer price;

    @Option(names = "--description", description = "Free-text description.")
    String description;

    @Option(names = {"-o", "--output-dir"}, description = "Also store the document as <toon_id>.json in this directory.")
    File outputDir;

    @Override
    public Integer call() throws Exception {
        if (parent != null) {
            parent.configureLogging();
        }

        BookInfo info = new BookInfo(isbn, title, author, publisher, pubYear, pages, kdc, category, price, description);

        ValidationResult check = new BookInfoValidator().validate(info);
        for (ValidationWarning warning : check.warnings()) {
            log.warn("{}: {}", warning.fieldTag(), warning.message());
        }
        if (!check.passed()) {
            for (ValidationError error : check.errors()) {
                log.error("FAILED: {} - {}", error.fieldTag() == null ? "input" : error.fieldTag(), error.message());
            }
            return KormarcCli.EXIT_VALIDATION_FAILED;
        }

        ToonDocument document = new KormarcBuilder().buildDocument(info);
        if (outputDir != null) {
            Path file = new DirectoryRecordStore(outputDir.toPath()).save(document);
            log.info("Stored {}", file);
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println(new RecordJsonCodec().toJson(document));
        out.flush();
        return 0;
    }
}
