package com.largomodo.kormarc.cli;

import com.largomodo.kormarc.format.MarcXmlWriter;
import com.largomodo.kormarc.format.OutputFormat;
import com.largomodo.kormarc.format.RecordTextWriter;
import com.largomodo.kormarc.format.ToonDocument;
import com.largomodo.kormarc.model.KormarcRecord;
import com.largomodo.kormarc.parser.KormarcParser;
import com.largomodo.kormarc.store.DirectoryRecordStore;
import com.largomodo.kormarc.toon.RecordTypeClassifier;
import com.largomodo.kormarc.toon.ToonGenerator;
import com.largomodo.kormarc.toon.ToonId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts one record file: parse, classify, assign a TOON identifier, write.
 * <p>
 * Output goes to {@code <output>/<toon_id>.<ext>}; JSON output is a TOON document and
 * the output directory doubles as a {@link DirectoryRecordStore}.
 * <p>
 * Stateless apart from its collaborators, all of which are thread-safe, so one
 * instance serves every batch worker.
 */
public class RecordConverter {

    private static final Logger log = LoggerFactory.getLogger(RecordConverter.class);

    private final KormarcParser parser;
    private final ToonGenerator toonGenerator;
    private final OutputFormat format;

    public RecordConverter(KormarcParser parser, ToonGenerator toonGenerator, OutputFormat format) {
        if (parser == null || toonGenerator == null || format == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.parser = parser;
        this.toonGenerator = toonGenerator;
        this.format = format;
    }

    /**
     * @return identifier assigned to the converted record
     * @throws IOException if the input cannot be read or parsed, or the output cannot be written
     */
    public String convert(Path input, Path outputDir) throws IOException {
        log.info("Processing: {}", input.getFileName());
        KormarcRecord record = parser.parseFile(input);

        String prefix = RecordTypeClassifier.classify(record);
        ToonId id = toonGenerator.parse(toonGenerator.generate(prefix));

        Path written = switch (format) {
            case JSON -> new DirectoryRecordStore(outputDir).save(ToonDocument.of(id, record));
            case XML -> writeString(outputDir, id, new MarcXmlWriter().write(record));
            case TEXT -> writeString(outputDir, id, new RecordTextWriter(parser.getDelimiter()).write(record));
        };
        log.info("Converted {} -> {}", input.getFileName(), written.getFileName());
        return id.value();
    }

    private Path writeString(Path outputDir, ToonId id, String content) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(id.value() + "." + format.getFileExtension());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
