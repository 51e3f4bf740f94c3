package com.largomodo.kormarc.store;

import com.largomodo.kormarc.format.RecordConversionException;
import com.largomodo.kormarc.format.RecordJsonCodec;
import com.largomodo.kormarc.format.ToonDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-system record store: one TOON document per {@code <toon_id>.json} file in a
 * single directory.
 * <p>
 * {@link #records()} lists files in name order, which for one type prefix is creation
 * order. A file whose content is not a TOON document is still listed with its raw
 * text, so that consumers can decide to skip it.
 */
public class DirectoryRecordStore implements RecordSource {

    private static final Logger log = LoggerFactory.getLogger(DirectoryRecordStore.class);
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final RecordJsonCodec codec;

    public DirectoryRecordStore(Path directory) {
        this(directory, new RecordJsonCodec());
    }

    public DirectoryRecordStore(Path directory, RecordJsonCodec codec) {
        if (directory == null || codec == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.directory = directory;
        this.codec = codec;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Write a document, replacing any previous document with the same identifier.
     *
     * @return the written file
     */
    public Path save(ToonDocument document) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(document.toonId() + EXTENSION);
        Files.writeString(file, codec.toJson(document), StandardCharsets.UTF_8);
        return file;
    }

    public Optional<ToonDocument> load(String toonId) throws IOException {
        Path file = directory.resolve(toonId + EXTENSION);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(codec.documentFromJson(Files.readString(file, StandardCharsets.UTF_8)));
    }

    @Override
    public Stream<StoredRecord> records() throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Record store is not a directory: " + directory);
        }
        return Files.list(directory)
                .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                .filter(Files::isRegularFile)
                .sorted()
                .map(this::read)
                .filter(Objects::nonNull);
    }

    private StoredRecord read(Path file) {
        String name = file.getFileName().toString();
        String toonId = name.substring(0, name.length() - EXTENSION.length());
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("WARNING: Cannot read {} - skipping", name);
            return null;
        }
        try {
            return new StoredRecord(toonId, codec.parsedMember(content));
        } catch (RecordConversionException e) {
            log.debug("{} is not a TOON document: {}", name, e.getMessage());
            return new StoredRecord(toonId, content);
        }
    }
}
