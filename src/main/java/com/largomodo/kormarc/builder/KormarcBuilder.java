package com.largomodo.kormarc.builder;

import com.largomodo.kormarc.format.RecordTextWriter;
import com.largomodo.kormarc.format.ToonDocument;
import com.largomodo.kormarc.model.ControlField;
import com.largomodo.kormarc.model.DataField;
import com.largomodo.kormarc.model.KormarcRecord;
import com.largomodo.kormarc.model.Leader;
import com.largomodo.kormarc.model.RecordStatus;
import com.largomodo.kormarc.model.Subfield;
import com.largomodo.kormarc.model.TypeOfRecord;
import com.largomodo.kormarc.toon.ToonGenerator;
import com.largomodo.kormarc.toon.ToonId;
import com.largomodo.kormarc.util.IsbnUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Assembles a catalog record from typed {@link BookInfo}.
 * <p>
 * The record carries the National Library of Korea as cataloging agency (003, 040),
 * a control number from this builder's {@link ControlNumberSequence} and timestamps
 * taken from the injected {@link Clock}. Fields without input (author, publisher,
 * pages, KDC) are omitted rather than written empty.
 * <p>
 * Thread-safe: the sequence is atomic and every other collaborator is stateless.
 */
public class KormarcBuilder {

    private static final Logger log = LoggerFactory.getLogger(KormarcBuilder.class);

    static final int RECORD_LENGTH = 714;
    static final int BASE_ADDRESS = 205;
    static final String AGENCY = "NLK";
    static final String LANGUAGE = "kor";
    static final int FIXED_DATA_LENGTH = 40;

    private static final DateTimeFormatter TRANSACTION = DateTimeFormatter.ofPattern("yyyyMMddHHmmss", Locale.ROOT);
    private static final DateTimeFormatter ENTRY_DATE = DateTimeFormatter.ofPattern("yyMMdd", Locale.ROOT);

    private final ToonGenerator toonGenerator;
    private final ControlNumberSequence sequence;
    private final Clock clock;

    public KormarcBuilder() {
        this(new ToonGenerator(), new ControlNumberSequence(), Clock.systemDefaultZone());
    }

    public KormarcBuilder(ToonGenerator toonGenerator, ControlNumberSequence sequence, Clock clock) {
        if (toonGenerator == null || sequence == null || clock == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.toonGenerator = toonGenerator;
        this.sequence = sequence;
        this.clock = clock;
    }

    public KormarcRecord build(BookInfo info) {
        Objects.requireNonNull(info, "info must not be null");
        LocalDateTime now = LocalDateTime.now(clock);

        Leader leader = new Leader(RECORD_LENGTH, RecordStatus.INCREASE_IN_ENCODING_LEVEL,
                TypeOfRecord.LANGUAGE_MATERIAL, info.category().getBibliographicLevel(),
                'm', 'a', 2, 2, BASE_ADDRESS, ' ', ' ', ' ', "4500");

        KormarcRecord record = new KormarcRecord(leader, controlFields(info, now), dataFields(info));
        log.debug("Built record {} for ISBN {}", record.controlFields().get(0).data(), info.isbn());
        return record;
    }

    /**
     * Build the record and assign it a TOON identifier with the category's prefix.
     */
    public Built buildWithToon(BookInfo info) {
        KormarcRecord record = build(info);
        String toonId = toonGenerator.generate(info.category().getToonPrefix(), clock.millis());
        return new Built(record, toonId);
    }

    /**
     * Build the record together with its stored document form.
     */
    public ToonDocument buildDocument(BookInfo info) {
        Built built = buildWithToon(info);
        ToonId id = toonGenerator.parse(built.toonId());
        return new ToonDocument(id.value(), id.createdAt(), id.type(), IsbnUtil.normalize(info.isbn()),
                new RecordTextWriter().write(built.record()), built.record());
    }

    private List<ControlField> controlFields(BookInfo info, LocalDateTime now) {
        String year = publicationYear(info).orElse(String.valueOf(now.getYear()));
        String fixedData = padRight(now.format(ENTRY_DATE) + "s" + year + "    " + LANGUAGE + "  "
                + info.category().getFormCode(), FIXED_DATA_LENGTH);

        return List.of(
                new ControlField("001", sequence.next()),
                new ControlField("003", AGENCY),
                new ControlField("005", now.format(TRANSACTION) + ".0"),
                new ControlField("008", fixedData));
    }

    private List<DataField> dataFields(BookInfo info) {
        List<DataField> fields = new ArrayList<>();

        fields.add(new DataField("040", ' ', ' ', List.of(
                new Subfield('a', AGENCY),
                new Subfield('b', LANGUAGE),
                new Subfield('c', "(" + AGENCY + ")"),
                new Subfield('d', AGENCY),
                new Subfield('e', "KORMARC2014"))));

        fields.add(new DataField("020", ' ', ' ', List.of(new Subfield('a', info.isbn()))));

        if (hasText(info.author())) {
            fields.add(new DataField("100", '1', ' ', List.of(new Subfield('a', info.author()))));
        }

        fields.add(new DataField("245", '0', ' ', List.of(new Subfield('a', info.title()))));

        List<Subfield> publication = new ArrayList<>();
        if (hasText(info.publisher())) {
            publication.add(new Subfield('b', info.publisher()));
        }
        if (hasText(info.pubYear())) {
            publication.add(new Subfield('c', "c" + info.pubYear()));
        }
        if (!publication.isEmpty()) {
            fields.add(new DataField("260", ' ', ' ', publication));
        }

        if (info.pages() != null && info.pages() > 0) {
            fields.add(new DataField("300", ' ', ' ', List.of(new Subfield('a', info.pages() + "p"))));
        }

        if (hasText(info.kdc())) {
            fields.add(new DataField("082", '0', '4', List.of(new Subfield('a', info.kdc()))));
            KdcMainClass.fromKdc(info.kdc()).ifPresent(mainClass ->
                    fields.add(new DataField("650", ' ', '8', List.of(new Subfield('a', mainClass.getLabel())))));
        }

        return fields;
    }

    private static Optional<String> publicationYear(BookInfo info) {
        String pubYear = info.pubYear();
        if (pubYear == null || pubYear.length() < 4 || !IsbnUtil.isDigits(pubYear.substring(0, 4))) {
            return Optional.empty();
        }
        return Optional.of(pubYear.substring(0, 4));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String padRight(String value, int length) {
        if (value.length() >= length) {
            return value;
        }
        return value + " ".repeat(length - value.length());
    }

    /**
     * A built record with its TOON identifier.
     */
    public record Built(KormarcRecord record, String toonId) {
    }
}
