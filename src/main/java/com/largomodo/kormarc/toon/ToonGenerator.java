package com.largomodo.kormarc.toon;

import com.largomodo.kormarc.codec.CrockfordBase32;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generator and parser for TOON (Timestamp-Ordered Object Notation) identifiers.
 * <p>
 * Format: {@code <type_prefix>_<26 Base32 symbols>}, e.g.
 * {@code kormarc_book_01HZR9SYXR9VQJXJ9X8Y8Y8Y8Y}. The payload is the Crockford Base32
 * encoding of 16 bytes: a 48-bit big-endian millisecond timestamp followed by 80 random
 * bits. Identifiers with the same prefix therefore sort by creation time, then by the
 * random part. Uniqueness is probabilistic and needs no coordination.
 * <p>
 * Thread-safe: the only shared state is the {@link SecureRandom}, which is itself thread-safe.
 */
public class ToonGenerator {

    public static final int PAYLOAD_LENGTH = 26;
    public static final int TIMESTAMP_BYTES = 6;
    public static final int RANDOM_BYTES = 10;

    private static final long TIMESTAMP_MASK = 0xFFFF_FFFF_FFFFL;
    private static final Pattern PREFIX = Pattern.compile("^[a-z]+(?:_[a-z]+)*$");
    private static final Pattern TOON = Pattern.compile(
            "^([a-z]+(?:_[a-z]+)*)_([0-9a-hjkmnp-tv-z]{" + PAYLOAD_LENGTH + "})$");

    private final Clock clock;
    private final SecureRandom random;

    public ToonGenerator() {
        this(Clock.systemUTC(), new SecureRandom());
    }

    public ToonGenerator(Clock clock, SecureRandom random) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Generate an identifier stamped with the current time.
     */
    public String generate(String typePrefix) {
        return generate(typePrefix, clock.millis());
    }

    /**
     * Generate an identifier for the given millisecond timestamp with fresh random bits.
     */
    public String generate(String typePrefix, long timestampMs) {
        byte[] randomBytes = new byte[RANDOM_BYTES];
        random.nextBytes(randomBytes);
        return generate(typePrefix, timestampMs, randomBytes);
    }

    /**
     * Generate an identifier from explicit inputs. The random override exists for
     * deterministic tests.
     *
     * @param typePrefix  lowercase words joined by {@code _}, e.g. {@code kormarc_book}
     * @param timestampMs Unix milliseconds, truncated to 48 bits
     * @param randomBytes exactly 10 bytes
     * @return identifier in canonical form
     * @throws ToonValidationException if the prefix or random bytes are malformed
     */
    public String generate(String typePrefix, long timestampMs, byte[] randomBytes) {
        String prefix = normalizePrefix(typePrefix);
        if (randomBytes == null || randomBytes.length != RANDOM_BYTES) {
            throw new ToonValidationException("Random bytes must be exactly " + RANDOM_BYTES + " bytes");
        }

        long ts = timestampMs & TIMESTAMP_MASK;
        byte[] data = new byte[TIMESTAMP_BYTES + RANDOM_BYTES];
        for (int i = 0; i < TIMESTAMP_BYTES; i++) {
            data[i] = (byte) (ts >>> (8 * (TIMESTAMP_BYTES - 1 - i)));
        }
        System.arraycopy(randomBytes, 0, data, TIMESTAMP_BYTES, RANDOM_BYTES);

        String payload = CrockfordBase32.encode(data).substring(0, PAYLOAD_LENGTH);
        return prefix + "_" + payload;
    }

    /**
     * Parse an identifier. Matching is case-insensitive and ignores surrounding whitespace.
     *
     * @throws ToonValidationException if the identifier does not match the TOON format
     */
    public ToonId parse(String toonId) {
        if (toonId == null) {
            throw new ToonValidationException("Invalid TOON format: null");
        }
        Matcher m = TOON.matcher(toonId.strip().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw new ToonValidationException("Invalid TOON format: " + toonId);
        }

        String type = m.group(1);
        String ulid = m.group(2).toUpperCase(Locale.ROOT);

        byte[] decoded = CrockfordBase32.decode(ulid);
        long timestampMs = 0;
        for (int i = 0; i < TIMESTAMP_BYTES; i++) {
            timestampMs = (timestampMs << 8) | (decoded[i] & 0xFF);
        }

        int firstSeparator = type.indexOf('_');
        String subtype = firstSeparator < 0 ? "" : type.substring(firstSeparator + 1);

        return new ToonId(type, subtype, ulid, timestampMs, Instant.ofEpochMilli(timestampMs));
    }

    /**
     * @return true iff {@link #parse(String)} accepts the identifier
     */
    public boolean validate(String toonId) {
        try {
            parse(toonId);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public Instant extractTimestamp(String toonId) {
        return parse(toonId).createdAt();
    }

    private static String normalizePrefix(String typePrefix) {
        if (typePrefix == null) {
            throw new ToonValidationException("Type prefix must not be null");
        }
        String prefix = typePrefix.toLowerCase(Locale.ROOT);
        if (!PREFIX.matcher(prefix).matches()) {
            throw new ToonValidationException(
                    "Invalid type prefix '" + typePrefix + "': expected lowercase words joined by '_'");
        }
        return prefix;
    }
}
