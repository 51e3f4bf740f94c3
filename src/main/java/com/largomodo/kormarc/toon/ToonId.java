package com.largomodo.kormarc.toon;

import java.time.Instant;
import java.util.Objects;

/**
 * Decoded parts of a TOON identifier.
 *
 * @param type        full type prefix, lowercase (e.g. {@code kormarc_book})
 * @param subtype     every prefix segment after the first, joined by {@code _}; empty for single-segment prefixes
 * @param ulid        26-symbol Base32 payload, uppercase
 * @param timestampMs creation time in Unix milliseconds (48 bits)
 * @param createdAt   creation time as a UTC instant
 */
public record ToonId(String type, String subtype, String ulid, long timestampMs, Instant createdAt) {

    public ToonId {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(subtype, "subtype must not be null");
        Objects.requireNonNull(ulid, "ulid must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    /**
     * @return canonical identifier string: lowercase prefix, uppercase payload
     */
    public String value() {
        return type + "_" + ulid;
    }
}
