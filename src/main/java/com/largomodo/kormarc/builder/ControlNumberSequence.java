package com.largomodo.kormarc.builder;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of 001 control numbers: twelve digits, zero padded, strictly increasing.
 * <p>
 * Each builder owns its sequence. Concurrent callers never receive the same number.
 */
public class ControlNumberSequence {

    public static final long DEFAULT_START = 100_000L;
    private static final long MAX = 999_999_999_999L;

    private final AtomicLong next;

    public ControlNumberSequence() {
        this(DEFAULT_START);
    }

    public ControlNumberSequence(long start) {
        if (start < 0 || start > MAX) {
            throw new IllegalArgumentException("Control number start must be between 0 and " + MAX + ", got: " + start);
        }
        this.next = new AtomicLong(start);
    }

    /**
     * @return the next control number
     * @throws IllegalStateException once twelve digits are exhausted
     */
    public String next() {
        long value = next.getAndIncrement();
        if (value > MAX) {
            throw new IllegalStateException("Control number sequence exhausted");
        }
        return String.format(Locale.ROOT, "%012d", value);
    }
}
