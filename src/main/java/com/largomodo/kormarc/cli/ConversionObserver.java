package com.largomodo.kormarc.cli;

import java.nio.file.Path;

/**
 * Observer interface for record conversion lifecycle events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override only
 * the events they care about.
 *
 * @see RecordConverter
 */
public interface ConversionObserver {

    /**
     * Called when conversion of an input file begins.
     *
     * @param input the record file being processed
     */
    default void onStart(Path input) {}

    /**
     * Called when a record was converted and written.
     *
     * @param input  the record file that was processed
     * @param toonId identifier assigned to the record
     */
    default void onSuccess(Path input, String toonId) {}

    /**
     * Called when conversion fails.
     *
     * @param input the record file that failed to convert
     * @param e     the exception that caused the failure
     */
    default void onFailure(Path input, Exception e) {}
}
