package io.github.yok.flexload.parser;

import java.io.Closeable;
import java.util.Iterator;

/**
 * Lazy, finite, non-restartable sequence of source rows. The first row is the header row.
 *
 * <p>
 * Read failures during iteration surface as {@link java.io.UncheckedIOException}. Records that
 * can be skipped are skipped by the implementation and counted in {@link #getSkippedRows()}.
 * </p>
 */
public interface TabularSource extends Iterator<SourceRow>, Closeable {

    /**
     * Returns the number of physical records that could not be parsed and were skipped.
     *
     * @return skipped record count so far
     */
    long getSkippedRows();

    /**
     * Returns a short description of the source for logs (file name and sheet).
     *
     * @return description
     */
    String describe();

    /**
     * Returns the name of the sheet being read.
     *
     * @return sheet name, or {@code null} for sources without sheets
     */
    default String getSheetName() {
        return null;
    }
}
