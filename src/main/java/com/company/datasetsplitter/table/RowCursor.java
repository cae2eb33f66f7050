package com.company.datasetsplitter.table;

import java.io.Closeable;
import java.io.IOException;

/**
 * Forward-only iteration over the rows of a {@link RowSource}.
 */
public interface RowCursor extends Closeable {

    /**
     * @return the next row, or {@code null} once the source is exhausted
     */
    String[] next() throws IOException;

    @Override
    default void close() throws IOException {
    }
}
