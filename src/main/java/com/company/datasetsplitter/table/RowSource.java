package com.company.datasetsplitter.table;

import java.io.IOException;
import java.util.List;

/**
 * A readable tabular origin: a file on disk or an already materialized table.
 * Every value is exposed as uninterpreted text; {@code null} marks a missing value.
 */
public interface RowSource {

    /**
     * Name used in log lines and error messages, usually the file name.
     */
    String getName();

    /**
     * Declared column names in source order. Reads at most the header or footer, never the rows.
     */
    List<String> columnNames();

    /**
     * Opens a cursor that yields, for each row, the values of {@code projection} in that order.
     * @param projection subset of {@link #columnNames()}, in source order
     */
    RowCursor open(List<String> projection) throws IOException;
}
