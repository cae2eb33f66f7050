package com.company.datasetsplitter.writer;

import com.company.datasetsplitter.model.WriterKind;
import com.company.datasetsplitter.table.Table;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serializes a realized table to one file.
 * Following Interface Segregation Principle
 */
public interface TableWriter {

    WriterKind getKind();

    /**
     * Write the whole table to {@code target}, replacing any existing file.
     * Either the complete file appears at {@code target} or nothing does.
     * @throws IOException if serialization or the final move fails
     */
    void write(Table table, Path target) throws IOException;
}
