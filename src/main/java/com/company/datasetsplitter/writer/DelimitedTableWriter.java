package com.company.datasetsplitter.writer;

import com.company.datasetsplitter.model.WriterKind;
import com.company.datasetsplitter.table.Table;
import com.opencsv.CSVWriter;
import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Header line followed by one line per row. Fields are quoted only when they contain the separator,
 * a quote or a line break; nulls are written as empty fields.
 */
public class DelimitedTableWriter extends AbstractTableWriter {

    private final char separator;

    public DelimitedTableWriter(char separator) {
        this.separator = separator;
    }

    public char getSeparator() {
        return separator;
    }

    @Override
    public WriterKind getKind() {
        return WriterKind.DELIMITED;
    }

    @Override
    protected void writeFile(Table table, Path file) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             ICSVWriter csvWriter = new CSVWriterBuilder(out)
                     .withSeparator(separator)
                     .withQuoteChar(CSVWriter.DEFAULT_QUOTE_CHARACTER)
                     .withEscapeChar(CSVWriter.DEFAULT_QUOTE_CHARACTER)
                     .withLineEnd("\n")
                     .build()) {
            csvWriter.writeNext(table.getColumns().toArray(new String[0]), false);
            for (String[] row : table.getRows()) {
                csvWriter.writeNext(row, false);
            }
            csvWriter.flush();
            if (csvWriter.checkError()) {
                throw new IOException("Delimited write to " + file + " failed");
            }
        }
    }
}
