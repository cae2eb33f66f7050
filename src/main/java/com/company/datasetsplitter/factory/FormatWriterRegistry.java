package com.company.datasetsplitter.factory;

import com.company.datasetsplitter.exception.UnsupportedFormatException;
import com.company.datasetsplitter.model.OutputFormat;
import com.company.datasetsplitter.writer.DelimitedTableWriter;
import com.company.datasetsplitter.writer.ParquetTableWriter;
import com.company.datasetsplitter.writer.SpreadsheetTableWriter;
import com.company.datasetsplitter.writer.TableWriter;
import com.company.datasetsplitter.writer.WriterOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps an output format identifier to the writer for its family.
 * Following Factory Pattern: the writer is selected once per run and reused for every partition.
 */
@Slf4j
@Component
public class FormatWriterRegistry {

    /**
     * Resolve the writer for {@code formatId}.
     * @throws UnsupportedFormatException for an unknown identifier, before any file is touched
     */
    public TableWriter lookup(String formatId, WriterOptions options) {
        return lookup(OutputFormat.fromId(formatId), options);
    }

    public TableWriter lookup(OutputFormat format, WriterOptions options) {
        WriterOptions effective = options != null ? options : WriterOptions.defaults();
        log.debug("Creating {} writer for output format {}", format.getWriterKind(), format);

        switch (format.getWriterKind()) {
            case DELIMITED:
                return new DelimitedTableWriter(effective.getSeparator());
            case COLUMNAR:
                return new ParquetTableWriter(effective.getCompression());
            case SPREADSHEET:
                return new SpreadsheetTableWriter(effective.getSheetName());
            default:
                throw new UnsupportedFormatException(format.getExtension());
        }
    }
}
