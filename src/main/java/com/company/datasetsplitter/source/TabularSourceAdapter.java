package com.company.datasetsplitter.source;

import com.company.datasetsplitter.exception.UnreadableSourceException;
import com.company.datasetsplitter.model.SourceFormat;
import com.company.datasetsplitter.table.RowSource;
import com.company.datasetsplitter.table.TabularQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens a file as a deferred query. No rows are read here; every column is exposed as uninterpreted text.
 */
@Slf4j
@Component
public class TabularSourceAdapter {

    public TabularQuery open(Path path, SourceFormat format, char separator) {
        String fileName = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new UnreadableSourceException("Cannot open " + path, fileName);
        }
        if (format == null) {
            throw UnreadableSourceException.unrecognizedFormat(fileName, null);
        }

        RowSource source;
        switch (format) {
            case DELIMITED:
                source = new DelimitedRowSource(path, separator);
                break;
            case COLUMNAR:
                source = new ParquetRowSource(path);
                break;
            default:
                throw UnreadableSourceException.unrecognizedFormat(fileName, format.getTag());
        }
        log.debug("Opened {} as {} source", fileName, format.getTag());
        return TabularQuery.of(source);
    }

    /**
     * Same as {@link #open(Path, SourceFormat, char)} with the format given as a tag
     * ({@code delimited}, {@code columnar}) or a file extension ({@code csv}, {@code txt}, {@code parquet}).
     */
    public TabularQuery open(Path path, String formatTag, char separator) {
        SourceFormat format = SourceFormat.fromTag(formatTag)
                .orElseThrow(() -> UnreadableSourceException.unrecognizedFormat(
                        String.valueOf(path.getFileName()), formatTag));
        return open(path, format, separator);
    }
}
