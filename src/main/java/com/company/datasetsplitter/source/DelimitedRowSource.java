package com.company.datasetsplitter.source;

import com.company.datasetsplitter.exception.UnreadableSourceException;
import com.company.datasetsplitter.table.RowCursor;
import com.company.datasetsplitter.table.RowSource;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Delimited text file whose first record is the header. Every field is read as text; an empty field is null.
 * A quote only opens a quoted field at the start of a field, see {@link FieldStartQuoteParser}.
 */
@Slf4j
public class DelimitedRowSource implements RowSource {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final Path path;
    private final char separator;
    private volatile List<String> header;

    public DelimitedRowSource(Path path, char separator) {
        this.path = path;
        this.separator = separator;
    }

    @Override
    public String getName() {
        return path.getFileName().toString();
    }

    public char getSeparator() {
        return separator;
    }

    @Override
    public List<String> columnNames() {
        List<String> columns = header;
        if (columns == null) {
            synchronized (this) {
                columns = header;
                if (columns == null) {
                    columns = readHeader();
                    header = columns;
                }
            }
        }
        return columns;
    }

    @Override
    public RowCursor open(List<String> projection) throws IOException {
        List<String> columns = columnNames();
        int[] indexes = new int[projection.size()];
        for (int i = 0; i < indexes.length; i++) {
            indexes[i] = columns.indexOf(projection.get(i));
        }

        CSVReader reader = newReader();
        try {
            // header already parsed by columnNames()
            reader.readNext();
        } catch (CsvValidationException | IOException e) {
            reader.close();
            throw new UnreadableSourceException("Failed to read header of " + getName(), getName(), e);
        }
        return new DelimitedCursor(reader, columns.size(), indexes);
    }

    private List<String> readHeader() {
        if (!Files.isReadable(path)) {
            throw new UnreadableSourceException("Cannot open " + path, getName());
        }
        try (CSVReader reader = newReader()) {
            String[] fields = reader.readNext();
            if (fields == null) {
                log.debug("{} is empty, no columns declared", getName());
                return Collections.emptyList();
            }
            if (fields.length > 0 && !fields[0].isEmpty() && fields[0].charAt(0) == BYTE_ORDER_MARK) {
                fields[0] = fields[0].substring(1);
            }
            Set<String> seen = new HashSet<>();
            for (String field : fields) {
                if (!seen.add(field)) {
                    throw new UnreadableSourceException(
                            "Duplicate column name '" + field + "' in header of " + getName(), getName());
                }
            }
            return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(fields)));
        } catch (IOException | CsvValidationException e) {
            throw new UnreadableSourceException("Failed to read header of " + getName(), getName(), e);
        }
    }

    private CSVReader newReader() throws IOException {
        return new CSVReaderBuilder(Files.newBufferedReader(path, StandardCharsets.UTF_8))
                .withCSVParser(new FieldStartQuoteParser(separator))
                .build();
    }

    private final class DelimitedCursor implements RowCursor {

        private final CSVReader reader;
        private final int width;
        private final int[] indexes;

        private DelimitedCursor(CSVReader reader, int width, int[] indexes) {
            this.reader = reader;
            this.width = width;
            this.indexes = indexes;
        }

        @Override
        public String[] next() throws IOException {
            String[] fields;
            do {
                try {
                    fields = reader.readNext();
                } catch (CsvValidationException e) {
                    throw UnreadableSourceException.malformedRow(getName(), reader.getLinesRead(), e.getMessage());
                }
                if (fields == null) {
                    return null;
                }
            } while (isBlankLine(fields));

            if (fields.length > width) {
                throw UnreadableSourceException.malformedRow(getName(), reader.getLinesRead(),
                        "expected " + width + " fields but found " + fields.length);
            }
            String[] row = new String[indexes.length];
            for (int i = 0; i < indexes.length; i++) {
                int index = indexes[i];
                row[i] = index < fields.length ? emptyToNull(fields[index]) : null;
            }
            return row;
        }

        private boolean isBlankLine(String[] fields) {
            return width > 1 && fields.length == 1 && fields[0].isEmpty();
        }

        @Override
        public void close() throws IOException {
            reader.close();
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
