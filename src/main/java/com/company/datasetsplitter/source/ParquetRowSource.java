package com.company.datasetsplitter.source;

import com.company.datasetsplitter.exception.UnreadableSourceException;
import com.company.datasetsplitter.table.RowCursor;
import com.company.datasetsplitter.table.RowSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.api.InitContext;
import org.apache.parquet.hadoop.api.ReadSupport;
import org.apache.parquet.hadoop.example.GroupReadSupport;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.LocalInputFile;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Parquet file read through the example {@link Group} model. Only the projected top-level columns are
 * requested from the reader, so unused column chunks are never decoded. Values are rendered as text.
 */
@Slf4j
public class ParquetRowSource implements RowSource {

    private final Path path;
    private volatile MessageType fileSchema;

    public ParquetRowSource(Path path) {
        this.path = path;
    }

    @Override
    public String getName() {
        return path.getFileName().toString();
    }

    @Override
    public List<String> columnNames() {
        return schema().getFields().stream()
                .map(Type::getName)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public RowCursor open(List<String> projection) throws IOException {
        MessageType schema = schema();
        List<Type> fields = new ArrayList<>(projection.size());
        for (String column : projection) {
            fields.add(schema.getType(column));
        }
        MessageType requested = new MessageType(schema.getName(), fields);
        log.debug("Reading {} with projection {}", getName(), projection);

        ParquetReader<Group> reader = new ProjectedReaderBuilder(new LocalInputFile(path), requested)
                .withConf(new Configuration())
                .build();
        return new ParquetCursor(reader, projection.size());
    }

    private MessageType schema() {
        MessageType schema = fileSchema;
        if (schema == null) {
            synchronized (this) {
                schema = fileSchema;
                if (schema == null) {
                    schema = readFooterSchema();
                    fileSchema = schema;
                }
            }
        }
        return schema;
    }

    private MessageType readFooterSchema() {
        if (!Files.isReadable(path)) {
            throw new UnreadableSourceException("Cannot open " + path, getName());
        }
        try (ParquetFileReader reader = ParquetFileReader.open(new LocalInputFile(path))) {
            return reader.getFooter().getFileMetaData().getSchema();
        } catch (IOException | RuntimeException e) {
            throw new UnreadableSourceException("Failed to read Parquet footer of " + getName(), getName(), e);
        }
    }

    /**
     * Optional and required fields render as their single value, or null when absent. Repeated fields always
     * render bracketed, {@code []} when empty.
     */
    static String render(Group group, int fieldIndex) {
        int repetitions = group.getFieldRepetitionCount(fieldIndex);
        if (!group.getType().getType(fieldIndex).isRepetition(Type.Repetition.REPEATED)) {
            return repetitions == 0 ? null : renderValue(group, fieldIndex, 0);
        }
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (int i = 0; i < repetitions; i++) {
            joiner.add(renderValue(group, fieldIndex, i));
        }
        return joiner.toString();
    }

    private static String renderValue(Group group, int fieldIndex, int index) {
        if (group.getType().getType(fieldIndex).isPrimitive()) {
            return group.getValueToString(fieldIndex, index);
        }
        return group.getGroup(fieldIndex, index).toString().trim();
    }

    private static final class ParquetCursor implements RowCursor {

        private final ParquetReader<Group> reader;
        private final int width;

        private ParquetCursor(ParquetReader<Group> reader, int width) {
            this.reader = reader;
            this.width = width;
        }

        @Override
        public String[] next() throws IOException {
            Group group = reader.read();
            if (group == null) {
                return null;
            }
            String[] row = new String[width];
            for (int i = 0; i < width; i++) {
                row[i] = render(group, i);
            }
            return row;
        }

        @Override
        public void close() throws IOException {
            reader.close();
        }
    }

    private static final class ProjectedReaderBuilder extends ParquetReader.Builder<Group> {

        private final MessageType requested;

        private ProjectedReaderBuilder(InputFile file, MessageType requested) {
            super(file);
            this.requested = requested;
        }

        @Override
        protected ReadSupport<Group> getReadSupport() {
            return new GroupReadSupport() {
                @Override
                public ReadContext init(InitContext context) {
                    return new ReadContext(requested, Collections.emptyMap());
                }
            };
        }
    }
}
