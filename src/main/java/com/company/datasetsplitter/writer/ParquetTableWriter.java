package com.company.datasetsplitter.writer;

import com.company.datasetsplitter.model.WriterKind;
import com.company.datasetsplitter.table.Table;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalOutputFile;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Types;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Columnar writer. Every column is an optional UTF-8 string so nulls survive as nulls.
 */
public class ParquetTableWriter extends AbstractTableWriter {

    static final String SCHEMA_NAME = "partition";

    private final CompressionCodecName compression;

    public ParquetTableWriter(CompressionCodecName compression) {
        this.compression = compression;
    }

    public CompressionCodecName getCompression() {
        return compression;
    }

    @Override
    public WriterKind getKind() {
        return WriterKind.COLUMNAR;
    }

    @Override
    protected void writeFile(Table table, Path file) throws IOException {
        MessageType schema = schemaFor(table.getColumns());
        SimpleGroupFactory groups = new SimpleGroupFactory(schema);
        int width = table.getColumnCount();

        try (ParquetWriter<Group> writer = ExampleParquetWriter.builder(new LocalOutputFile(file))
                .withConf(new Configuration())
                .withType(schema)
                .withCompressionCodec(compression)
                .build()) {
            for (String[] row : table.getRows()) {
                Group group = groups.newGroup();
                for (int i = 0; i < width; i++) {
                    if (row[i] != null) {
                        group.add(i, Binary.fromString(row[i]));
                    }
                }
                writer.write(group);
            }
        }
    }

    static MessageType schemaFor(List<String> columns) {
        Types.MessageTypeBuilder builder = Types.buildMessage();
        for (String column : columns) {
            builder.optional(PrimitiveTypeName.BINARY)
                    .as(LogicalTypeAnnotation.stringType())
                    .named(column);
        }
        return builder.named(SCHEMA_NAME);
    }
}
