package com.company.datasetsplitter.source;

import com.company.datasetsplitter.table.Table;
import com.company.datasetsplitter.table.TabularQuery;
import com.company.datasetsplitter.writer.ParquetTableWriter;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalOutputFile;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.MessageTypeParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ParquetRowSource
 */
class ParquetRowSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReadFooterColumnsAndRowsAsText() throws IOException {
        // Given
        Path file = writeSample("sales.parquet");

        // When
        ParquetRowSource source = new ParquetRowSource(file);
        Table table = TabularQuery.of(source).collect();

        // Then
        assertThat(source.columnNames()).containsExactly("region", "val", "unit price");
        assertThat(table.getRowCount()).isEqualTo(3);
        assertThat(table.getRows().get(0)).containsExactly("EU", "1", "9.99");
        assertThat(table.getRows().get(2)).containsExactly(null, "3", null);
    }

    @Test
    void shouldReadOnlyProjectedColumns() throws IOException {
        // Given
        Path file = writeSample("projected.parquet");

        // When
        Table table = TabularQuery.of(new ParquetRowSource(file)).select("unit price", "region").collect();

        // Then
        assertThat(table.getColumns()).containsExactly("unit price", "region");
        assertThat(table.getRows().get(1)).containsExactly("5", "US");
    }

    @Test
    void shouldFilterOnColumnValues() throws IOException {
        // Given
        Path file = writeSample("filtered.parquet");

        // When
        Table table = TabularQuery.of(new ParquetRowSource(file))
                .filterEquals("region", "US")
                .exclude("region")
                .collect();

        // Then
        assertThat(table.getColumns()).containsExactly("val", "unit price");
        assertThat(table.getRowCount()).isEqualTo(1);
        assertThat(table.getRows().get(0)).containsExactly("2", "5");
    }

    @Test
    void repeatedField_shouldAlwaysRenderBracketed() throws IOException {
        // Given
        MessageType schema = MessageTypeParser.parseMessageType(
                "message tagged { required binary region (UTF8); repeated binary tags (UTF8); }");
        SimpleGroupFactory groups = new SimpleGroupFactory(schema);
        Path file = tempDir.resolve("tagged.parquet");
        try (ParquetWriter<Group> writer = ExampleParquetWriter.builder(new LocalOutputFile(file))
                .withConf(new Configuration())
                .withType(schema)
                .build()) {
            writer.write(groups.newGroup().append("region", "EU").append("tags", "a"));
            writer.write(groups.newGroup().append("region", "US").append("tags", "a").append("tags", "b"));
            writer.write(groups.newGroup().append("region", "APAC"));
        }

        // When
        Table table = TabularQuery.of(new ParquetRowSource(file)).collect();

        // Then
        assertThat(table.getRows()).extracting(row -> row[1]).containsExactly("[a]", "[a, b]", "[]");
        assertThat(table.getRows()).extracting(row -> row[0]).containsExactly("EU", "US", "APAC");
    }

    private Path writeSample(String name) throws IOException {
        List<String[]> rows = new ArrayList<>();
        rows.add(new String[]{"EU", "1", "9.99"});
        rows.add(new String[]{"US", "2", "5"});
        rows.add(new String[]{null, "3", null});
        Path file = tempDir.resolve(name);
        new ParquetTableWriter(CompressionCodecName.SNAPPY)
                .write(new Table(List.of("region", "val", "unit price"), rows), file);
        return file;
    }
}
