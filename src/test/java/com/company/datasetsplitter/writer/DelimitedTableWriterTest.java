package com.company.datasetsplitter.writer;

import com.company.datasetsplitter.table.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DelimitedTableWriter
 */
class DelimitedTableWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteHeaderAndRowsQuotingOnlyWhenNeeded() throws IOException {
        // Given
        List<String[]> rows = new ArrayList<>();
        rows.add(new String[]{"1", "plain"});
        rows.add(new String[]{"2", "a,b"});
        rows.add(new String[]{"3", null});
        rows.add(new String[]{"4", "say \"hi\""});
        Table table = new Table(List.of("val", "note"), rows);
        Path target = tempDir.resolve("out.csv");

        // When
        new DelimitedTableWriter(',').write(table, target);

        // Then
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo(
                "val,note\n1,plain\n2,\"a,b\"\n3,\n4,\"say \"\"hi\"\"\"\n");
    }

    @Test
    void shouldUseConfiguredSeparator() throws IOException {
        // Given
        List<String[]> rows = new ArrayList<>();
        rows.add(new String[]{"1", "x"});
        Path target = tempDir.resolve("out.txt");

        // When
        new DelimitedTableWriter('\t').write(new Table(List.of("a", "b"), rows), target);

        // Then
        assertThat(Files.readAllLines(target)).containsExactly("a\tb", "1\tx");
    }

    @Test
    void shouldReplaceExistingTargetAndLeaveNoTempFiles() throws IOException {
        // Given
        Path target = Files.writeString(tempDir.resolve("out.csv"), "stale content\n");
        List<String[]> rows = new ArrayList<>();
        rows.add(new String[]{"EU"});

        // When
        new DelimitedTableWriter(',').write(new Table(List.of("region"), rows), target);

        // Then
        assertThat(Files.readAllLines(target)).containsExactly("region", "EU");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void emptyTable_shouldWriteHeaderOnly() throws IOException {
        // Given
        Path target = tempDir.resolve("empty.csv");

        // When
        new DelimitedTableWriter(',').write(new Table(List.of("a", "b"), new ArrayList<>()), target);

        // Then
        assertThat(Files.readAllLines(target)).containsExactly("a,b");
    }
}
