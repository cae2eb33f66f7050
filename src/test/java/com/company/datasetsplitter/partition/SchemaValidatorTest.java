package com.company.datasetsplitter.partition;

import com.company.datasetsplitter.exception.MissingColumnException;
import com.company.datasetsplitter.source.DelimitedRowSource;
import com.company.datasetsplitter.table.TabularQuery;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaValidator
 */
class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator();

    @TempDir
    Path tempDir;

    @Test
    void shouldAcceptDeclaredColumnWithoutReadingRows() throws IOException {
        // Given a header followed by a row that would fail if it were parsed
        Path file = Files.writeString(tempDir.resolve("data.csv"), "region,val\nEU,1,extra\n");
        TabularQuery query = TabularQuery.of(new DelimitedRowSource(file, ','));

        // When
        boolean present = validator.hasColumn(query, "region");

        // Then
        assertThat(present).isTrue();
    }

    @Test
    void shouldRejectMissingColumn() throws IOException {
        // Given
        Path file = Files.writeString(tempDir.resolve("data.csv"), "country,val\nEU,1\n");
        TabularQuery query = TabularQuery.of(new DelimitedRowSource(file, ','));

        // When / Then
        assertThat(validator.hasColumn(query, "region")).isFalse();
        assertThatThrownBy(() -> validator.requireColumn(query, "region"))
                .isInstanceOf(MissingColumnException.class)
                .hasMessage("Column region not found in data.csv");
    }

    @Test
    void columnNamesShouldBeCaseSensitive() throws IOException {
        // Given
        Path file = Files.writeString(tempDir.resolve("data.csv"), "Region,val\n");
        TabularQuery query = TabularQuery.of(new DelimitedRowSource(file, ','));

        // When / Then
        assertThat(validator.hasColumn(query, "region")).isFalse();
    }
}
