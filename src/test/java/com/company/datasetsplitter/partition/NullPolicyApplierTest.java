package com.company.datasetsplitter.partition;

import com.company.datasetsplitter.model.NullPolicy;
import com.company.datasetsplitter.source.DelimitedRowSource;
import com.company.datasetsplitter.table.Table;
import com.company.datasetsplitter.table.TabularQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NullPolicyApplier
 */
class NullPolicyApplierTest {

    private final NullPolicyApplier applier = new NullPolicyApplier();

    @TempDir
    Path tempDir;

    private TabularQuery query;

    @BeforeEach
    void setUp() throws IOException {
        Path file = Files.writeString(tempDir.resolve("data.csv"), "region,val\nEU,1\nUS,2\n,3\n");
        query = TabularQuery.of(new DelimitedRowSource(file, ','));
    }

    @Test
    void skip_shouldRemoveRowsWithNullCategory() {
        // When
        Table table = applier.apply(query, "region", NullPolicy.skip()).collect();

        // Then
        assertThat(table.getRows()).extracting(row -> row[0]).containsExactly("EU", "US");
    }

    @Test
    void fill_shouldReplaceNullCategoryWithSentinel() {
        // When
        Table table = applier.apply(query, "region", NullPolicy.fill("OTHER")).collect();

        // Then
        assertThat(table.getRows()).extracting(row -> row[0]).containsExactly("EU", "US", "OTHER");
        assertThat(table.getRows()).extracting(row -> row[1]).containsExactly("1", "2", "3");
    }

    @Test
    void fill_shouldLeaveOtherColumnsNullable() throws IOException {
        // Given
        Path file = Files.writeString(tempDir.resolve("gaps.csv"), "region,val\n,\n");
        TabularQuery gaps = TabularQuery.of(new DelimitedRowSource(file, ','));

        // When
        Table table = applier.apply(gaps, "region", NullPolicy.fromFillValue("N/A")).collect();

        // Then
        assertThat(table.getRows().get(0)).containsExactly("N/A", null);
    }
}
