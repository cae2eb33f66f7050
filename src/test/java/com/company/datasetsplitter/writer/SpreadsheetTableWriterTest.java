package com.company.datasetsplitter.writer;

import com.company.datasetsplitter.table.Table;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SpreadsheetTableWriter
 */
class SpreadsheetTableWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteHeaderAndTextCellsToNamedSheet() throws IOException {
        // Given
        List<String[]> rows = new ArrayList<>();
        rows.add(new String[]{"EU", "007"});
        rows.add(new String[]{"US", null});
        Path target = tempDir.resolve("out.xlsx");

        // When
        new SpreadsheetTableWriter("Sheet1").write(new Table(List.of("region", "code"), rows), target);

        // Then
        try (InputStream in = Files.newInputStream(target); XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheet("Sheet1");
            assertThat(sheet).isNotNull();
            assertThat(sheet.getLastRowNum()).isEqualTo(2);

            Row header = sheet.getRow(0);
            assertThat(header.getCell(0).getStringCellValue()).isEqualTo("region");
            assertThat(header.getCell(1).getStringCellValue()).isEqualTo("code");

            assertThat(sheet.getRow(1).getCell(1).getStringCellValue()).isEqualTo("007");
            assertThat(sheet.getRow(2).getCell(0).getStringCellValue()).isEqualTo("US");
            assertThat(sheet.getRow(2).getCell(1)).isNull();
        }
    }

    @Test
    void tooManyRows_shouldFailWithoutLeavingAFile() {
        // Given
        List<String[]> hugeRows = new AbstractList<>() {
            @Override
            public String[] get(int index) {
                return new String[]{"x"};
            }

            @Override
            public int size() {
                return SpreadsheetTableWriter.MAX_DATA_ROWS + 1;
            }
        };
        Path target = tempDir.resolve("huge.xlsx");

        // When / Then
        assertThatThrownBy(() -> new SpreadsheetTableWriter("Sheet1")
                .write(new Table(List.of("col"), hugeRows), target))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("row limit");
        assertThat(target).doesNotExist();
    }

    @Test
    void failedWrite_shouldNotLeaveTempFiles() throws IOException {
        // Given
        Path target = tempDir.resolve("missing-dir").resolve("out.xlsx");

        // When / Then
        assertThatThrownBy(() -> new SpreadsheetTableWriter("Sheet1")
                .write(new Table(List.of("col"), new ArrayList<>()), target))
                .isInstanceOf(IOException.class);
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }
}
