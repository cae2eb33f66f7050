package com.company.datasetsplitter.model;

import com.company.datasetsplitter.exception.UnsupportedFormatException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OutputFormat and SourceFormat lookups
 */
class OutputFormatTest {

    @Test
    void shouldMapIdentifiersToWriterFamilies() {
        assertThat(OutputFormat.fromId("csv").getWriterKind()).isEqualTo(WriterKind.DELIMITED);
        assertThat(OutputFormat.fromId(" TXT ").getWriterKind()).isEqualTo(WriterKind.DELIMITED);
        assertThat(OutputFormat.fromId("parquet").getWriterKind()).isEqualTo(WriterKind.COLUMNAR);
        assertThat(OutputFormat.fromId("xlsx").getWriterKind()).isEqualTo(WriterKind.SPREADSHEET);
        assertThat(OutputFormat.fromId("xlsx").getExtension()).isEqualTo("xlsx");
    }

    @Test
    void unknownOrMissingIdentifier_shouldBeUnsupported() {
        assertThatThrownBy(() -> OutputFormat.fromId("xls")).isInstanceOf(UnsupportedFormatException.class);
        assertThatThrownBy(() -> OutputFormat.fromId(null)).isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void sourceFormat_shouldAcceptTagsAndExtensions() {
        assertThat(SourceFormat.fromTag("csv")).contains(SourceFormat.DELIMITED);
        assertThat(SourceFormat.fromTag("delimited")).contains(SourceFormat.DELIMITED);
        assertThat(SourceFormat.fromTag("Parquet")).contains(SourceFormat.COLUMNAR);
        assertThat(SourceFormat.fromTag("xlsx")).isEmpty();
    }
}
