package com.company.datasetsplitter.source;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FieldStartQuoteParser
 */
class FieldStartQuoteParserTest {

    private final FieldStartQuoteParser parser = new FieldStartQuoteParser(',');

    @Test
    void shouldTreatMidFieldQuotesAsLiterals() throws IOException {
        assertThat(parser.parseLine("US,5\" screen,a\"b\"c")).containsExactly("US", "5\" screen", "a\"b\"c");
    }

    @Test
    void shouldUnquoteFieldsAndUnescapeDoubledQuotes() throws IOException {
        assertThat(parser.parseLine("\"Smith, J\",\"said \"\"hi\"\"\",\"\",plain"))
                .containsExactly("Smith, J", "said \"hi\"", "", "plain");
    }

    @Test
    void shouldKeepTextAfterClosingQuote() throws IOException {
        assertThat(parser.parseLine("\"12\"in,x")).containsExactly("12in", "x");
    }

    @Test
    void shouldHonourOtherSeparators() throws IOException {
        // Given
        FieldStartQuoteParser tabs = new FieldStartQuoteParser('\t');

        // When
        String[] fields = tabs.parseLine("a,b\t\"c\td\"\t");

        // Then
        assertThat(fields).containsExactly("a,b", "c\td", "");
    }

    @Test
    void multiLine_shouldCarryOpenQuotedFieldToNextLine() throws IOException {
        // When
        String[] first = parser.parseLineMulti("EU,\"first");
        boolean pendingAfterFirst = parser.isPending();
        String[] second = parser.parseLineMulti("second\",2");

        // Then
        assertThat(first).containsExactly("EU");
        assertThat(pendingAfterFirst).isTrue();
        assertThat(second).containsExactly("first\nsecond", "2");
        assertThat(parser.isPending()).isFalse();
    }

    @Test
    void singleLine_shouldRejectUnterminatedQuotedField() {
        assertThatThrownBy(() -> parser.parseLine("EU,\"open"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Unterminated quoted field");
    }
}
