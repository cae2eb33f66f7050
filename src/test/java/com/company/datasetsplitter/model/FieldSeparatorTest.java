package com.company.datasetsplitter.model;

import com.company.datasetsplitter.exception.SplitterConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FieldSeparator
 */
class FieldSeparatorTest {

    @ParameterizedTest
    @CsvSource({"comma, 44", "SEMICOLON, 59", "tab, 9", "pipe, 124"})
    void shouldResolveNamedSeparators(String name, int expected) {
        assertThat((int) FieldSeparator.resolve(name, "splitter.separator")).isEqualTo(expected);
    }

    @Test
    void shouldAcceptSingleLiteralCharacterAndEscapedTab() {
        assertThat(FieldSeparator.resolve(";", "splitter.separator")).isEqualTo(';');
        assertThat(FieldSeparator.resolve("\t", "splitter.separator")).isEqualTo('\t');
        assertThat(FieldSeparator.resolve("\\t", "splitter.separator")).isEqualTo('\t');
    }

    @Test
    void shouldRejectUnknownNamesAndQuoteCharacter() {
        assertThatThrownBy(() -> FieldSeparator.resolve("colon-ish", "splitter.output-separator"))
                .isInstanceOf(SplitterConfigurationException.class)
                .extracting("configProperty").isEqualTo("splitter.output-separator");
        assertThatThrownBy(() -> FieldSeparator.resolve("\"", "splitter.separator"))
                .isInstanceOf(SplitterConfigurationException.class);
        assertThatThrownBy(() -> FieldSeparator.resolve("", "splitter.separator"))
                .isInstanceOf(SplitterConfigurationException.class);
    }
}
