package com.company.datasetsplitter.model;

import com.company.datasetsplitter.exception.SplitterConfigurationException;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * Named field delimiters accepted on the command line. A single literal character is accepted too.
 */
public enum FieldSeparator {
    COMMA(','),
    SEMICOLON(';'),
    TAB('\t'),
    PIPE('|');

    private final char character;

    FieldSeparator(char character) {
        this.character = character;
    }

    public char getCharacter() {
        return character;
    }

    /**
     * Resolves a separator name ("comma", "tab", ...) or a one-character literal.
     */
    public static char resolve(String value, String configProperty) {
        if (StringUtils.isEmpty(value)) {
            throw new SplitterConfigurationException("Separator must not be empty", configProperty);
        }
        if (value.length() == 1) {
            char literal = value.charAt(0);
            if (literal == '"' || literal == '\n' || literal == '\r') {
                throw new SplitterConfigurationException(
                        "Separator cannot be a quote or line break character", configProperty);
            }
            return literal;
        }
        if ("\\t".equals(value)) {
            return '\t';
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT)).getCharacter();
        } catch (IllegalArgumentException e) {
            throw new SplitterConfigurationException("Unknown separator: " + value, configProperty, e);
        }
    }
}
