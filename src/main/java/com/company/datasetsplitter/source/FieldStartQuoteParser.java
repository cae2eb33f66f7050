package com.company.datasetsplitter.source;

import com.opencsv.AbstractCSVParser;
import com.opencsv.enums.CSVReaderNullFieldIndicator;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * OpenCSV parser that treats the quote character as special only when it opens a field.
 *
 * <p>A quote inside an unquoted field ({@code 5" screen}) is kept as a literal character. Inside a quoted field a
 * doubled quote is an escaped quote, a single quote closes the field, and anything between the closing quote and
 * the next separator is kept as is. A quoted field that runs past the end of the line continues on the next one
 * when {@link com.opencsv.CSVReader} asks for multi-line parsing.
 */
public class FieldStartQuoteParser extends AbstractCSVParser {

    public static final char QUOTE = '"';

    private final char fieldSeparator;
    private final char quote;
    private String pendingField;

    public FieldStartQuoteParser(char separator) {
        super(separator, QUOTE, CSVReaderNullFieldIndicator.NEITHER);
        this.fieldSeparator = separator;
        this.quote = QUOTE;
    }

    @Override
    public boolean isPending() {
        return pendingField != null;
    }

    @Override
    public String getPendingText() {
        return StringUtils.defaultString(pendingField);
    }

    @Override
    protected String[] parseLine(String nextLine, boolean multi) throws IOException {
        if (!multi) {
            pendingField = null;
        }
        if (nextLine == null) {
            if (pendingField != null) {
                String remainder = pendingField;
                pendingField = null;
                return new String[]{remainder};
            }
            return null;
        }

        List<String> tokens = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean atFieldStart = true;
        if (pendingField != null) {
            field.append(pendingField).append('\n');
            pendingField = null;
            inQuotes = true;
            atFieldStart = false;
        }

        int length = nextLine.length();
        for (int i = 0; i < length; i++) {
            char c = nextLine.charAt(i);
            if (inQuotes) {
                if (c != quote) {
                    field.append(c);
                } else if (i + 1 < length && nextLine.charAt(i + 1) == quote) {
                    field.append(quote);
                    i++;
                } else {
                    inQuotes = false;
                }
            } else if (c == fieldSeparator) {
                tokens.add(field.toString());
                field.setLength(0);
                atFieldStart = true;
            } else if (c == quote && atFieldStart) {
                inQuotes = true;
                atFieldStart = false;
            } else {
                field.append(c);
                atFieldStart = false;
            }
        }

        if (inQuotes) {
            if (!multi) {
                throw new IOException("Unterminated quoted field at end of line: "
                        + StringUtils.abbreviate(field.toString(), 100));
            }
            pendingField = field.toString();
        } else {
            tokens.add(field.toString());
        }
        return tokens.toArray(new String[0]);
    }

    protected String convertToCsvValue(String value, boolean applyQuotesToAll) {
        String text = StringUtils.defaultString(value);
        boolean needsQuotes = applyQuotesToAll
                || StringUtils.containsAny(text, fieldSeparator, quote, '\n', '\r');
        if (!needsQuotes) {
            return text;
        }
        String doubled = String.valueOf(quote) + quote;
        return quote + text.replace(String.valueOf(quote), doubled) + quote;
    }

    public void setErrorLocale(Locale errorLocale) {
        // messages are not localized
    }
}
