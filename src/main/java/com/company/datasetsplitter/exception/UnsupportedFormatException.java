package com.company.datasetsplitter.exception;

/**
 * Unknown output format identifier. Raised at registry lookup, before any file is opened,
 * and aborts the whole run.
 */
public class UnsupportedFormatException extends SplitterException {
    private final String formatId;

    public UnsupportedFormatException(String formatId) {
        super("Unsupported output format: " + formatId);
        this.formatId = formatId;
    }

    public String getFormatId() {
        return formatId;
    }
}
