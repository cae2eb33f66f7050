package com.company.datasetsplitter.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Physical layout of an input file.
 */
public enum SourceFormat {
    DELIMITED("delimited"),
    COLUMNAR("columnar");

    private final String tag;

    SourceFormat(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Accepts a format tag ("delimited", "columnar") or a file extension ("csv", "txt", "parquet").
     */
    public static Optional<SourceFormat> fromTag(String value) {
        if (value == null) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "delimited":
            case "csv":
            case "txt":
                return Optional.of(DELIMITED);
            case "columnar":
            case "parquet":
                return Optional.of(COLUMNAR);
            default:
                return Optional.empty();
        }
    }
}
