package com.company.datasetsplitter.model;

import com.company.datasetsplitter.exception.UnsupportedFormatException;

import java.util.Locale;

public enum OutputFormat {
    CSV("csv", WriterKind.DELIMITED),
    TXT("txt", WriterKind.DELIMITED),
    PARQUET("parquet", WriterKind.COLUMNAR),
    XLSX("xlsx", WriterKind.SPREADSHEET);

    private final String extension;
    private final WriterKind writerKind;

    OutputFormat(String extension, WriterKind writerKind) {
        this.extension = extension;
        this.writerKind = writerKind;
    }

    public String getExtension() {
        return extension;
    }

    public WriterKind getWriterKind() {
        return writerKind;
    }

    public static OutputFormat fromId(String formatId) {
        if (formatId != null) {
            String normalized = formatId.trim().toLowerCase(Locale.ROOT);
            for (OutputFormat format : values()) {
                if (format.extension.equals(normalized)) {
                    return format;
                }
            }
        }
        throw new UnsupportedFormatException(formatId);
    }
}
