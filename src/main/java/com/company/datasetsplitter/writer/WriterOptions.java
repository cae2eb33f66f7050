package com.company.datasetsplitter.writer;

import lombok.Builder;
import lombok.Value;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

/**
 * Format-specific options threaded through to the table writers.
 */
@Value
@Builder
public class WriterOptions {

    public static final String DEFAULT_SHEET_NAME = "Sheet1";

    @Builder.Default
    char separator = ',';

    @Builder.Default
    CompressionCodecName compression = CompressionCodecName.SNAPPY;

    @Builder.Default
    String sheetName = DEFAULT_SHEET_NAME;

    public static WriterOptions defaults() {
        return builder().build();
    }
}
