package com.company.datasetsplitter.model;

import com.company.datasetsplitter.writer.WriterOptions;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Validated run options, resolved once from configuration and shared by every file of a batch.
 */
@Value
@Builder(toBuilder = true)
public class SplitRequest {
    String categoryColumn;
    Path inputPath;
    Path outputDir;
    String extension;
    SourceFormat sourceFormat;
    char inputSeparator;
    OutputFormat outputFormat;
    WriterOptions writerOptions;
    boolean keepCategoryColumn;
    boolean makeDirectory;
    NullPolicy nullPolicy;
    boolean verbose;
    boolean recursive;
    @Builder.Default
    ScanMode scanMode = ScanMode.CACHED;
    boolean failFast;
}
