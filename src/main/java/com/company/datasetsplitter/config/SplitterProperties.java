package com.company.datasetsplitter.config;

import com.company.datasetsplitter.exception.SplitterConfigurationException;
import com.company.datasetsplitter.model.FieldSeparator;
import com.company.datasetsplitter.model.NullPolicy;
import com.company.datasetsplitter.model.OutputFormat;
import com.company.datasetsplitter.model.ScanMode;
import com.company.datasetsplitter.model.SourceFormat;
import com.company.datasetsplitter.model.SplitRequest;
import com.company.datasetsplitter.writer.WriterOptions;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.poi.ss.util.WorkbookUtil;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

@ConfigurationProperties(prefix = "splitter")
@Validated
public class SplitterProperties {

    private static final Set<CompressionCodecName> SUPPORTED_CODECS = EnumSet.of(
            CompressionCodecName.UNCOMPRESSED, CompressionCodecName.SNAPPY, CompressionCodecName.GZIP);

    @NotBlank
    private String categoryCol;

    @NotBlank
    private String inputPath;

    @NotBlank
    private String outputDir;

    @NotBlank
    private String extension;

    @NotBlank
    private String outputFormat;

    @NotBlank
    private String separator = "comma";

    @NotBlank
    private String outputSeparator = "comma";

    private boolean keepCategoryCol = false;
    private boolean makeDir = false;
    private String fillNullValue;
    private boolean verbose = false;
    private boolean recursive = false;

    @Min(0)
    private int workerThreads = 0;

    @NotNull
    private ScanMode scanMode = ScanMode.CACHED;

    private boolean failFast = false;

    @NotBlank
    private String parquetCompression = "snappy";

    @NotBlank
    private String sheetName = WriterOptions.DEFAULT_SHEET_NAME;

    private boolean runOnStartup = true;

    // Getters and Setters
    public String getCategoryCol() {
        return categoryCol;
    }

    public void setCategoryCol(String categoryCol) {
        this.categoryCol = categoryCol;
    }

    public String getInputPath() {
        return inputPath;
    }

    public void setInputPath(String inputPath) {
        this.inputPath = inputPath;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getExtension() {
        return extension;
    }

    public void setExtension(String extension) {
        this.extension = extension;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public String getSeparator() {
        return separator;
    }

    public void setSeparator(String separator) {
        this.separator = separator;
    }

    public String getOutputSeparator() {
        return outputSeparator;
    }

    public void setOutputSeparator(String outputSeparator) {
        this.outputSeparator = outputSeparator;
    }

    public boolean isKeepCategoryCol() {
        return keepCategoryCol;
    }

    public void setKeepCategoryCol(boolean keepCategoryCol) {
        this.keepCategoryCol = keepCategoryCol;
    }

    public boolean isMakeDir() {
        return makeDir;
    }

    public void setMakeDir(boolean makeDir) {
        this.makeDir = makeDir;
    }

    public String getFillNullValue() {
        return fillNullValue;
    }

    public void setFillNullValue(String fillNullValue) {
        this.fillNullValue = fillNullValue;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public ScanMode getScanMode() {
        return scanMode;
    }

    public void setScanMode(ScanMode scanMode) {
        this.scanMode = scanMode;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public void setFailFast(boolean failFast) {
        this.failFast = failFast;
    }

    public String getParquetCompression() {
        return parquetCompression;
    }

    public void setParquetCompression(String parquetCompression) {
        this.parquetCompression = parquetCompression;
    }

    public String getSheetName() {
        return sheetName;
    }

    public void setSheetName(String sheetName) {
        this.sheetName = sheetName;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    // Helper methods

    /**
     * Pool size for one file's fan-out; {@code 0} means one thread per available processor.
     */
    public int getEffectiveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }

    /**
     * Resolve the raw properties into a validated request. Touches no files.
     * @throws SplitterConfigurationException for an invalid separator, extension, codec or sheet name
     * @throws com.company.datasetsplitter.exception.UnsupportedFormatException for an unknown output format
     */
    public SplitRequest toSplitRequest() {
        OutputFormat format = OutputFormat.fromId(outputFormat);
        SourceFormat sourceFormat = SourceFormat.fromTag(extension)
                .orElseThrow(() -> new SplitterConfigurationException(
                        "Unsupported input extension '" + extension + "', expected csv, txt or parquet",
                        "splitter.extension"));

        WriterOptions writerOptions = WriterOptions.builder()
                .separator(FieldSeparator.resolve(outputSeparator, "splitter.output-separator"))
                .compression(resolveCompression())
                .sheetName(resolveSheetName())
                .build();

        return SplitRequest.builder()
                .categoryColumn(categoryCol)
                .inputPath(toPath(inputPath, "splitter.input-path"))
                .outputDir(toPath(outputDir, "splitter.output-dir"))
                .extension(extension.trim().toLowerCase(Locale.ROOT))
                .sourceFormat(sourceFormat)
                .inputSeparator(FieldSeparator.resolve(separator, "splitter.separator"))
                .outputFormat(format)
                .writerOptions(writerOptions)
                .keepCategoryColumn(keepCategoryCol)
                .makeDirectory(makeDir)
                .nullPolicy(NullPolicy.fromFillValue(fillNullValue))
                .verbose(verbose)
                .recursive(recursive)
                .scanMode(scanMode)
                .failFast(failFast)
                .build();
    }

    private CompressionCodecName resolveCompression() {
        String requested = parquetCompression.trim();
        return SUPPORTED_CODECS.stream()
                .filter(codec -> codec.name().equalsIgnoreCase(requested))
                .findFirst()
                .orElseThrow(() -> new SplitterConfigurationException(
                        "Unsupported Parquet compression '" + parquetCompression + "', expected one of "
                                + SUPPORTED_CODECS, "splitter.parquet-compression"));
    }

    private String resolveSheetName() {
        try {
            WorkbookUtil.validateSheetName(sheetName);
            return sheetName;
        } catch (IllegalArgumentException e) {
            throw new SplitterConfigurationException(
                    "Invalid sheet name '" + sheetName + "': " + e.getMessage(), "splitter.sheet-name", e);
        }
    }

    private static Path toPath(String value, String property) {
        try {
            return Paths.get(value);
        } catch (InvalidPathException e) {
            throw new SplitterConfigurationException("Invalid path '" + value + "'", property, e);
        }
    }
}
