package com.company.datasetsplitter.cli;

import com.company.datasetsplitter.config.SplitterProperties;
import com.company.datasetsplitter.exception.SplitterConfigurationException;
import com.company.datasetsplitter.exception.UnsupportedFormatException;
import com.company.datasetsplitter.factory.FormatWriterRegistry;
import com.company.datasetsplitter.logging.LoggingContext;
import com.company.datasetsplitter.metrics.SplitterMetrics;
import com.company.datasetsplitter.model.FileSplitResult;
import com.company.datasetsplitter.model.SplitRequest;
import com.company.datasetsplitter.model.SplitRunSummary;
import com.company.datasetsplitter.service.BatchSplitService;
import com.company.datasetsplitter.writer.TableWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;

/**
 * Runs one batch when the application starts and turns its outcome into the process exit status.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "splitter", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class SplitterRunner implements ApplicationRunner, ExitCodeGenerator {

    private final SplitterProperties properties;
    private final FormatWriterRegistry writerRegistry;
    private final BatchSplitService batchSplitService;
    private final SplitterMetrics metrics;

    private volatile int exitCode = SplitRunSummary.EXIT_OK;
    private volatile SplitRunSummary lastSummary;

    public SplitterRunner(SplitterProperties properties,
                          FormatWriterRegistry writerRegistry,
                          BatchSplitService batchSplitService,
                          SplitterMetrics metrics) {
        this.properties = properties;
        this.writerRegistry = writerRegistry;
        this.batchSplitService = batchSplitService;
        this.metrics = metrics;
    }

    @Override
    public void run(ApplicationArguments args) {
        String runId = LoggingContext.generateRunId();
        try {
            SplitRequest request = properties.toSplitRequest();
            // resolved before any file is opened so an unknown format writes nothing
            TableWriter writer = writerRegistry.lookup(request.getOutputFormat(), request.getWriterOptions());
            log.info("Run {}: splitting {} by {} into {} ({} output, {} scan)", runId, request.getInputPath(),
                    request.getCategoryColumn(), request.getOutputDir(), request.getOutputFormat(),
                    request.getScanMode());

            SplitRunSummary summary = batchSplitService.run(request, writer);
            lastSummary = summary;
            exitCode = summary.getExitCode();
            logSummary(summary);

        } catch (SplitterConfigurationException e) {
            log.error("Invalid configuration ({}): {}", e.getConfigProperty(), e.getMessage());
            abort();
        } catch (UnsupportedFormatException e) {
            log.error("{}", e.getMessage());
            abort();
        } catch (UncheckedIOException e) {
            log.error("Cannot enumerate input files: {}", e.getMessage());
            abort();
        } finally {
            LoggingContext.clearAll();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public SplitRunSummary getLastSummary() {
        return lastSummary;
    }

    private void abort() {
        SplitRunSummary summary = new SplitRunSummary();
        summary.markAborted();
        lastSummary = summary;
        exitCode = summary.getExitCode();
    }

    private void logSummary(SplitRunSummary summary) {
        for (FileSplitResult result : summary.getResults()) {
            if (result.isSkipped() || result.isFailed()) {
                log.warn("{}: {} - {}", result.getFileName(), result.getStatus(), result.getErrorMessage());
            }
        }
        log.info("Run finished: {} files ({} split, {} without categories, {} skipped, {} failed), "
                        + "{} partitions, {} rows, exit code {}",
                summary.getResults().size(),
                summary.countByStatus(FileSplitResult.Status.SPLIT),
                summary.countByStatus(FileSplitResult.Status.NO_CATEGORIES),
                summary.getFilesSkipped(),
                summary.getFilesFailed(),
                summary.getPartitionsWritten(),
                summary.getRowsWritten(),
                summary.getExitCode());
        log.debug("Metrics snapshot: {}", metrics.getSnapshot());
    }
}
