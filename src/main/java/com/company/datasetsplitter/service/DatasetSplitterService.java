package com.company.datasetsplitter.service;

import com.company.datasetsplitter.config.WorkerPoolFactory;
import com.company.datasetsplitter.exception.MissingColumnException;
import com.company.datasetsplitter.exception.PartitionWriteException;
import com.company.datasetsplitter.exception.SplitterException;
import com.company.datasetsplitter.exception.UnreadableSourceException;
import com.company.datasetsplitter.logging.LoggingContext;
import com.company.datasetsplitter.metrics.SplitterMetrics;
import com.company.datasetsplitter.model.FileSplitResult;
import com.company.datasetsplitter.model.PartitionResult;
import com.company.datasetsplitter.model.SplitRequest;
import com.company.datasetsplitter.partition.CategoryResolver;
import com.company.datasetsplitter.partition.NullPolicyApplier;
import com.company.datasetsplitter.partition.PartitionWriter;
import com.company.datasetsplitter.partition.ResolvedCategories;
import com.company.datasetsplitter.partition.SchemaValidator;
import com.company.datasetsplitter.source.TabularSourceAdapter;
import com.company.datasetsplitter.table.TabularQuery;
import com.company.datasetsplitter.writer.TableWriter;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Splits one source file: open, schema gate, null policy, category resolution, fan-out.
 * Recoverable per-file conditions are reported in the returned result instead of being thrown.
 */
@Slf4j
@Service
public class DatasetSplitterService {

    private final TabularSourceAdapter sourceAdapter;
    private final SchemaValidator schemaValidator;
    private final NullPolicyApplier nullPolicyApplier;
    private final CategoryResolver categoryResolver;
    private final PartitionWriter partitionWriter;
    private final WorkerPoolFactory workerPools;
    private final SplitterMetrics metrics;

    public DatasetSplitterService(TabularSourceAdapter sourceAdapter,
                                  SchemaValidator schemaValidator,
                                  NullPolicyApplier nullPolicyApplier,
                                  CategoryResolver categoryResolver,
                                  PartitionWriter partitionWriter,
                                  WorkerPoolFactory workerPools,
                                  SplitterMetrics metrics) {
        this.sourceAdapter = sourceAdapter;
        this.schemaValidator = schemaValidator;
        this.nullPolicyApplier = nullPolicyApplier;
        this.categoryResolver = categoryResolver;
        this.partitionWriter = partitionWriter;
        this.workerPools = workerPools;
        this.metrics = metrics;
    }

    public FileSplitResult splitFile(Path file, SplitRequest request, TableWriter writer) {
        String fileName = file.getFileName().toString();
        String column = request.getCategoryColumn();
        FileSplitResult result = new FileSplitResult(fileName);

        LoggingContext.setFileContext(fileName);
        Timer.Sample sample = metrics.startFileSplitTimer();
        ExecutorService pool = workerPools.newPool();
        try {
            log.info("Splitting {} by {}", file, column);
            TabularQuery query = sourceAdapter.open(file, request.getSourceFormat(), request.getInputSeparator());

            if (!schemaValidator.hasColumn(query, column)) {
                return skipMissingColumn(result, new MissingColumnException(column, fileName));
            }

            TabularQuery prepared = nullPolicyApplier.apply(query, column, request.getNullPolicy());
            ResolvedCategories resolved = categoryResolver.resolve(prepared, column, request.getScanMode(), pool);
            result.setCategories(resolved.getCategories());
            if (request.isVerbose()) {
                log.info("Categories of {} ({}): {}", fileName, resolved.size(), resolved.getCategories());
            }

            if (resolved.isEmpty()) {
                log.warn("No category values found in column {} of {}, nothing to write", column, fileName);
                metrics.incrementFilesProcessed();
                return result.markComplete(FileSplitResult.Status.NO_CATEGORIES);
            }

            List<PartitionResult> partitions =
                    partitionWriter.writePartitions(fileName, resolved, request, writer, pool);
            result.setPartitions(partitions);
            metrics.incrementFilesProcessed();
            result.markComplete(FileSplitResult.Status.SPLIT);
            log.info("Split {} into {} partitions ({} rows) in {}ms",
                    fileName, partitions.size(), result.getRowsWritten(), result.getProcessingTimeMs());
            return result;

        } catch (MissingColumnException e) {
            return skipMissingColumn(result, e);
        } catch (UnreadableSourceException e) {
            LoggingContext.setErrorContext(e.getClass().getSimpleName());
            log.warn("Skipping unreadable file {}: {}", fileName, e.getMessage());
            metrics.incrementFilesSkipped();
            return result.markFailed(FileSplitResult.Status.SKIPPED_UNREADABLE, e.getMessage());
        } catch (PartitionWriteException e) {
            LoggingContext.setErrorContext(e.getClass().getSimpleName());
            log.error("Failed to split {}: {} ({} further partition failures)",
                    fileName, e.getMessage(), e.getSuppressed().length);
            metrics.incrementFilesFailed();
            return result.markFailed(FileSplitResult.Status.FAILED, e.getMessage());
        } catch (SplitterException e) {
            LoggingContext.setErrorContext(e.getClass().getSimpleName());
            log.error("Failed to split {}: {}", fileName, e.getMessage(), e);
            metrics.incrementFilesFailed();
            return result.markFailed(FileSplitResult.Status.FAILED, e.getMessage());
        } finally {
            pool.shutdown();
            metrics.recordFileSplitTime(sample);
            LoggingContext.clearErrorContext();
            LoggingContext.clearFileContext();
        }
    }

    private FileSplitResult skipMissingColumn(FileSplitResult result, MissingColumnException e) {
        log.warn("{}, skipping file", e.getMessage());
        metrics.incrementFilesSkipped();
        return result.markFailed(FileSplitResult.Status.SKIPPED_MISSING_COLUMN, e.getMessage());
    }
}
