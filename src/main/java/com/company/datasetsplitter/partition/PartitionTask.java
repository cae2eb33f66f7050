package com.company.datasetsplitter.partition;

import com.company.datasetsplitter.exception.PartitionWriteException;
import com.company.datasetsplitter.logging.LoggingContext;
import com.company.datasetsplitter.metrics.SplitterMetrics;
import com.company.datasetsplitter.model.PartitionResult;
import com.company.datasetsplitter.table.Table;
import com.company.datasetsplitter.table.TabularQuery;
import com.company.datasetsplitter.writer.TableWriter;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Evaluates one category's filtered view and writes it to its target path.
 * Owns its query and target exclusively; nothing is shared with sibling tasks except the writer,
 * which is stateless.
 */
@Slf4j
public class PartitionTask implements Callable<PartitionResult> {

    private final String fileName;
    private final String category;
    private final TabularQuery query;
    private final Path target;
    private final TableWriter writer;
    private final SplitterMetrics metrics;

    public PartitionTask(String fileName, String category, TabularQuery query, Path target,
                         TableWriter writer, SplitterMetrics metrics) {
        this.fileName = fileName;
        this.category = category;
        this.query = query;
        this.target = target;
        this.writer = writer;
        this.metrics = metrics;
    }

    public String getCategory() {
        return category;
    }

    @Override
    public PartitionResult call() {
        LoggingContext.setCategoryContext(category);
        Timer.Sample sample = metrics.startPartitionWriteTimer();
        try {
            Table table = query.collect();
            writer.write(table, target);
            metrics.incrementPartitionsWritten(table.getRowCount());
            LoggingContext.setRowCount(table.getRowCount());
            log.debug("Wrote category {} of {} ({} rows) to {}", category, fileName, table.getRowCount(), target);
            return new PartitionResult(category, target, table.getRowCount());
        } catch (PartitionWriteException e) {
            metrics.incrementPartitionWriteFailures();
            throw e;
        } catch (Exception e) {
            metrics.incrementPartitionWriteFailures();
            throw new PartitionWriteException(
                    String.format("Failed to write category '%s' of %s to %s: %s",
                            category, fileName, target, e.getMessage()),
                    fileName, category, target.toString(), e);
        } finally {
            metrics.recordPartitionWriteTime(sample);
        }
    }
}
