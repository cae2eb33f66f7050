package com.company.datasetsplitter.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for the dataset splitter
 * Following Micrometer patterns and Single Responsibility Principle
 */
@Component
public class SplitterMetrics {

    private final MeterRegistry meterRegistry;

    // Counters for tracking events
    private final Counter filesProcessedCounter;
    private final Counter filesSkippedCounter;
    private final Counter filesFailedCounter;
    private final Counter partitionsWrittenCounter;
    private final Counter partitionWriteFailuresCounter;
    private final Counter rowsWrittenCounter;

    // Timers for measuring latencies
    private final Timer fileSplitTimer;
    private final Timer partitionWriteTimer;

    public SplitterMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.filesProcessedCounter = Counter.builder("dataset_splitter_files_processed_total")
            .description("Total number of source files split")
            .register(meterRegistry);

        this.filesSkippedCounter = Counter.builder("dataset_splitter_files_skipped_total")
            .description("Total number of source files skipped with a warning")
            .register(meterRegistry);

        this.filesFailedCounter = Counter.builder("dataset_splitter_files_failed_total")
            .description("Total number of source files whose split failed")
            .register(meterRegistry);

        this.partitionsWrittenCounter = Counter.builder("dataset_splitter_partitions_written_total")
            .description("Total number of partition files written")
            .register(meterRegistry);

        this.partitionWriteFailuresCounter = Counter.builder("dataset_splitter_partition_write_failures_total")
            .description("Total number of failed partition writes")
            .register(meterRegistry);

        this.rowsWrittenCounter = Counter.builder("dataset_splitter_rows_written_total")
            .description("Total number of rows written across all partitions")
            .register(meterRegistry);

        this.fileSplitTimer = Timer.builder("dataset_splitter_file_split_duration")
            .description("Time taken to split one source file")
            .register(meterRegistry);

        this.partitionWriteTimer = Timer.builder("dataset_splitter_partition_write_duration")
            .description("Time taken to evaluate and write one partition")
            .register(meterRegistry);
    }

    public void incrementFilesProcessed() {
        filesProcessedCounter.increment();
    }

    public void incrementFilesSkipped() {
        filesSkippedCounter.increment();
    }

    public void incrementFilesFailed() {
        filesFailedCounter.increment();
    }

    public void incrementPartitionsWritten(long rowCount) {
        partitionsWrittenCounter.increment();
        rowsWrittenCounter.increment(rowCount);
    }

    public void incrementPartitionWriteFailures() {
        partitionWriteFailuresCounter.increment();
    }

    // Timer methods
    public Timer.Sample startFileSplitTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordFileSplitTime(Timer.Sample sample) {
        sample.stop(fileSplitTimer);
    }

    public Timer.Sample startPartitionWriteTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordPartitionWriteTime(Timer.Sample sample) {
        sample.stop(partitionWriteTimer);
    }

    /**
     * Get all current metric values for the run summary
     */
    public SplitterMetricsSnapshot getSnapshot() {
        return SplitterMetricsSnapshot.builder()
            .filesProcessed(filesProcessedCounter.count())
            .filesSkipped(filesSkippedCounter.count())
            .filesFailed(filesFailedCounter.count())
            .partitionsWritten(partitionsWrittenCounter.count())
            .partitionWriteFailures(partitionWriteFailuresCounter.count())
            .rowsWritten(rowsWrittenCounter.count())
            .avgFileSplitTime(fileSplitTimer.mean(TimeUnit.MILLISECONDS))
            .avgPartitionWriteTime(partitionWriteTimer.mean(TimeUnit.MILLISECONDS))
            .build();
    }
}
