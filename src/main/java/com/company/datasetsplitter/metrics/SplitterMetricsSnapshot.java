package com.company.datasetsplitter.metrics;

import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time view of the splitter counters, logged as the run summary.
 */
@Data
@Builder
public class SplitterMetricsSnapshot {
    private double filesProcessed;
    private double filesSkipped;
    private double filesFailed;
    private double partitionsWritten;
    private double partitionWriteFailures;
    private double rowsWritten;
    private double avgFileSplitTime;
    private double avgPartitionWriteTime;
}
