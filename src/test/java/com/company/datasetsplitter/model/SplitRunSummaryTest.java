package com.company.datasetsplitter.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SplitRunSummary and NullPolicy
 */
class SplitRunSummaryTest {

    @Test
    void exitCode_shouldReflectWorstOutcome() {
        // Given
        SplitRunSummary summary = new SplitRunSummary();
        summary.add(new FileSplitResult("a.csv").markComplete(FileSplitResult.Status.SPLIT));
        summary.add(new FileSplitResult("b.csv")
                .markFailed(FileSplitResult.Status.SKIPPED_MISSING_COLUMN, "Column region not found in b.csv"));

        // Then
        assertThat(summary.getExitCode()).isEqualTo(SplitRunSummary.EXIT_OK);

        // When
        summary.add(new FileSplitResult("c.csv").markFailed(FileSplitResult.Status.FAILED, "disk full"));

        // Then
        assertThat(summary.getExitCode()).isEqualTo(SplitRunSummary.EXIT_FILE_FAILURES);
        assertThat(summary.getFilesSkipped()).isEqualTo(1);
        assertThat(summary.getFilesFailed()).isEqualTo(1);

        // When
        summary.markAborted();

        // Then
        assertThat(summary.getExitCode()).isEqualTo(SplitRunSummary.EXIT_ABORTED);
    }

    @Test
    void shouldAggregatePartitionsAndRows() {
        // Given
        FileSplitResult result = new FileSplitResult("a.csv");
        result.setPartitions(List.of(
                new PartitionResult("EU", Paths.get("out", "a_EU.csv"), 3),
                new PartitionResult("US", Paths.get("out", "a_US.csv"), 2)));
        result.markComplete(FileSplitResult.Status.SPLIT);
        SplitRunSummary summary = new SplitRunSummary();
        summary.add(result);

        // Then
        assertThat(summary.getPartitionsWritten()).isEqualTo(2);
        assertThat(summary.getRowsWritten()).isEqualTo(5);
        assertThat(summary.countByStatus(FileSplitResult.Status.SPLIT)).isEqualTo(1);
    }

    @Test
    void nullPolicy_shouldFillOnlyWhenSentinelGiven() {
        assertThat(NullPolicy.fromFillValue("OTHER")).isEqualTo(NullPolicy.fill("OTHER"));
        assertThat(NullPolicy.fromFillValue("OTHER").getSentinel()).contains("OTHER");
        assertThat(NullPolicy.fromFillValue(null).getKind()).isEqualTo(NullPolicy.Kind.SKIP);
        assertThat(NullPolicy.fromFillValue("").getKind()).isEqualTo(NullPolicy.Kind.FILL);
        assertThat(NullPolicy.skip()).hasToString("Skip");
    }
}
