package com.company.datasetsplitter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-file outcomes of one batch run.
 */
public class SplitRunSummary {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FILE_FAILURES = 1;
    public static final int EXIT_ABORTED = 2;

    private final List<FileSplitResult> results = new ArrayList<>();
    private boolean aborted;

    public void add(FileSplitResult result) {
        results.add(result);
    }

    public List<FileSplitResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public void markAborted() {
        this.aborted = true;
    }

    public boolean isAborted() {
        return aborted;
    }

    public long countByStatus(FileSplitResult.Status status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }

    public long getFilesSkipped() {
        return results.stream().filter(FileSplitResult::isSkipped).count();
    }

    public long getFilesFailed() {
        return results.stream().filter(FileSplitResult::isFailed).count();
    }

    public long getPartitionsWritten() {
        return results.stream().mapToLong(r -> r.getPartitions().size()).sum();
    }

    public long getRowsWritten() {
        return results.stream().mapToLong(FileSplitResult::getRowsWritten).sum();
    }

    public int getExitCode() {
        if (aborted) {
            return EXIT_ABORTED;
        }
        return getFilesFailed() > 0 ? EXIT_FILE_FAILURES : EXIT_OK;
    }
}
