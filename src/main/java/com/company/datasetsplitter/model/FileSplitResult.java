package com.company.datasetsplitter.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public class FileSplitResult {

    public enum Status {
        SPLIT,
        NO_CATEGORIES,
        SKIPPED_MISSING_COLUMN,
        SKIPPED_UNREADABLE,
        FAILED
    }

    private String fileName;
    private Status status;
    private String errorMessage;
    private List<String> categories = new ArrayList<>();
    private List<PartitionResult> partitions = new ArrayList<>();
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private long processingTimeMs;

    // Constructors
    public FileSplitResult() {}

    public FileSplitResult(String fileName) {
        this.fileName = fileName;
        this.startTime = LocalDateTime.now();
    }

    // Getters and Setters
    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public List<String> getCategories() {
        return categories;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories;
    }

    public List<PartitionResult> getPartitions() {
        return partitions;
    }

    public void setPartitions(List<PartitionResult> partitions) {
        this.partitions = partitions;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public LocalDateTime getEndTime() {
        return endTime;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public long getRowsWritten() {
        return partitions.stream().mapToLong(PartitionResult::getRowCount).sum();
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED_MISSING_COLUMN || status == Status.SKIPPED_UNREADABLE;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public FileSplitResult markComplete(Status finalStatus) {
        this.status = finalStatus;
        this.endTime = LocalDateTime.now();
        if (startTime != null) {
            this.processingTimeMs = Duration.between(startTime, endTime).toMillis();
        }
        return this;
    }

    public FileSplitResult markFailed(Status finalStatus, String message) {
        this.errorMessage = message;
        return markComplete(finalStatus);
    }
}
