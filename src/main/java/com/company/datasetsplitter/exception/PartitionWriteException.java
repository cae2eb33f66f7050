package com.company.datasetsplitter.exception;

public class PartitionWriteException extends SplitterException {
    private final String targetPath;

    public PartitionWriteException(String message, String fileName, String category, String targetPath) {
        super(message, fileName, category);
        this.targetPath = targetPath;
    }

    public PartitionWriteException(String message, String fileName, String category, String targetPath,
                                   Throwable cause) {
        super(message, fileName, category, cause);
        this.targetPath = targetPath;
    }

    public String getTargetPath() {
        return targetPath;
    }
}
