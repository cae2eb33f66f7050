package com.company.datasetsplitter.exception;

public class SplitterException extends RuntimeException {
    private final String fileName;
    private final String category;

    public SplitterException(String message) {
        super(message);
        this.fileName = null;
        this.category = null;
    }

    public SplitterException(String message, Throwable cause) {
        super(message, cause);
        this.fileName = null;
        this.category = null;
    }

    public SplitterException(String message, String fileName, String category) {
        super(message);
        this.fileName = fileName;
        this.category = category;
    }

    public SplitterException(String message, String fileName, String category, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
        this.category = category;
    }

    public String getFileName() {
        return fileName;
    }

    public String getCategory() {
        return category;
    }
}
