package com.company.datasetsplitter.exception;

public class MissingColumnException extends SplitterException {
    private final String columnName;

    public MissingColumnException(String columnName, String fileName) {
        super("Column " + columnName + " not found in " + fileName, fileName, null);
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}
