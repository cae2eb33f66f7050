package com.company.datasetsplitter.exception;

/**
 * The source file cannot be opened or parsed. Fatal to that file only:
 * the batch logs it and moves on to the next file.
 */
public class UnreadableSourceException extends SplitterException {

    public UnreadableSourceException(String message, String fileName) {
        super(message, fileName, null);
    }

    public UnreadableSourceException(String message, String fileName, Throwable cause) {
        super(message, fileName, null, cause);
    }

    public static UnreadableSourceException unrecognizedFormat(String fileName, String format) {
        return new UnreadableSourceException("Unrecognized source format '" + format + "' for " + fileName, fileName);
    }

    public static UnreadableSourceException malformedRow(String fileName, long lineNumber, String details) {
        return new UnreadableSourceException(
                "Malformed row at line " + lineNumber + " in " + fileName + ": " + details, fileName);
    }
}
