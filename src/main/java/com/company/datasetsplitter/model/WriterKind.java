package com.company.datasetsplitter.model;

/**
 * The closed set of serialization routines a partition can be written with.
 */
public enum WriterKind {
    DELIMITED,
    COLUMNAR,
    SPREADSHEET
}
