package com.company.datasetsplitter.model;

/**
 * How a file is evaluated during fan-out.
 * <ul>
 *   <li>{@link #CACHED}: the source is read once; category resolution and every partition filter run over
 *       the materialized rows.</li>
 *   <li>{@link #STREAMING}: nothing is kept in memory between evaluations; the category column is read once
 *       (projected) and every partition re-reads the source with its own filter.</li>
 * </ul>
 */
public enum ScanMode {
    CACHED,
    STREAMING
}
