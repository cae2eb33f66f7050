package com.company.datasetsplitter.table;

import com.company.datasetsplitter.exception.MissingColumnException;

import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * One transformation of a {@link TabularQuery}. Steps are immutable; binding one to a concrete column layout
 * yields the per-row function, which returns {@code null} to drop a row and never mutates its input array.
 */
interface QueryStep {

    List<String> outputColumns(List<String> input, String sourceName);

    Set<String> referencedColumns();

    UnaryOperator<String[]> bind(List<String> layout, String sourceName);

    /**
     * Column layout after this step ran over {@code layout}, which may be a pruned projection of the input.
     */
    default List<String> layoutAfter(List<String> layout, String sourceName) {
        return outputColumns(layout, sourceName);
    }

    static int requireColumn(List<String> layout, String column, String sourceName) {
        int index = layout.indexOf(column);
        if (index < 0) {
            throw new MissingColumnException(column, sourceName);
        }
        return index;
    }
}
