package com.company.datasetsplitter.table;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Column projection: either keeps the listed columns in the listed order, or drops them and keeps the rest.
 */
final class ProjectStep implements QueryStep {

    private final List<String> columns;
    private final boolean exclude;

    private ProjectStep(List<String> columns, boolean exclude) {
        this.columns = List.copyOf(columns);
        this.exclude = exclude;
    }

    static ProjectStep select(List<String> columns) {
        return new ProjectStep(columns, false);
    }

    static ProjectStep exclude(List<String> columns) {
        return new ProjectStep(columns, true);
    }

    @Override
    public List<String> outputColumns(List<String> input, String sourceName) {
        for (String column : columns) {
            QueryStep.requireColumn(input, column, sourceName);
        }
        if (!exclude) {
            return columns;
        }
        List<String> remaining = new ArrayList<>(input);
        remaining.removeAll(columns);
        return remaining;
    }

    @Override
    public Set<String> referencedColumns() {
        // dropped columns need not be read at all
        return exclude ? Set.of() : new LinkedHashSet<>(columns);
    }

    @Override
    public List<String> layoutAfter(List<String> layout, String sourceName) {
        if (!exclude) {
            return outputColumns(layout, sourceName);
        }
        // an excluded column may already be pruned from the layout
        List<String> remaining = new ArrayList<>(layout);
        remaining.removeAll(columns);
        return remaining;
    }

    @Override
    public UnaryOperator<String[]> bind(List<String> layout, String sourceName) {
        List<String> output = layoutAfter(layout, sourceName);
        int[] indexes = new int[output.size()];
        for (int i = 0; i < indexes.length; i++) {
            indexes[i] = layout.indexOf(output.get(i));
        }
        return row -> {
            String[] projected = new String[indexes.length];
            for (int i = 0; i < indexes.length; i++) {
                projected[i] = row[indexes[i]];
            }
            return projected;
        };
    }

    @Override
    public String toString() {
        return (exclude ? "exclude" : "select") + columns;
    }
}
