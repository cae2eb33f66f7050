package com.company.datasetsplitter.table;

import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Replaces the values of one column. Copies the row only when a value actually changes,
 * so rows shared with a materialized source stay untouched.
 */
final class MapValuesStep implements QueryStep {

    private final String column;
    private final UnaryOperator<String> mapper;
    private final String description;

    MapValuesStep(String column, UnaryOperator<String> mapper, String description) {
        this.column = column;
        this.mapper = mapper;
        this.description = description;
    }

    @Override
    public List<String> outputColumns(List<String> input, String sourceName) {
        QueryStep.requireColumn(input, column, sourceName);
        return input;
    }

    @Override
    public Set<String> referencedColumns() {
        return Set.of(column);
    }

    @Override
    public UnaryOperator<String[]> bind(List<String> layout, String sourceName) {
        int index = QueryStep.requireColumn(layout, column, sourceName);
        return row -> {
            String current = row[index];
            String mapped = mapper.apply(current);
            if (mapped == current) {
                return row;
            }
            String[] copy = row.clone();
            copy[index] = mapped;
            return copy;
        };
    }

    @Override
    public String toString() {
        return description + "(" + column + ")";
    }
}
