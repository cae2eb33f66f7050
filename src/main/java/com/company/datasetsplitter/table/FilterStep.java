package com.company.datasetsplitter.table;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

final class FilterStep implements QueryStep {

    private final String column;
    private final Predicate<String> predicate;
    private final String description;

    FilterStep(String column, Predicate<String> predicate, String description) {
        this.column = column;
        this.predicate = predicate;
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
        return row -> predicate.test(row[index]) ? row : null;
    }

    @Override
    public String toString() {
        return "filter(" + column + " " + description + ")";
    }
}
