package com.company.datasetsplitter.table;

import com.company.datasetsplitter.exception.SplitterException;
import com.company.datasetsplitter.exception.UnreadableSourceException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Deferred, composable description of a tabular transformation over a {@link RowSource}.
 *
 * <p>Instances are immutable: every transformation returns a new query sharing the same source.
 * Nothing is read until {@link #scan(Consumer)} or {@link #collect()} is called; {@link #columns()} only
 * reads the declared column names. At evaluation time the source is asked for the columns the query needs
 * and nothing more, so a columnar source can skip whole column chunks.
 */
public final class TabularQuery {

    private final RowSource source;
    private final List<QueryStep> steps;

    private TabularQuery(RowSource source, List<QueryStep> steps) {
        this.source = source;
        this.steps = steps;
    }

    public static TabularQuery of(RowSource source) {
        return new TabularQuery(Objects.requireNonNull(source, "source"), List.of());
    }

    public String getSourceName() {
        return source.getName();
    }

    /**
     * Declared output column names. Reads the source header (or footer), never its rows.
     */
    public List<String> columns() {
        List<String> columns = source.columnNames();
        for (QueryStep step : steps) {
            columns = step.outputColumns(columns, source.getName());
        }
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns().contains(column);
    }

    public TabularQuery filterNotNull(String column) {
        return with(new FilterStep(column, Objects::nonNull, "is not null"));
    }

    public TabularQuery filterEquals(String column, String value) {
        Objects.requireNonNull(value, "value");
        return with(new FilterStep(column, value::equals, "== '" + value + "'"));
    }

    public TabularQuery fillNull(String column, String value) {
        Objects.requireNonNull(value, "value");
        return with(new MapValuesStep(column, current -> current == null ? value : current, "fillNull"));
    }

    public TabularQuery mapValues(String column, UnaryOperator<String> mapper) {
        return with(new MapValuesStep(column, mapper, "map"));
    }

    public TabularQuery select(String... columns) {
        return with(ProjectStep.select(Arrays.asList(columns)));
    }

    public TabularQuery exclude(String... columns) {
        return with(ProjectStep.exclude(Arrays.asList(columns)));
    }

    /**
     * Returns a query over the memoized result of this one. The first evaluation of the returned query
     * (or of anything derived from it) reads the source once; later evaluations run from memory.
     */
    public TabularQuery cache() {
        return of(new MaterializedRowSource(this));
    }

    /**
     * Evaluates the query, streaming each surviving row to {@code handler}.
     */
    public void scan(Consumer<String[]> handler) {
        String name = source.getName();
        List<String> sourceColumns = source.columnNames();
        List<String> outputColumns = sourceColumns;
        for (QueryStep step : steps) {
            outputColumns = step.outputColumns(outputColumns, name);
        }

        List<String> projection = requiredColumns(sourceColumns, outputColumns);
        List<String> layout = projection;
        List<UnaryOperator<String[]>> transforms = new ArrayList<>(steps.size());
        for (QueryStep step : steps) {
            transforms.add(step.bind(layout, name));
            layout = step.layoutAfter(layout, name);
        }

        try (RowCursor cursor = source.open(projection)) {
            String[] row;
            while ((row = cursor.next()) != null) {
                for (UnaryOperator<String[]> transform : transforms) {
                    row = transform.apply(row);
                    if (row == null) {
                        break;
                    }
                }
                if (row != null) {
                    handler.accept(row);
                }
            }
        } catch (SplitterException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new UnreadableSourceException("Failed to read " + name + ": " + e.getMessage(), name, e);
        }
    }

    /**
     * Evaluates the query into a realized table.
     */
    public Table collect() {
        List<String[]> rows = new ArrayList<>();
        scan(rows::add);
        return new Table(columns(), rows);
    }

    private TabularQuery with(QueryStep step) {
        List<QueryStep> next = new ArrayList<>(steps.size() + 1);
        next.addAll(steps);
        next.add(step);
        return new TabularQuery(source, Collections.unmodifiableList(next));
    }

    /**
     * Source columns the steps reference plus the ones that survive to the output, in source order.
     */
    private List<String> requiredColumns(List<String> sourceColumns, List<String> outputColumns) {
        Set<String> required = new LinkedHashSet<>(outputColumns);
        for (QueryStep step : steps) {
            required.addAll(step.referencedColumns());
        }
        return sourceColumns.stream()
                .filter(required::contains)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "TabularQuery{source=" + source.getName() + ", steps=" + steps + "}";
    }
}
