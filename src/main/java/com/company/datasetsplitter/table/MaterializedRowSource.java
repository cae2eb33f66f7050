package com.company.datasetsplitter.table;

import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;

/**
 * Row source backed by the memoized evaluation of an upstream query. The upstream query is
 * evaluated at most once, on the first {@link #open(List)}; concurrent cursors then share its rows.
 */
@Slf4j
final class MaterializedRowSource implements RowSource {

    private final TabularQuery upstream;
    private volatile Table table;

    MaterializedRowSource(TabularQuery upstream) {
        this.upstream = upstream;
    }

    @Override
    public String getName() {
        return upstream.getSourceName();
    }

    @Override
    public List<String> columnNames() {
        Table realized = table;
        return realized != null ? realized.getColumns() : upstream.columns();
    }

    @Override
    public RowCursor open(List<String> projection) {
        Table realized = materialize();
        List<String> columns = realized.getColumns();
        Iterator<String[]> rows = realized.getRows().iterator();
        if (projection.equals(columns)) {
            return () -> rows.hasNext() ? rows.next() : null;
        }

        int[] indexes = new int[projection.size()];
        for (int i = 0; i < indexes.length; i++) {
            indexes[i] = QueryStep.requireColumn(columns, projection.get(i), getName());
        }
        return () -> {
            if (!rows.hasNext()) {
                return null;
            }
            String[] row = rows.next();
            String[] projected = new String[indexes.length];
            for (int i = 0; i < indexes.length; i++) {
                projected[i] = row[indexes[i]];
            }
            return projected;
        };
    }

    private Table materialize() {
        Table realized = table;
        if (realized == null) {
            synchronized (this) {
                realized = table;
                if (realized == null) {
                    realized = upstream.collect();
                    table = realized;
                    log.debug("Materialized {} rows x {} columns from {}",
                            realized.getRowCount(), realized.getColumnCount(), getName());
                }
            }
        }
        return realized;
    }
}
