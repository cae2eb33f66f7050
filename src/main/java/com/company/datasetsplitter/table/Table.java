package com.company.datasetsplitter.table;

import java.util.Collections;
import java.util.List;

/**
 * A realized (evaluated) table. Rows are shared with the query that produced them and must be treated as read-only.
 */
public final class Table {

    private final List<String> columns;
    private final List<String[]> rows;

    public Table(List<String> columns, List<String[]> rows) {
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableList(rows);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<String[]> getRows() {
        return rows;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int getRowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public String value(int row, int column) {
        return rows.get(row)[column];
    }
}
