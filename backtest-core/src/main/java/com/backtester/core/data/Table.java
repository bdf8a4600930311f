package com.backtester.core.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Untyped row-oriented table with a fixed, ordered set of named columns.
 * Rows are addressed by insertion index. Cells default to {@code null}.
 *
 * Not thread-safe.
 */
public final class Table {
    private final List<String> columns;
    private final Map<String, Integer> columnIndex;
    private final List<Object[]> rows;

    public Table(List<String> columns) {
        this.columns = new ArrayList<>();
        this.columnIndex = new HashMap<>();
        this.rows = new ArrayList<>();
        for (String column : columns) {
            if (column == null || column.isBlank()) {
                throw new IllegalArgumentException("Column name cannot be empty");
            }
            if (columnIndex.putIfAbsent(column, this.columns.size()) != null) {
                throw new IllegalArgumentException("Duplicate column: " + column);
            }
            this.columns.add(column);
        }
    }

    /**
     * Append a column; existing rows get {@code defaultValue} in it.
     */
    public void addColumn(String name, Object defaultValue) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be empty");
        }
        if (columnIndex.containsKey(name)) {
            throw new IllegalArgumentException("Column " + name + " already exists");
        }
        columnIndex.put(name, columns.size());
        columns.add(name);
        for (int i = 0; i < rows.size(); i++) {
            Object[] old = rows.get(i);
            Object[] widened = new Object[columns.size()];
            System.arraycopy(old, 0, widened, 0, old.length);
            widened[columns.size() - 1] = defaultValue;
            rows.set(i, widened);
        }
    }

    /** Appends an empty row and returns its index. */
    public int newRow() {
        rows.add(new Object[columns.size()]);
        return rows.size() - 1;
    }

    /**
     * Appends a row populated from {@code values}. Fails without adding anything if a key
     * is not a known column.
     */
    public int addRow(Map<String, ?> values) {
        requireKnownColumns(values);
        int index = newRow();
        setRow(index, values);
        return index;
    }

    public void setRow(int index, Map<String, ?> values) {
        requireRow(index);
        requireKnownColumns(values);
        Object[] row = rows.get(index);
        values.forEach((column, value) -> row[columnIndex.get(column)] = value);
    }

    /** Row as a column-ordered map. Empty if the index is out of range. */
    public Optional<Map<String, Object>> getRow(int index) {
        if (index < 0 || index >= rows.size()) {
            return Optional.empty();
        }
        Object[] row = rows.get(index);
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            result.put(columns.get(i), row[i]);
        }
        return Optional.of(result);
    }

    public Optional<Object> get(int index, String column) {
        Integer col = columnIndex.get(column);
        if (col == null || index < 0 || index >= rows.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(index)[col]);
    }

    public void set(int index, String column, Object value) {
        Integer col = columnIndex.get(column);
        if (col == null) {
            throw new IllegalArgumentException("Column " + column + " does not exist");
        }
        requireRow(index);
        rows.get(index)[col] = value;
    }

    public List<Object> getColumnValues(String column) {
        Integer col = columnIndex.get(column);
        if (col == null) {
            throw new IllegalArgumentException("Column " + column + " does not exist");
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            values.add(row[col]);
        }
        return values;
    }

    /**
     * Copy of the first {@code n} rows. Non-positive {@code n} means 5.
     */
    public Table head(int n) {
        int limit = n <= 0 ? 5 : Math.min(n, rows.size());
        Table copy = new Table(columns);
        for (int i = 0; i < limit; i++) {
            copy.rows.add(rows.get(i).clone());
        }
        return copy;
    }

    public List<String> columns() {
        return Collections.unmodifiableList(columns);
    }

    public boolean hasColumn(String column) {
        return columnIndex.containsKey(column);
    }

    public int numRows() {
        return rows.size();
    }

    public int numCols() {
        return columns.size();
    }

    private void requireRow(int index) {
        if (index < 0 || index >= rows.size()) {
            throw new IndexOutOfBoundsException("Row " + index + " does not exist");
        }
    }

    private void requireKnownColumns(Map<String, ?> values) {
        for (String column : values.keySet()) {
            if (!columnIndex.containsKey(column)) {
                throw new IllegalArgumentException("Column " + column + " does not exist");
            }
        }
    }
}
