package com.gridsql.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The uniform tabular result of a SELECT, {@code {cols, rows}}.
 *
 * <p>Both execution paths, native-dialect bridge and direct evaluation, produce this
 * same type, so callers cannot tell which one ran.
 */
public final class QueryResult {

    private final List<ResultColumn> columns;
    private final List<ResultRow> rows;

    public QueryResult(List<ResultColumn> columns, List<ResultRow> rows) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public List<ResultColumn> columns() {
        return columns;
    }

    public List<ResultRow> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * Returns the index of the column with the given id.
     *
     * @param id the column id
     * @return the index, or -1
     */
    public int columnIndex(String id) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the values of one column, top to bottom.
     *
     * @param id the column id
     * @return the values
     * @throws IllegalArgumentException if no such column exists
     */
    public List<Object> columnValues(String id) {
        int index = columnIndex(id);
        if (index < 0) {
            throw new IllegalArgumentException("No column '" + id + "' in " + columns);
        }
        List<Object> values = new ArrayList<>();
        for (ResultRow row : rows) {
            values.add(row.value(index));
        }
        return values;
    }

    /**
     * Returns all values as a 2-D list.
     *
     * @return the values, row by row
     */
    public List<List<Object>> values() {
        List<List<Object>> values = new ArrayList<>();
        for (ResultRow row : rows) {
            List<Object> line = new ArrayList<>();
            for (ResultCell cell : row.cells()) {
                line.add(cell.value());
            }
            values.add(line);
        }
        return values;
    }

    @Override
    public String toString() {
        return "QueryResult(" + columns + ", " + rows.size() + " rows)";
    }
}
