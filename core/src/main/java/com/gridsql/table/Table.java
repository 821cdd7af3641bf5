package com.gridsql.table;

import com.gridsql.expression.ColumnReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An in-memory table: ordered columns, ordered rows, and where it came from.
 *
 * <p>Tables are built per statement and discarded afterwards.
 */
public final class Table {

    private final List<Column> columns;
    private final List<Row> rows;
    private final TableSource source;
    private final boolean emptyStringIsNull;
    private final Map<ColumnReference, Integer> resolved = new HashMap<>();

    /**
     * Creates a table.
     *
     * @param columns the columns
     * @param rows the rows
     * @param source where the rows came from
     * @param emptyStringIsNull whether {@code IS NULL} also matches empty strings
     */
    public Table(List<Column> columns, List<Row> rows, TableSource source, boolean emptyStringIsNull) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.emptyStringIsNull = emptyStringIsNull;
    }

    public List<Column> columns() {
        return columns;
    }

    public List<Row> rows() {
        return rows;
    }

    public TableSource source() {
        return source;
    }

    public boolean emptyStringIsNull() {
        return emptyStringIsNull;
    }

    public boolean isJoined() {
        return source instanceof JoinedSource;
    }

    /**
     * Resolves a column reference to its index, caching the answer.
     *
     * @param ref the reference
     * @return the column index
     * @throws com.gridsql.exception.ValidationException if missing or ambiguous
     */
    public int resolve(ColumnReference ref) {
        Integer index = resolved.get(ref);
        if (index == null) {
            index = ColumnLookup.resolve(columns, ref);
            resolved.put(ref, index);
        }
        return index;
    }

    public int rowCount() {
        return rows.size();
    }

    @Override
    public String toString() {
        return String.format("Table(%s, %d columns, %d rows)", source.describe(), columns.size(), rows.size());
    }
}
