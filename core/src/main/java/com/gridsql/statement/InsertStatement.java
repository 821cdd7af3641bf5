package com.gridsql.statement;

import com.gridsql.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parsed INSERT.
 *
 * <p>Without a column list each VALUES tuple is positional, matching the target's column
 * order. With {@code (col, col)} each tuple is sparse: named columns are set and the
 * others left empty.
 */
public final class InsertStatement implements Statement {

    private final TableReference target;
    private final List<String> columns;
    private final List<List<Expression>> rows;

    public InsertStatement(TableReference target, List<String> columns, List<List<Expression>> rows) {
        this.target = target;
        this.columns = columns == null ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(columns));
        List<List<Expression>> copy = new ArrayList<>();
        for (List<Expression> row : Objects.requireNonNull(rows, "rows must not be null")) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
        if (this.rows.isEmpty()) {
            throw new IllegalArgumentException("rows must not be empty");
        }
    }

    @Override
    public String operation() {
        return "INSERT";
    }

    @Override
    public TableReference source() {
        return target;
    }

    /**
     * Returns the explicit column list.
     *
     * @return the column names, empty for positional inserts
     */
    public List<String> columns() {
        return columns;
    }

    public boolean isPositional() {
        return columns.isEmpty();
    }

    public List<List<Expression>> rows() {
        return rows;
    }

    @Override
    public String toString() {
        return "INSERT" + (target != null ? " INTO " + target : "") +
            (columns.isEmpty() ? "" : " " + columns) + " VALUES " + rows;
    }
}
