package com.gridsql.statement;

import com.gridsql.expression.ColumnReference;
import java.util.Objects;

/**
 * One {@code [LEFT|RIGHT] JOIN target ON a.x = b.y} clause.
 *
 * <p>The two key columns are kept in the order written; which one belongs to which side
 * is decided when the tables are resolved.
 */
public final class JoinClause {

    /**
     * Join types.
     */
    public enum JoinType {
        INNER,
        LEFT,
        RIGHT
    }

    private final JoinType joinType;
    private final TableReference table;
    private final ColumnReference firstKey;
    private final ColumnReference secondKey;

    public JoinClause(JoinType joinType, TableReference table,
                      ColumnReference firstKey, ColumnReference secondKey) {
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.firstKey = Objects.requireNonNull(firstKey, "firstKey must not be null");
        this.secondKey = Objects.requireNonNull(secondKey, "secondKey must not be null");
    }

    public JoinType joinType() {
        return joinType;
    }

    public TableReference table() {
        return table;
    }

    public ColumnReference firstKey() {
        return firstKey;
    }

    public ColumnReference secondKey() {
        return secondKey;
    }

    @Override
    public String toString() {
        return String.format("%s JOIN %s ON %s = %s",
            joinType, table, firstKey.toSQL(), secondKey.toSQL());
    }
}
