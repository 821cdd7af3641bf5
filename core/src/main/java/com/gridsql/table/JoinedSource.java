package com.gridsql.table;

import java.util.Objects;

/**
 * The result of joining two tables. Not writable.
 */
public final class JoinedSource implements TableSource {

    private final TableSource left;
    private final TableSource right;

    public JoinedSource(TableSource left, TableSource right) {
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
    }

    public TableSource left() {
        return left;
    }

    public TableSource right() {
        return right;
    }

    @Override
    public String describe() {
        return left.describe() + " JOIN " + right.describe();
    }
}
