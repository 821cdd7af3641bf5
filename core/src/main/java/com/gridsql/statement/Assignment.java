package com.gridsql.statement;

import com.gridsql.expression.Expression;
import java.util.Objects;

/**
 * One {@code column = expression} pair of an UPDATE's SET list. The expression is
 * evaluated against each target row before any assignment is applied.
 */
public final class Assignment {

    private final String column;
    private final Expression value;

    public Assignment(String column, Expression value) {
        this.column = Objects.requireNonNull(column, "column must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public String column() {
        return column;
    }

    public Expression value() {
        return value;
    }

    @Override
    public String toString() {
        return column + " = " + value.toSQL();
    }
}
