package com.gridsql.statement;

import com.gridsql.expression.Expression;
import java.util.Objects;

/**
 * One ORDER BY key. Ascending keys place nulls first, descending keys last.
 */
public final class OrderItem {

    /**
     * Sort direction.
     */
    public enum Direction {
        ASCENDING,
        DESCENDING
    }

    private final Expression expression;
    private final Direction direction;

    public OrderItem(Expression expression, Direction direction) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
    }

    public Expression expression() {
        return expression;
    }

    public Direction direction() {
        return direction;
    }

    public boolean isDescending() {
        return direction == Direction.DESCENDING;
    }

    @Override
    public String toString() {
        return expression.toSQL() + (isDescending() ? " desc" : " asc");
    }
}
