package com.gridsql.statement;

import com.gridsql.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parsed {@code UPDATE [target] SET ... [FROM target] WHERE ... [ORDER BY ...] [LIMIT n]}.
 *
 * <p>A missing WHERE is representable here and rejected by validation, so the error
 * names the missing clause instead of a syntax position.
 */
public final class UpdateStatement implements Statement, RowTargetingStatement {

    private final TableReference target;
    private final List<Assignment> assignments;
    private final Expression where;
    private final List<OrderItem> orderBy;
    private final Integer limit;

    public UpdateStatement(TableReference target, List<Assignment> assignments, Expression where,
                           List<OrderItem> orderBy, Integer limit) {
        this.target = target;
        this.assignments = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(assignments, "assignments must not be null")));
        this.where = where;
        this.orderBy = orderBy == null ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(orderBy));
        this.limit = limit;
        if (this.assignments.isEmpty()) {
            throw new IllegalArgumentException("assignments must not be empty");
        }
    }

    @Override
    public String operation() {
        return "UPDATE";
    }

    @Override
    public TableReference source() {
        return target;
    }

    public List<Assignment> assignments() {
        return assignments;
    }

    @Override
    public Expression where() {
        return where;
    }

    @Override
    public List<OrderItem> orderBy() {
        return orderBy;
    }

    @Override
    public Integer limit() {
        return limit;
    }

    @Override
    public String toString() {
        return "UPDATE " + (target != null ? target + " " : "") + "SET " + assignments +
            (where != null ? " WHERE " + where.toSQL() : "") +
            (orderBy.isEmpty() ? "" : " ORDER BY " + orderBy) +
            (limit != null ? " LIMIT " + limit : "");
    }
}
