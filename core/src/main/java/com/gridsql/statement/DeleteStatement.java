package com.gridsql.statement;

import com.gridsql.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed {@code DELETE [FROM target] WHERE ... [ORDER BY ...] [LIMIT n]}.
 */
public final class DeleteStatement implements Statement, RowTargetingStatement {

    private final TableReference target;
    private final Expression where;
    private final List<OrderItem> orderBy;
    private final Integer limit;

    public DeleteStatement(TableReference target, Expression where, List<OrderItem> orderBy, Integer limit) {
        this.target = target;
        this.where = where;
        this.orderBy = orderBy == null ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(orderBy));
        this.limit = limit;
    }

    @Override
    public String operation() {
        return "DELETE";
    }

    @Override
    public TableReference source() {
        return target;
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
        return "DELETE" + (target != null ? " FROM " + target : "") +
            (where != null ? " WHERE " + where.toSQL() : "") +
            (orderBy.isEmpty() ? "" : " ORDER BY " + orderBy) +
            (limit != null ? " LIMIT " + limit : "");
    }
}
