package com.gridsql.statement;

import com.gridsql.expression.Expression;
import java.util.List;

/**
 * A mutation that picks its target rows with WHERE, then optional ORDER BY and LIMIT.
 */
public interface RowTargetingStatement {

    Expression where();

    List<OrderItem> orderBy();

    /**
     * Returns the maximum number of rows to mutate.
     *
     * @return the limit, or null for all matches
     */
    Integer limit();
}
