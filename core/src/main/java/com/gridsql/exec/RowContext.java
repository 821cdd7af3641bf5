package com.gridsql.exec;

import com.gridsql.expression.AggregateExpression;
import com.gridsql.expression.ColumnReference;
import com.gridsql.types.CellValue;

/**
 * What an expression is evaluated against: one row, one group of rows, or a projected
 * output row.
 */
public interface RowContext {

    /**
     * Returns the value of a column.
     *
     * @param ref the column reference
     * @return the value
     */
    CellValue column(ColumnReference ref);

    /**
     * Returns the value of an aggregate.
     *
     * @param aggregate the aggregate
     * @return the value
     * @throws com.gridsql.exception.ValidationException outside a grouped context
     */
    CellValue aggregate(AggregateExpression aggregate);

    /**
     * Returns whether {@code IS NULL} also matches empty strings here.
     *
     * @return true when empty strings count as null
     */
    boolean emptyStringIsNull();
}
