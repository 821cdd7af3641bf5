package com.gridsql.exec;

import com.gridsql.exception.ValidationException;
import com.gridsql.expression.AggregateExpression;
import com.gridsql.expression.ColumnReference;
import com.gridsql.table.Row;
import com.gridsql.table.Table;
import com.gridsql.types.CellValue;

/**
 * Evaluation context for a single row of a table.
 */
public final class TableRowContext implements RowContext {

    private final Table table;
    private final Row row;

    public TableRowContext(Table table, Row row) {
        this.table = table;
        this.row = row;
    }

    public Table table() {
        return table;
    }

    public Row row() {
        return row;
    }

    @Override
    public CellValue column(ColumnReference ref) {
        return row.get(table.resolve(ref));
    }

    @Override
    public CellValue aggregate(AggregateExpression aggregate) {
        throw new ValidationException(
            "Aggregate " + aggregate.toSQL() + " is not allowed here",
            "expression evaluation",
            aggregate.toSQL(),
            "Use aggregates only in the SELECT list, HAVING or ORDER BY");
    }

    @Override
    public boolean emptyStringIsNull() {
        return table.emptyStringIsNull();
    }
}
