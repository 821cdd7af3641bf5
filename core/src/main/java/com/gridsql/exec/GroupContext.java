package com.gridsql.exec;

import com.gridsql.expression.AggregateExpression;
import com.gridsql.expression.ColumnReference;
import com.gridsql.types.CellValue;
import com.gridsql.types.NullValue;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluation context for one group of rows.
 *
 * <p>Plain column references read the group's first row, which is correct for grouping
 * columns since every row of the group shares their values. Aggregates are computed over
 * all rows of the group and cached.
 */
public final class GroupContext implements RowContext {

    private final AggregationEngine engine;
    private final List<RowContext> rows;
    private final Map<AggregateExpression, CellValue> cache = new HashMap<>();

    GroupContext(AggregationEngine engine, List<RowContext> rows) {
        this.engine = engine;
        this.rows = rows;
    }

    public List<RowContext> rows() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * Returns a context covering only the rows of this group that satisfy a filter;
     * used for PIVOT cells.
     *
     * @param subset the rows
     * @return the narrower group
     */
    GroupContext subset(List<RowContext> subset) {
        return new GroupContext(engine, subset);
    }

    @Override
    public CellValue column(ColumnReference ref) {
        if (rows.isEmpty()) {
            return NullValue.get();
        }
        return rows.get(0).column(ref);
    }

    @Override
    public CellValue aggregate(AggregateExpression aggregate) {
        CellValue value = cache.get(aggregate);
        if (value == null) {
            value = engine.aggregate(aggregate, rows);
            cache.put(aggregate, value);
        }
        return value;
    }

    @Override
    public boolean emptyStringIsNull() {
        return rows.isEmpty() || rows.get(0).emptyStringIsNull();
    }
}
