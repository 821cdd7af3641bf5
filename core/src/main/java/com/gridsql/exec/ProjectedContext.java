package com.gridsql.exec;

import com.gridsql.expression.AggregateExpression;
import com.gridsql.expression.ColumnReference;
import com.gridsql.expression.Expression;
import com.gridsql.types.CellValue;

import java.util.List;
import java.util.Map;

/**
 * Context for HAVING, DISTINCT ON and ORDER BY after projection.
 *
 * <p>An unqualified name equal to a projection alias reads the projected value; an
 * aggregate that was projected reads its projected value; everything else falls through
 * to the underlying row or group.
 */
final class ProjectedContext implements RowContext {

    private final Map<String, Integer> aliases;
    private final List<Expression> projected;
    private final List<CellValue> values;
    private final RowContext base;

    ProjectedContext(Map<String, Integer> aliases, List<Expression> projected,
                     List<CellValue> values, RowContext base) {
        this.aliases = aliases;
        this.projected = projected;
        this.values = values;
        this.base = base;
    }

    List<CellValue> values() {
        return values;
    }

    RowContext base() {
        return base;
    }

    @Override
    public CellValue column(ColumnReference ref) {
        if (!ref.isQualified()) {
            Integer index = aliases.get(ref.columnName());
            if (index != null) {
                return values.get(index);
            }
        }
        return base.column(ref);
    }

    @Override
    public CellValue aggregate(AggregateExpression aggregate) {
        int index = projected.indexOf(aggregate);
        if (index >= 0) {
            return values.get(index);
        }
        return base.aggregate(aggregate);
    }

    @Override
    public boolean emptyStringIsNull() {
        return base.emptyStringIsNull();
    }
}
