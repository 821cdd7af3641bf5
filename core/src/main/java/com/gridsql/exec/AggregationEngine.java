package com.gridsql.exec;

import com.gridsql.expression.AggregateExpression;
import com.gridsql.expression.Expression;
import com.gridsql.types.CellValue;
import com.gridsql.types.NullValue;
import com.gridsql.types.NumberValue;
import com.gridsql.types.StringValue;
import com.gridsql.types.TypeCoercion;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Buckets rows into groups and computes aggregates over them.
 *
 * <p>Without grouping expressions all rows form one group, even when there are none, so
 * {@code SELECT COUNT(*)} over an empty table still returns one row with 0. Groups keep
 * the order in which their first row appeared.
 *
 * <p>Aggregate semantics:
 * <ul>
 *   <li>COUNT(*) counts rows; COUNT(x) counts non-null values of x</li>
 *   <li>SUM and AVG use the values that are numeric, and are Null when there are none</li>
 *   <li>MIN and MAX use the sort order of {@link CellValueComparator}, Null when empty</li>
 *   <li>DISTINCT removes duplicate values before aggregating</li>
 * </ul>
 */
public final class AggregationEngine {

    private final ExpressionEvaluator evaluator;

    public AggregationEngine(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Groups rows by the values of the grouping expressions.
     *
     * @param rows the filtered rows
     * @param groupBy the grouping expressions (may be empty)
     * @return the groups, in order of first appearance
     */
    public List<GroupContext> group(List<? extends RowContext> rows, List<Expression> groupBy) {
        List<GroupContext> groups = new ArrayList<>();
        if (groupBy.isEmpty()) {
            groups.add(new GroupContext(this, new ArrayList<>(rows)));
            return groups;
        }
        Map<List<Object>, List<RowContext>> buckets = new LinkedHashMap<>();
        for (RowContext row : rows) {
            List<Object> key = new ArrayList<>(groupBy.size());
            for (Expression expr : groupBy) {
                key.add(CellValueComparator.groupingKey(evaluator.evaluate(expr, row)));
            }
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        for (List<RowContext> bucket : buckets.values()) {
            groups.add(new GroupContext(this, bucket));
        }
        return groups;
    }

    /**
     * Computes one aggregate over a set of rows.
     *
     * @param aggregate the aggregate
     * @param rows the rows of the group
     * @return the aggregate value
     */
    public CellValue aggregate(AggregateExpression aggregate, List<RowContext> rows) {
        if (aggregate.isCountStar()) {
            return new NumberValue(rows.size());
        }
        List<CellValue> values = new ArrayList<>();
        Set<Object> seen = new HashSet<>();
        for (RowContext row : rows) {
            CellValue value = evaluator.evaluate(aggregate.argument(), row);
            if (isAbsent(value, row)) {
                continue;
            }
            if (aggregate.isDistinct() && !seen.add(CellValueComparator.groupingKey(value))) {
                continue;
            }
            values.add(value);
        }
        switch (aggregate.function()) {
            case COUNT:
                return new NumberValue(values.size());
            case SUM:
            case AVG: {
                double sum = 0;
                int count = 0;
                for (CellValue value : values) {
                    OptionalDouble n = TypeCoercion.asNumber(value);
                    if (n.isPresent()) {
                        sum += n.getAsDouble();
                        count++;
                    }
                }
                if (count == 0) {
                    return NullValue.get();
                }
                return new NumberValue(aggregate.function() == AggregateExpression.Function.SUM ? sum : sum / count);
            }
            case MIN:
            case MAX: {
                CellValue best = null;
                for (CellValue value : values) {
                    if (best == null) {
                        best = value;
                        continue;
                    }
                    int c = CellValueComparator.compareForSort(value, best);
                    if (aggregate.function() == AggregateExpression.Function.MIN ? c < 0 : c > 0) {
                        best = value;
                    }
                }
                return best == null ? NullValue.get() : best;
            }
            default:
                throw new IllegalArgumentException("Unknown aggregate: " + aggregate.function());
        }
    }

    ExpressionEvaluator evaluator() {
        return evaluator;
    }

    private static boolean isAbsent(CellValue value, RowContext row) {
        return value.isNull() || (row.emptyStringIsNull() && value instanceof StringValue s && s.isEmpty());
    }
}
