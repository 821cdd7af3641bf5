package com.gridsql.exec;

import com.gridsql.exception.ValidationException;
import com.gridsql.expression.ColumnReference;
import com.gridsql.statement.JoinClause;
import com.gridsql.table.Column;
import com.gridsql.table.ColumnLookup;
import com.gridsql.table.JoinedSource;
import com.gridsql.table.Row;
import com.gridsql.table.Table;
import com.gridsql.types.CellValue;
import com.gridsql.types.NullValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins two tables on an equality of one column from each side.
 *
 * <p>Semantics:
 * <ul>
 *   <li>INNER: one output row per matching pair</li>
 *   <li>LEFT: every left row at least once, right columns Null when unmatched</li>
 *   <li>RIGHT: every right row at least once, left columns Null when unmatched</li>
 * </ul>
 * Null keys match nothing. Output order follows the preserved side (the left side for
 * INNER and LEFT), then the other side's order among matches.
 *
 * <p>The output keeps each column's alias qualifier, so both sides may have a column of
 * the same name; only an unqualified reference to such a name is rejected.
 */
public final class JoinExecutor {

    /**
     * Joins two tables.
     *
     * @param left the left table (possibly already a join)
     * @param right the right table
     * @param clause the join clause
     * @return the joined table
     * @throws ValidationException if the keys cannot be assigned one to each side
     */
    public Table join(Table left, Table right, JoinClause clause) {
        int[] keys = assignKeys(left.columns(), right.columns(), clause);
        int leftKey = keys[0];
        int rightKey = keys[1];

        List<Column> columns = new ArrayList<>(left.columns());
        columns.addAll(right.columns());

        List<List<CellValue>> output = new ArrayList<>();
        if (clause.joinType() == JoinClause.JoinType.RIGHT) {
            for (Row r : right.rows()) {
                boolean matched = false;
                for (Row l : left.rows()) {
                    if (CellValueComparator.valuesEqual(l.get(leftKey), r.get(rightKey))) {
                        output.add(combine(l, left.columns().size(), r, right.columns().size()));
                        matched = true;
                    }
                }
                if (!matched) {
                    output.add(combine(null, left.columns().size(), r, right.columns().size()));
                }
            }
        } else {
            for (Row l : left.rows()) {
                boolean matched = false;
                for (Row r : right.rows()) {
                    if (CellValueComparator.valuesEqual(l.get(leftKey), r.get(rightKey))) {
                        output.add(combine(l, left.columns().size(), r, right.columns().size()));
                        matched = true;
                    }
                }
                if (!matched && clause.joinType() == JoinClause.JoinType.LEFT) {
                    output.add(combine(l, left.columns().size(), null, right.columns().size()));
                }
            }
        }

        List<Row> rows = new ArrayList<>(output.size());
        for (int i = 0; i < output.size(); i++) {
            rows.add(new Row(i, output.get(i)));
        }
        return new Table(columns, rows, new JoinedSource(left.source(), right.source()),
            left.emptyStringIsNull() && right.emptyStringIsNull());
    }

    /**
     * Works out which key of the ON clause belongs to which side.
     *
     * @return {left index, right index}
     */
    static int[] assignKeys(List<Column> left, List<Column> right, JoinClause clause) {
        ColumnReference first = clause.firstKey();
        ColumnReference second = clause.secondKey();
        if (ColumnLookup.canResolve(left, first) && ColumnLookup.canResolve(right, second)) {
            return new int[] {ColumnLookup.resolve(left, first), ColumnLookup.resolve(right, second)};
        }
        if (ColumnLookup.canResolve(left, second) && ColumnLookup.canResolve(right, first)) {
            return new int[] {ColumnLookup.resolve(left, second), ColumnLookup.resolve(right, first)};
        }
        // Surface the most specific error for whichever key does not resolve
        List<Column> all = new ArrayList<>(left);
        all.addAll(right);
        ColumnLookup.resolve(all, first);
        ColumnLookup.resolve(all, second);
        throw new ValidationException(
            "Invalid join condition: " + first.toSQL() + " = " + second.toSQL()
                + " must compare one column from each side",
            "join validation",
            clause.toString(),
            "Qualify each side, for example ON a.Id = b.AId");
    }

    private static List<CellValue> combine(Row l, int leftWidth, Row r, int rightWidth) {
        List<CellValue> values = new ArrayList<>(leftWidth + rightWidth);
        for (int i = 0; i < leftWidth; i++) {
            values.add(l == null ? NullValue.get() : l.get(i));
        }
        for (int i = 0; i < rightWidth; i++) {
            values.add(r == null ? NullValue.get() : r.get(i));
        }
        return values;
    }
}
