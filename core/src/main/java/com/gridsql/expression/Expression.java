package com.gridsql.expression;

import java.util.Collections;
import java.util.List;

/**
 * Base interface for all expressions in a parsed statement.
 *
 * <p>Expressions represent computations that produce a cell value, such as:
 * <ul>
 *   <li>Literals ({@code 42}, {@code "active"}, {@code DATE "2024-01-01"})</li>
 *   <li>Column references ({@code Amount}, {@code o.CustomerId})</li>
 *   <li>Arithmetic ({@code Amount * 2})</li>
 *   <li>Comparisons and string operators ({@code Status = "active"}, {@code Name contains "al"})</li>
 *   <li>Scalar functions ({@code lower(Name)}, {@code TODAY()})</li>
 *   <li>Aggregates ({@code SUM(Amount)})</li>
 * </ul>
 *
 * <p>Expressions are used in the projection list, WHERE, GROUP BY, HAVING, ORDER BY,
 * PIVOT, LABEL and FORMAT clauses, join conditions and UPDATE assignments. They are
 * evaluated by {@link com.gridsql.exec.ExpressionEvaluator} and rendered into the native
 * dialect by {@link com.gridsql.bridge.NativeQueryGenerator}.
 *
 * <p>All implementations are {@code final} and immutable.
 */
public interface Expression {

    /**
     * Converts this expression to its canonical statement text.
     *
     * <p>The text is valid in the native query dialect for every expression the dialect
     * supports, and is used as the default column id and label of a projection.
     *
     * @return the statement text
     */
    String toSQL();

    /**
     * Returns the direct sub-expressions of this expression.
     *
     * @return an unmodifiable list of children, empty for leaves
     */
    default List<Expression> children() {
        return Collections.emptyList();
    }
}
